package im.arun.formulatree.parse;

import lombok.Value;

@Value
public class Token {
    TokenType type;
    String text;
    int position;

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isCommand(String name) {
        return type == TokenType.COMMAND && text.equals(name);
    }

    public boolean isChar(char c) {
        return type == TokenType.CHAR && text.charAt(0) == c;
    }
}
