package im.arun.formulatree.parse;

/**
 * Math-mode tokenizer with one token of lookahead. Whitespace and comments are
 * skipped; text-mode arguments are read raw through {@link #readRawGroup()}.
 */
public class LatexLexer {
    private final String input;
    private int pos;
    private Token peeked;

    public LatexLexer(String input) {
        this.input = input;
        this.pos = 0;
    }

    public String getInput() {
        return input;
    }

    public Token peek() {
        if (peeked == null) {
            peeked = read();
        }
        return peeked;
    }

    public Token next() {
        Token token = peek();
        peeked = null;
        return token;
    }

    /**
     * Position of the next unread character, including a peeked token.
     */
    public int position() {
        return peeked != null ? peeked.getPosition() : pos;
    }

    /**
     * Read a balanced {@code {...}} group verbatim and return its content.
     */
    public String readRawGroup() {
        rewindPeek();
        skipWhitespace();
        int start = pos;
        if (pos >= input.length() || input.charAt(pos) != '{') {
            throw new LatexParseException("Expected '{'", start);
        }
        int depth = 0;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\\' && pos + 1 < input.length()) {
                pos += 2;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    pos++;
                    return input.substring(start + 1, pos - 1);
                }
            }
            pos++;
        }
        throw new LatexParseException("Unbalanced braces", start);
    }

    private void rewindPeek() {
        if (peeked != null) {
            pos = peeked.getPosition();
            peeked = null;
        }
    }

    private void skipWhitespace() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '%') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    private Token read() {
        skipWhitespace();
        int start = pos;
        if (pos >= input.length()) {
            return new Token(TokenType.EOF, "", start);
        }
        char c = input.charAt(pos++);
        switch (c) {
            case '\\':
                return readCommand(start);
            case '{':
                return new Token(TokenType.LBRACE, "{", start);
            case '}':
                return new Token(TokenType.RBRACE, "}", start);
            case '^':
                return new Token(TokenType.CARET, "^", start);
            case '_':
                return new Token(TokenType.UNDERSCORE, "_", start);
            case '\'':
                return new Token(TokenType.PRIME, "'", start);
            case '&':
                return new Token(TokenType.AMPERSAND, "&", start);
            default:
                return new Token(TokenType.CHAR, String.valueOf(c), start);
        }
    }

    private Token readCommand(int start) {
        if (pos >= input.length()) {
            throw new LatexParseException("Incomplete command", start);
        }
        char first = input.charAt(pos);
        if (!isCommandLetter(first)) {
            pos++;
            // "\ " is a control space; any other whitespace after "\" collapses to it
            String symbol = Character.isWhitespace(first) ? " " : String.valueOf(first);
            return new Token(TokenType.COMMAND, "\\" + symbol, start);
        }
        while (pos < input.length() && isCommandLetter(input.charAt(pos))) {
            pos++;
        }
        return new Token(TokenType.COMMAND, input.substring(start, pos), start);
    }

    private static boolean isCommandLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '@';
    }
}
