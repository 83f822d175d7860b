package im.arun.formulatree.parse;

public enum TokenType {
    /** {@code \name} or a control symbol such as {@code \,}. */
    COMMAND,
    CHAR,
    LBRACE,
    RBRACE,
    CARET,
    UNDERSCORE,
    PRIME,
    AMPERSAND,
    EOF
}
