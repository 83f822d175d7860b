package im.arun.formulatree.parse;

/**
 * Tags of raw parse nodes.
 */
public enum ParseNodeType {
    MATHORD,
    TEXTORD,
    ATOM,
    OP,
    SUPSUB,
    GENFRAC,
    ORDGROUP,
    STYLING,
    COLOR,
    ENCLOSE,
    HORIZ_BRACE,
    TEXT,
    SPACING,
    ARRAY,
    LEFTRIGHT,
    SQRT,
    HTMLMATHML,
    MCLASS,
    LAP,
    ACCENT,
    HTML,
    FONT,
    OVERLINE,
    CR
}
