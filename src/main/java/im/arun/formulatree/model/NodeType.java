package im.arun.formulatree.model;

/**
 * Discriminator of the closed set of node variants.
 */
public enum NodeType {
    SCRIPT("script"),
    FRACTION("frac"),
    SYMBOL("symbol"),
    COLOR("color"),
    GROUP("group"),
    BOX("box"),
    BRACE("brace"),
    TEXT("text"),
    SPACE("space"),
    ARRAY("array"),
    ROOT("root"),
    ACCENT("accent"),
    OP("op"),
    STRIKETHROUGH("strikethrough"),
    VARIABLE("variable"),
    MATRIX("matrix"),
    DELIMITED("delimited");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    /** Short lowercase name used in exports and log lines. */
    public String label() {
        return label;
    }
}
