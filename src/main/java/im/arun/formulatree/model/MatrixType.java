package im.arun.formulatree.model;

/**
 * Bracket style of a matrix environment.
 */
public enum MatrixType {
    MATRIX("matrix", null, null),
    PMATRIX("pmatrix", "(", ")"),
    BMATRIX("bmatrix", "[", "]"),
    VMATRIX("vmatrix", "|", "|"),
    VVMATRIX("Vmatrix", "\\Vert", "\\Vert");

    private final String environment;
    private final String left;
    private final String right;

    MatrixType(String environment, String left, String right) {
        this.environment = environment;
        this.left = left;
        this.right = right;
    }

    public String environment() {
        return environment;
    }

    public String left() {
        return left;
    }

    public String right() {
        return right;
    }

    /**
     * Bracket style for a pair of {@code \left ... \right} delimiters, or null when
     * the pair does not denote a matrix.
     */
    public static MatrixType fromDelimiters(String left, String right) {
        for (MatrixType type : values()) {
            if (type.left != null && type.left.equals(left) && type.right.equals(right)) {
                return type;
            }
        }
        return null;
    }

    public static MatrixType fromEnvironment(String environment) {
        for (MatrixType type : values()) {
            if (type.environment.equals(environment)) {
                return type;
            }
        }
        return null;
    }
}
