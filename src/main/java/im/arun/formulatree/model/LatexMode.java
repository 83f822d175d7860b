package im.arun.formulatree.model;

/**
 * Serialization modes for {@link AugmentedFormulaNode#toLatex(LatexMode, int)}.
 */
public enum LatexMode {
    /** Wraps every node in {@code \cssId{id}{...}} for the renderer. */
    RENDER,
    /** Plain LaTeX, used by the code editor and for structural equality. */
    NO_ID,
    /** Plain LaTeX without the decorative markup of wrapper nodes. */
    CONTENT_ONLY
}
