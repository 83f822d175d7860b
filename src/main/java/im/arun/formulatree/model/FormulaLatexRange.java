package im.arun.formulatree.model;

/**
 * A piece of editor text: either plain or decorated with styling hints.
 */
public interface FormulaLatexRange {

    /** Number of characters this range spans in the editor text. */
    int length();

    /** The text this range spans. */
    String text();
}
