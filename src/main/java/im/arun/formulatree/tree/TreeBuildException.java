package im.arun.formulatree.tree;

import im.arun.formulatree.FormulaException;

/**
 * A parse node has no corresponding formula node, or a required child is missing.
 */
public class TreeBuildException extends FormulaException {
    public static final String DEFAULT_MESSAGE = "Failed to build formula tree";

    public TreeBuildException() {
        super(DEFAULT_MESSAGE);
    }

    public TreeBuildException(String message) {
        super(message);
    }
}
