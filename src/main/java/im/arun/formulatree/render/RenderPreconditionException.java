package im.arun.formulatree.render;

import im.arun.formulatree.FormulaException;

/**
 * Raised when a formula is rendered before a renderer is available.
 */
public class RenderPreconditionException extends FormulaException {

    public RenderPreconditionException(String message) {
        super(message);
    }
}
