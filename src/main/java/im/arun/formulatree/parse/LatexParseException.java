package im.arun.formulatree.parse;

import im.arun.formulatree.FormulaException;
import lombok.Getter;

/**
 * Malformed LaTeX or a construct the parser does not know.
 */
@Getter
public class LatexParseException extends FormulaException {
    private final int position;

    public LatexParseException(String message, int position) {
        super(String.format("%s at position %d", message, position));
        this.position = position;
    }
}
