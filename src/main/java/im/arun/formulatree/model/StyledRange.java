package im.arun.formulatree.model;

import lombok.Value;

import java.util.List;

/**
 * A decorated span: opening markup, nested child ranges, closing markup.
 */
@Value
public class StyledRange implements FormulaLatexRange {
    String id;
    String left;
    List<FormulaLatexRange> children;
    String right;
    RangeHints hints;

    public StyledRange(String id, String left, List<FormulaLatexRange> children, String right,
                       RangeHints hints) {
        this.id = id;
        this.left = left;
        this.children = List.copyOf(children);
        this.right = right;
        this.hints = hints == null ? RangeHints.NONE : hints;
    }

    public StyledRange(String id, String left, List<FormulaLatexRange> children, String right) {
        this(id, left, children, right, RangeHints.NONE);
    }

    @Override
    public int length() {
        int total = left.length() + right.length();
        for (FormulaLatexRange child : children) {
            total += child.length();
        }
        return total;
    }

    @Override
    public String text() {
        StringBuilder sb = new StringBuilder(left);
        children.forEach(child -> sb.append(child.text()));
        return sb.append(right).toString();
    }
}
