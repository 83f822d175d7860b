package im.arun.formulatree.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code \left ... \right} around a list of nodes.
 */
@Getter
public class Delimited extends AugmentedFormulaNode {
    private final String left;
    private final String right;
    private final List<AugmentedFormulaNode> body;

    public Delimited(String id, String left, String right, List<AugmentedFormulaNode> body) {
        super(id);
        this.left = left;
        this.right = right;
        this.body = List.copyOf(body);
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.DELIMITED;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return body;
    }

    // A control word delimiter such as \langle must not run into the next letter.
    private String opening() {
        boolean controlWord = left.length() > 1 && left.startsWith("\\")
                && Character.isLetter(left.charAt(left.length() - 1));
        return "\\left" + left + (controlWord ? " " : "");
    }

    private String closing() {
        return "\\right" + right;
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        List<LatexRange> children = joined(body, mode, " ");
        if (mode == LatexMode.CONTENT_ONLY) {
            return consolidate(children, offset);
        }
        List<LatexRange> elements = new ArrayList<>();
        elements.add(lit(opening()));
        elements.addAll(children);
        elements.add(lit(closing()));
        return consolidate(latexWithId(mode, elements), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        List<FormulaLatexRange> ranges = new ArrayList<>();
        ranges.add(new UnstyledRange(opening()));
        ranges.addAll(joinedStyled(body, " "));
        ranges.add(new UnstyledRange(closing()));
        return ranges;
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        Delimited delimited = (Delimited) other;
        return left.equals(delimited.left) && right.equals(delimited.right) && allMatch(body, delimited.body);
    }

    @Override
    protected void attachChildren() {
        adoptAll(body);
    }

    @Override
    protected Delimited copySubtree() {
        return new Delimited(getId(), left, right, copyAll(body));
    }

    @Override
    public Delimited withId(String id) {
        return linkedLike(new Delimited(id, left, right, body));
    }

    public Delimited withBody(List<AugmentedFormulaNode> body) {
        return linkedLike(new Delimited(getId(), left, right, body));
    }
}
