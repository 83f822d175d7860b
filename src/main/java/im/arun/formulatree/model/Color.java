package im.arun.formulatree.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code \textcolor{color}{...}} around a list of nodes.
 */
@Getter
public class Color extends AugmentedFormulaNode {
    private final String color;
    private final List<AugmentedFormulaNode> body;

    public Color(String id, String color, List<AugmentedFormulaNode> body) {
        super(id);
        this.color = color;
        this.body = List.copyOf(body);
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.COLOR;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return body;
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        List<LatexRange> children = joined(body, mode, " ");
        if (mode == LatexMode.CONTENT_ONLY) {
            return consolidate(children, offset);
        }
        List<LatexRange> elements = new ArrayList<>();
        elements.add(lit("\\textcolor{" + color + "}{"));
        elements.addAll(children);
        elements.add(lit("}"));
        return consolidate(latexWithId(mode, elements), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        return List.of(new StyledRange(getId(), "\\textcolor{" + color + "}{", joinedStyled(body, " "), "}",
                RangeHints.builder().color(color).tooltip("Color: " + color).build()));
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        Color node = (Color) other;
        return color.equals(node.color) && allMatch(body, node.body);
    }

    @Override
    protected void attachChildren() {
        adoptAll(body);
    }

    @Override
    protected Color copySubtree() {
        return new Color(getId(), color, copyAll(body));
    }

    @Override
    public Color withId(String id) {
        return linkedLike(new Color(id, color, body));
    }

    public Color withBody(List<AugmentedFormulaNode> body) {
        return linkedLike(new Color(getId(), color, body));
    }

    public Color withColor(String color) {
        return linkedLike(new Color(getId(), color, body));
    }
}
