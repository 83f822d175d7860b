package im.arun.formulatree.model;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * {@code \fcolorbox{border}{background}{$...$}} around a single node.
 */
@Getter
public class Box extends AugmentedFormulaNode {
    private final String borderColor;
    private final String backgroundColor;
    private final AugmentedFormulaNode body;

    public Box(String id, String borderColor, String backgroundColor, AugmentedFormulaNode body) {
        super(id);
        this.borderColor = borderColor;
        this.backgroundColor = backgroundColor;
        this.body = body;
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.BOX;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return List.of(body);
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        LatexRange bodyElement = body.toLatex(mode, 0);
        if (mode == LatexMode.CONTENT_ONLY) {
            return consolidate(List.of(bodyElement), offset);
        }
        // fcolorbox switches to text mode, so the body goes back into math with $
        return consolidate(latexWithId(mode, List.of(lit(opening()), bodyElement, lit("$}"))), offset);
    }

    private String opening() {
        return "\\fcolorbox{" + borderColor + "}{" + backgroundColor + "}{$";
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        return List.of(new StyledRange(getId(), opening(), body.toStyledRanges(), "$}",
                RangeHints.builder().color(borderColor).tooltip("Box: " + borderColor).build()));
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        Box box = (Box) other;
        return Objects.equals(borderColor, box.borderColor)
                && Objects.equals(backgroundColor, box.backgroundColor)
                && body.matches(box.body);
    }

    @Override
    protected void attachChildren() {
        adopt(body);
    }

    @Override
    protected Box copySubtree() {
        return new Box(getId(), borderColor, backgroundColor, body.deepCopy());
    }

    @Override
    public Box withId(String id) {
        return linkedLike(new Box(id, borderColor, backgroundColor, body));
    }

    public Box withBody(AugmentedFormulaNode body) {
        return linkedLike(new Box(getId(), borderColor, backgroundColor, body));
    }
}
