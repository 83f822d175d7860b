package im.arun.formulatree.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code \text{...}}. Children are text-mode characters and spaces, always written
 * without id wrappers because the renderer does not accept them in text mode.
 */
@Getter
public class Text extends AugmentedFormulaNode {
    private final List<AugmentedFormulaNode> body;

    public Text(String id, List<AugmentedFormulaNode> body) {
        super(id);
        this.body = List.copyOf(body);
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.TEXT;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return body;
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        List<LatexRange> elements = new ArrayList<>();
        elements.add(lit("\\text{"));
        elements.addAll(joined(body, LatexMode.NO_ID, ""));
        elements.add(lit("}"));
        return consolidate(latexWithId(mode, elements), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        List<FormulaLatexRange> ranges = new ArrayList<>();
        ranges.add(new UnstyledRange("\\text{"));
        ranges.addAll(joinedStyled(body, ""));
        ranges.add(new UnstyledRange("}"));
        return ranges;
    }

    /** The literal text content. */
    public String plainText() {
        StringBuilder sb = new StringBuilder();
        body.forEach(child -> sb.append(child.toLatex(LatexMode.NO_ID)));
        return sb.toString();
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        return allMatch(body, ((Text) other).body);
    }

    @Override
    protected void attachChildren() {
        adoptAll(body);
    }

    @Override
    protected Text copySubtree() {
        return new Text(getId(), copyAll(body));
    }

    @Override
    public Text withId(String id) {
        return linkedLike(new Text(id, body));
    }

    public Text withBody(List<AugmentedFormulaNode> body) {
        return linkedLike(new Text(getId(), body));
    }
}
