package im.arun.formulatree.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code \sqrt[index]{body}}; the index is optional.
 */
@Getter
public class Root extends AugmentedFormulaNode {
    private final AugmentedFormulaNode body;
    private final AugmentedFormulaNode index;

    public Root(String id, AugmentedFormulaNode body, AugmentedFormulaNode index) {
        super(id);
        this.body = body;
        this.index = index;
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.ROOT;
    }

    /**
     * The index comes first, as it does in the serialized LaTeX.
     */
    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return index == null ? List.of(body) : List.of(index, body);
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        List<LatexRange> elements = new ArrayList<>();
        elements.add(lit("\\sqrt"));
        if (index != null) {
            elements.add(lit("["));
            elements.add(index.toLatex(mode, 0));
            elements.add(lit("]"));
        }
        elements.add(lit("{"));
        elements.add(body.toLatex(mode, 0));
        elements.add(lit("}"));
        return consolidate(latexWithId(mode, elements), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        List<FormulaLatexRange> ranges = new ArrayList<>();
        if (index != null) {
            ranges.add(new UnstyledRange("\\sqrt["));
            ranges.addAll(index.toStyledRanges());
            ranges.add(new UnstyledRange("]{"));
        } else {
            ranges.add(new UnstyledRange("\\sqrt{"));
        }
        ranges.addAll(body.toStyledRanges());
        ranges.add(new UnstyledRange("}"));
        return ranges;
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        Root root = (Root) other;
        return body.matches(root.body) && optionalMatches(index, root.index);
    }

    @Override
    protected void attachChildren() {
        adopt(body);
        adopt(index);
    }

    @Override
    protected Root copySubtree() {
        return new Root(getId(), body.deepCopy(), copyOf(index));
    }

    @Override
    public Root withId(String id) {
        return linkedLike(new Root(id, body, index));
    }

    public Root withParts(String id, AugmentedFormulaNode body, AugmentedFormulaNode index) {
        return linkedLike(new Root(id, body, index));
    }
}
