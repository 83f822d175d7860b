package im.arun.formulatree.model;

import lombok.Getter;

import java.util.List;

/**
 * A horizontal brace drawn over or under its base. The annotation, if any, is the script
 * attached to this node by its parent.
 */
@Getter
public class Brace extends AugmentedFormulaNode {
    private final boolean over;
    private final AugmentedFormulaNode base;

    public Brace(String id, boolean over, AugmentedFormulaNode base) {
        super(id);
        this.over = over;
        this.base = base;
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.BRACE;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return List.of(base);
    }

    private String command() {
        return over ? "\\overbrace{" : "\\underbrace{";
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        LatexRange baseElement = base.toLatex(mode, 0);
        if (mode == LatexMode.CONTENT_ONLY) {
            return consolidate(List.of(baseElement), offset);
        }
        return consolidate(latexWithId(mode, List.of(lit(command()), baseElement, lit("}"))), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        return List.of(new StyledRange(getId(), command(), base.toStyledRanges(), "}"));
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        Brace brace = (Brace) other;
        return over == brace.over && base.matches(brace.base);
    }

    @Override
    protected void attachChildren() {
        adopt(base);
    }

    @Override
    protected Brace copySubtree() {
        return new Brace(getId(), over, base.deepCopy());
    }

    @Override
    public Brace withId(String id) {
        return linkedLike(new Brace(id, over, base));
    }

    public Brace withBase(AugmentedFormulaNode base) {
        return linkedLike(new Brace(getId(), over, base));
    }
}
