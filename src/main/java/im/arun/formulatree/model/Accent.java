package im.arun.formulatree.model;

import lombok.Getter;

import java.util.List;

/**
 * An accent command such as {@code \hat} over a single node.
 */
@Getter
public class Accent extends AugmentedFormulaNode {
    private final String label;
    private final AugmentedFormulaNode base;

    public Accent(String id, String label, AugmentedFormulaNode base) {
        super(id);
        this.label = label;
        this.base = base;
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.ACCENT;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return List.of(base);
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        return consolidate(latexWithId(mode, List.of(lit(label + "{"), base.toLatex(mode, 0), lit("}"))), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        return List.of(new StyledRange(getId(), label + "{", base.toStyledRanges(), "}"));
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        Accent accent = (Accent) other;
        return label.equals(accent.label) && base.matches(accent.base);
    }

    @Override
    protected void attachChildren() {
        adopt(base);
    }

    @Override
    protected Accent copySubtree() {
        return new Accent(getId(), label, base.deepCopy());
    }

    @Override
    public Accent withId(String id) {
        return linkedLike(new Accent(id, label, base));
    }

    public Accent withBase(AugmentedFormulaNode base) {
        return linkedLike(new Accent(getId(), label, base));
    }
}
