package im.arun.formulatree.model;

import lombok.Getter;

import java.util.List;

/**
 * A single LaTeX symbol such as {@code x}, {@code 2}, {@code +} or {@code \alpha}.
 */
@Getter
public class MathSymbol extends AugmentedFormulaNode {
    private final String value;

    public MathSymbol(String id, String value) {
        super(id);
        this.value = value;
    }

    @Override
    public NodeType getType() {
        return NodeType.SYMBOL;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return List.of();
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        return consolidate(latexWithId(mode, List.of(lit(value))), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        return List.of(new UnstyledRange(value));
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        return value.equals(((MathSymbol) other).value);
    }

    @Override
    protected void attachChildren() {
    }

    @Override
    protected MathSymbol copySubtree() {
        return new MathSymbol(getId(), value);
    }

    @Override
    public MathSymbol withId(String id) {
        return linkedLike(new MathSymbol(id, value));
    }

    public MathSymbol withValue(String value) {
        return linkedLike(new MathSymbol(getId(), value));
    }
}
