package im.arun.formulatree.model;

import lombok.Getter;

import java.util.List;

/**
 * A large operator ({@code \sum}, {@code \int}) or named function ({@code \sin}).
 */
@Getter
public class Op extends AugmentedFormulaNode {
    private final String operator;
    private final boolean limits;

    public Op(String id, String operator, boolean limits) {
        super(id);
        this.operator = operator;
        this.limits = limits;
    }

    @Override
    public NodeType getType() {
        return NodeType.OP;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return List.of();
    }

    private String latex() {
        return limits ? operator + "\\limits" : operator;
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        return consolidate(latexWithId(mode, List.of(lit(latex()))), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        return List.of(new UnstyledRange(latex()));
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        Op op = (Op) other;
        return operator.equals(op.operator) && limits == op.limits;
    }

    @Override
    protected void attachChildren() {
    }

    @Override
    protected Op copySubtree() {
        return new Op(getId(), operator, limits);
    }

    @Override
    public Op withId(String id) {
        return linkedLike(new Op(id, operator, limits));
    }
}
