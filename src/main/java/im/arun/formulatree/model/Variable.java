package im.arun.formulatree.model;

import lombok.Getter;

import java.util.List;

/**
 * Marks a subtree as one named variable. Has no markup of its own beyond the id
 * wrapper in render mode.
 */
@Getter
public class Variable extends AugmentedFormulaNode {
    static final String HIGHLIGHT_COLOR = "#2563eb";

    private final AugmentedFormulaNode body;
    /** Canonical LaTeX of the variable pattern. */
    private final String variableLatex;
    /** Symbol text the variable was declared with; doubles as its display id. */
    private final String originalSymbol;

    public Variable(String id, AugmentedFormulaNode body, String variableLatex, String originalSymbol) {
        super(id);
        this.body = body;
        this.variableLatex = variableLatex;
        this.originalSymbol = originalSymbol;
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.VARIABLE;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return List.of(body);
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        return consolidate(latexWithId(mode, List.of(body.toLatex(mode, 0))), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        return List.of(new StyledRange(getId(), "", body.toStyledRanges(), "",
                RangeHints.builder().color(HIGHLIGHT_COLOR).tooltip("Variable: " + originalSymbol).build()));
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        return body.matches(((Variable) other).body);
    }

    @Override
    protected void attachChildren() {
        adopt(body);
    }

    @Override
    protected Variable copySubtree() {
        return new Variable(getId(), body.deepCopy(), variableLatex, originalSymbol);
    }

    @Override
    public Variable withId(String id) {
        return linkedLike(new Variable(id, body, variableLatex, originalSymbol));
    }

    public Variable withBody(AugmentedFormulaNode body) {
        return linkedLike(new Variable(getId(), body, variableLatex, originalSymbol));
    }
}
