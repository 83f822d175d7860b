package im.arun.formulatree.model;

import lombok.Getter;

import java.util.List;

@Getter
public class Strikethrough extends AugmentedFormulaNode {
    private final AugmentedFormulaNode body;

    public Strikethrough(String id, AugmentedFormulaNode body) {
        super(id);
        this.body = body;
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.STRIKETHROUGH;
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
        return consolidate(latexWithId(mode, List.of(lit("\\cancel{"), bodyElement, lit("}"))), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        return List.of(new StyledRange(getId(), "\\cancel{", body.toStyledRanges(), "}"));
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        return body.matches(((Strikethrough) other).body);
    }

    @Override
    protected void attachChildren() {
        adopt(body);
    }

    @Override
    protected Strikethrough copySubtree() {
        return new Strikethrough(getId(), body.deepCopy());
    }

    @Override
    public Strikethrough withId(String id) {
        return linkedLike(new Strikethrough(id, body));
    }

    public Strikethrough withBody(AugmentedFormulaNode body) {
        return linkedLike(new Strikethrough(getId(), body));
    }
}
