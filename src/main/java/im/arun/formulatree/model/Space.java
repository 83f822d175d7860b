package im.arun.formulatree.model;

import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Explicit spacing such as {@code \,} or {@code \quad}. Never wrapped with an id.
 */
@Getter
public class Space extends AugmentedFormulaNode {
    private static final String TEXT_SPACE = " ";
    private static final String CONTROL_SPACE = "\\ ";

    private final String text;

    public Space(String id, String text) {
        super(id);
        this.text = text;
    }

    @Override
    public NodeType getType() {
        return NodeType.SPACE;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return List.of();
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        String latex = latex();
        return new LatexRange(latex, Map.of(getId(), new IdRange(offset, offset + latex.length())));
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        return List.of(new UnstyledRange(latex()));
    }

    // A word space from text mode is ignored once it lands back in math mode, e.g. in
    // the $...$ body of a box, so outside \text it is written as a control space.
    private String latex() {
        if (!TEXT_SPACE.equals(text) || (getParent() != null && getParent().getType() == NodeType.TEXT)) {
            return text;
        }
        return CONTROL_SPACE;
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        return text.equals(((Space) other).text);
    }

    @Override
    protected void attachChildren() {
    }

    @Override
    protected Space copySubtree() {
        return new Space(getId(), text);
    }

    @Override
    public Space withId(String id) {
        return linkedLike(new Space(id, text));
    }
}
