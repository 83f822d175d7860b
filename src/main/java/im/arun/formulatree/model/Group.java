package im.arun.formulatree.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A braced list of nodes.
 */
@Getter
public class Group extends AugmentedFormulaNode {
    // Parents that already delimit their operand, so plain output drops the braces.
    private static final Set<NodeType> SELF_DELIMITING_PARENTS =
            EnumSet.of(NodeType.ARRAY, NodeType.MATRIX, NodeType.ROOT, NodeType.BRACE, NodeType.FRACTION);

    private final List<AugmentedFormulaNode> body;

    public Group(String id, List<AugmentedFormulaNode> body) {
        super(id);
        this.body = List.copyOf(body);
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.GROUP;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return body;
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        List<LatexRange> children = joined(body, mode, " ");
        if (mode != LatexMode.RENDER && !needsBraces()) {
            return consolidate(children, offset);
        }
        List<LatexRange> elements = new ArrayList<>();
        elements.add(lit("{"));
        elements.addAll(children);
        elements.add(lit("}"));
        return consolidate(latexWithId(mode, elements), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        List<FormulaLatexRange> ranges = new ArrayList<>();
        boolean braced = needsBraces();
        if (braced) {
            ranges.add(new UnstyledRange("{"));
        }
        ranges.addAll(joinedStyled(body, " "));
        if (braced) {
            ranges.add(new UnstyledRange("}"));
        }
        return ranges;
    }

    // An empty group still needs its braces at top level, where nothing else marks it.
    private boolean needsBraces() {
        if (getParent() == null) {
            return body.isEmpty();
        }
        return !SELF_DELIMITING_PARENTS.contains(getParent().getType());
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        return allMatch(body, ((Group) other).body);
    }

    @Override
    protected void attachChildren() {
        adoptAll(body);
    }

    @Override
    protected Group copySubtree() {
        return new Group(getId(), copyAll(body));
    }

    @Override
    public Group withId(String id) {
        return linkedLike(new Group(id, body));
    }

    public Group withBody(List<AugmentedFormulaNode> body) {
        return linkedLike(new Group(getId(), body));
    }
}
