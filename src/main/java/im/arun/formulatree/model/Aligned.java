package im.arun.formulatree.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * A grid of cells written as an {@code array} environment. Used for every
 * non-bracketed multi-row environment.
 */
@Getter
public class Aligned extends AugmentedFormulaNode {
    private final List<List<AugmentedFormulaNode>> body;

    public Aligned(String id, List<List<AugmentedFormulaNode>> body) {
        super(id);
        this.body = copyGrid(body);
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.ARRAY;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return flatten(body);
    }

    public int columnCount() {
        return body.stream().mapToInt(List::size).max().orElse(0);
    }

    private String opening() {
        int columns = columnCount();
        return "\\begin{array}{" + (columns == 2 ? "rl" : "l".repeat(Math.max(columns, 1))) + "}\n";
    }

    @Override
    public LatexRange toLatex(LatexMode mode, int offset) {
        List<LatexRange> rows = gridLatex(body, mode);
        if (mode == LatexMode.CONTENT_ONLY) {
            return consolidate(rows, offset);
        }
        List<LatexRange> elements = new ArrayList<>();
        elements.add(lit(opening()));
        elements.addAll(rows);
        elements.add(lit("\n\\end{array}"));
        return consolidate(latexWithId(mode, elements), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        return List.of(new StyledRange(getId(), opening(), gridStyled(body), "\n\\end{array}",
                RangeHints.builder().noMark(true).build()));
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        return gridsMatch(body, ((Aligned) other).body);
    }

    @Override
    protected void attachChildren() {
        adoptGrid(body);
    }

    @Override
    protected Aligned copySubtree() {
        return new Aligned(getId(), copyCells(body));
    }

    @Override
    public Aligned withId(String id) {
        return linkedLike(new Aligned(id, body));
    }

    public Aligned withBody(List<List<AugmentedFormulaNode>> body) {
        return linkedLike(new Aligned(getId(), body));
    }
}
