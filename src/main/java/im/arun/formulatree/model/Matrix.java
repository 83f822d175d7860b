package im.arun.formulatree.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * A bracketed grid written as a {@code pmatrix}-style environment.
 */
@Getter
public class Matrix extends AugmentedFormulaNode {
    private final MatrixType matrixType;
    private final List<List<AugmentedFormulaNode>> body;

    public Matrix(String id, MatrixType matrixType, List<List<AugmentedFormulaNode>> body) {
        super(id);
        this.matrixType = matrixType;
        this.body = copyGrid(body);
        attachChildren();
    }

    @Override
    public NodeType getType() {
        return NodeType.MATRIX;
    }

    @Override
    public List<AugmentedFormulaNode> getChildren() {
        return flatten(body);
    }

    public int rowCount() {
        return body.size();
    }

    public int columnCount() {
        return body.stream().mapToInt(List::size).max().orElse(0);
    }

    private String opening() {
        return "\\begin{" + matrixType.environment() + "}";
    }

    private String closing() {
        return "\\end{" + matrixType.environment() + "}";
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
        elements.add(lit(closing()));
        return consolidate(latexWithId(mode, elements), offset);
    }

    @Override
    public List<FormulaLatexRange> toStyledRanges() {
        return List.of(new StyledRange(getId(), opening(), gridStyled(body), closing(),
                RangeHints.builder().tooltip("Matrix: " + matrixType.environment()).build()));
    }

    @Override
    protected boolean matchesSameType(AugmentedFormulaNode other) {
        Matrix matrix = (Matrix) other;
        return matrixType == matrix.matrixType && gridsMatch(body, matrix.body);
    }

    @Override
    protected void attachChildren() {
        adoptGrid(body);
    }

    @Override
    protected Matrix copySubtree() {
        return new Matrix(getId(), matrixType, copyCells(body));
    }

    @Override
    public Matrix withId(String id) {
        return linkedLike(new Matrix(id, matrixType, body));
    }

    public Matrix withBody(List<List<AugmentedFormulaNode>> body) {
        return linkedLike(new Matrix(getId(), matrixType, body));
    }
}
