package im.arun.formulatree.tree;

import im.arun.formulatree.model.Accent;
import im.arun.formulatree.model.Aligned;
import im.arun.formulatree.model.AugmentedFormula;
import im.arun.formulatree.model.AugmentedFormulaNode;
import im.arun.formulatree.model.Box;
import im.arun.formulatree.model.Brace;
import im.arun.formulatree.model.Color;
import im.arun.formulatree.model.Delimited;
import im.arun.formulatree.model.Fraction;
import im.arun.formulatree.model.Group;
import im.arun.formulatree.model.MathSymbol;
import im.arun.formulatree.model.Matrix;
import im.arun.formulatree.model.MatrixType;
import im.arun.formulatree.model.Op;
import im.arun.formulatree.model.Root;
import im.arun.formulatree.model.Script;
import im.arun.formulatree.model.Space;
import im.arun.formulatree.model.Strikethrough;
import im.arun.formulatree.model.Text;
import im.arun.formulatree.parse.LatexParser;
import im.arun.formulatree.parse.ParseNode;
import im.arun.formulatree.parse.ParseNodeType;
import im.arun.formulatree.variable.VariableGrouper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds augmented formula trees from raw parse trees.
 *
 * <p>Ids are structural paths: top-level nodes are numbered {@code 0, 1, ...} and
 * children extend their parent's id with {@code .base}, {@code .sub}, {@code .sup},
 * {@code .numer}, {@code .denom}, {@code .body}, {@code .index}, {@code .<i>} or
 * {@code .<row>.<col>}.</p>
 */
public class FormulaTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(FormulaTreeBuilder.class);

    private final LatexParser parser;
    private final VariableGrouper grouper;

    public FormulaTreeBuilder(LatexParser parser, VariableGrouper grouper) {
        this.parser = parser;
        this.grouper = grouper;
    }

    public FormulaTreeBuilder() {
        this(new LatexParser(), new VariableGrouper());
    }

    /**
     * Parse and build a formula.
     *
     * @throws im.arun.formulatree.parse.LatexParseException if the source does not parse
     * @throws TreeBuildException if the source uses a construct with no formula node or
     *                            gives two nodes the same id
     */
    public AugmentedFormula deriveTree(String latex) {
        List<ParseNode> parseTrees = parser.parse(latex);
        List<AugmentedFormulaNode> children = new ArrayList<>(parseTrees.size());
        for (int i = 0; i < parseTrees.size(); i++) {
            children.add(build(parseTrees.get(i), String.valueOf(i)));
        }
        AugmentedFormula formula = new AugmentedFormula(children);
        requireUniqueIds(formula);
        logger.debug("Built formula with {} nodes from '{}'", formula.getIdIndex().size(), latex);
        return formula;
    }

    // Structural ids never collide; an \htmlId can repeat another id.
    private static void requireUniqueIds(AugmentedFormula formula) {
        Set<String> seen = new HashSet<>();
        for (AugmentedFormulaNode node : formula.allNodes()) {
            if (!seen.add(node.getId())) {
                throw new TreeBuildException("Duplicate node id: " + node.getId());
            }
        }
    }

    /**
     * Build a formula and group the given variable patterns in it.
     *
     * @param variableTrees   pattern formulas, e.g. the tree of {@code x_i}
     * @param originalSymbols declared symbol text per pattern; may be null or shorter
     *                        than the pattern list
     */
    public AugmentedFormula deriveTreeWithVars(String latex, List<AugmentedFormula> variableTrees,
                                               List<String> originalSymbols) {
        AugmentedFormula formula = deriveTree(latex);
        if (variableTrees == null || variableTrees.isEmpty()) {
            return formula;
        }
        return grouper.groupVariablesByTrees(formula, variableTrees, originalSymbols);
    }

    /**
     * Convert one parse node and its descendants.
     *
     * @param node parse node
     * @param id   structural id of the resulting node
     */
    public AugmentedFormulaNode build(ParseNode node, String id) {
        if (node == null) {
            throw new TreeBuildException();
        }
        switch (node.getType()) {
            case HTML: {
                List<ParseNode> body = node.getBody();
                if (body == null || body.size() != 1) {
                    throw new TreeBuildException("htmlId should only have a single child");
                }
                return build(body.get(0), node.getHtmlId());
            }
            case SUPSUB: {
                AugmentedFormulaNode base = build(node.getBase(), id + ".base");
                AugmentedFormulaNode sub = node.getSub() != null ? build(node.getSub(), id + ".sub") : null;
                AugmentedFormulaNode sup = node.getSup() != null ? build(node.getSup(), id + ".sup") : null;
                return new Script(id, base, sub, sup);
            }
            case GENFRAC:
                return new Fraction(id, build(node.getNumer(), id + ".numer"), build(node.getDenom(), id + ".denom"));
            case ATOM:
            case MATHORD:
            case TEXTORD:
                return new MathSymbol(id, publicCommand(node.getText()));
            case COLOR:
                return new Color(id, node.getColor(), buildList(node.getBody(), id));
            case STYLING:
            case ORDGROUP: {
                List<ParseNode> body = node.getBody();
                if (body.size() == 1 && body.get(0).getType() != ParseNodeType.COLOR) {
                    return build(body.get(0), id);
                }
                return new Group(id, buildList(body, id));
            }
            case ENCLOSE:
                return buildEnclose(node, id);
            case HORIZ_BRACE:
                return new Brace(id, node.isOver(), build(node.getBase(), id + ".base"));
            case TEXT:
                return new Text(id, buildList(node.getBody(), id));
            case SPACING:
                return new Space(id, node.getText());
            case ARRAY:
                return new Aligned(id, buildGrid(node.getRows(), id));
            case LEFTRIGHT:
                return buildLeftRight(node, id);
            case OP:
                return new Op(id, node.getText(), node.isLimits());
            case SQRT: {
                AugmentedFormulaNode body = build(node.getBase(), id + ".body");
                AugmentedFormulaNode index = node.getIndex() != null ? build(node.getIndex(), id + ".index") : null;
                return new Root(id, body, index);
            }
            case HTMLMATHML:
                if (node.getHtml() != null && !node.getHtml().isEmpty()) {
                    return build(node.getHtml().get(0), id + ".html");
                }
                break;
            case MCLASS:
                if (node.getBody() != null && !node.getBody().isEmpty()) {
                    if (node.getBody().size() == 1) {
                        return build(node.getBody().get(0), id);
                    }
                    return new Group(id, buildList(node.getBody(), id));
                }
                break;
            case LAP:
                if (node.getBase() != null) {
                    return build(node.getBase(), id + ".body");
                }
                break;
            case ACCENT:
                return new Accent(id, node.getLabel(), build(node.getBase(), id + ".base"));
            default:
                break;
        }
        logger.debug("No formula node for parse node {} at position {}", node.getType(), node.getPosition());
        throw new TreeBuildException();
    }

    private AugmentedFormulaNode buildEnclose(ParseNode node, String id) {
        String label = node.getLabel();
        if ("\\cancel".equals(label)) {
            return new Strikethrough(id, build(node.getBase(), id + ".body"));
        }
        if ("\\fcolorbox".equals(label)) {
            return new Box(id, node.getBorderColor(), node.getBackgroundColor(), build(node.getBase(), id + ".body"));
        }
        throw new TreeBuildException("Unsupported enclose type: " + label);
    }

    private AugmentedFormulaNode buildLeftRight(ParseNode node, String id) {
        List<AugmentedFormulaNode> body = buildList(node.getBody(), id);
        MatrixType matrixType = MatrixType.fromDelimiters(node.getLeft(), node.getRight());
        if (matrixType != null && body.size() == 1 && body.get(0) instanceof Aligned) {
            // Cells keep the ids they were built with under the array
            return new Matrix(id, matrixType, ((Aligned) body.get(0)).getBody());
        }
        return new Delimited(id, node.getLeft(), node.getRight(), body);
    }

    private List<AugmentedFormulaNode> buildList(List<ParseNode> nodes, String id) {
        List<AugmentedFormulaNode> children = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            children.add(build(nodes.get(i), id + "." + i));
        }
        return children;
    }

    private List<List<AugmentedFormulaNode>> buildGrid(List<List<ParseNode>> rows, String id) {
        List<List<AugmentedFormulaNode>> grid = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<ParseNode> row = rows.get(r);
            List<AugmentedFormulaNode> cells = new ArrayList<>(row.size());
            for (int c = 0; c < row.size(); c++) {
                cells.add(build(row.get(c), id + "." + r + "." + c));
            }
            grid.add(cells);
        }
        return grid;
    }

    /**
     * Map parser-internal {@code \@name} commands to their public spelling.
     */
    static String publicCommand(String text) {
        if (!text.startsWith("\\@")) {
            return text;
        }
        switch (text) {
            case "\\@not":
                return "\\not";
            default:
                return "\\" + text.substring(2);
        }
    }
}
