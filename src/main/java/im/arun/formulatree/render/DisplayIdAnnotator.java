package im.arun.formulatree.render;

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
import im.arun.formulatree.model.LatexMode;
import im.arun.formulatree.model.MathSymbol;
import im.arun.formulatree.model.Matrix;
import im.arun.formulatree.model.NodeType;
import im.arun.formulatree.model.Op;
import im.arun.formulatree.model.Root;
import im.arun.formulatree.model.Script;
import im.arun.formulatree.model.Strikethrough;
import im.arun.formulatree.model.Text;
import im.arun.formulatree.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Produces the LaTeX handed to the typesetter, with element ids on every variable,
 * symbol and structural element, and records those ids on the tree as display ids.
 *
 * <p>Variables are wrapped as {@code \cssId{<symbol>}{\class{<css class>}{<body>}}}.
 * Symbols get {@code symbol-<n>}; fractions, large operators, matrices and delimited
 * groups get {@code <kind>-<n>} and are reported as expression scopes. The counter
 * restarts on every call, so annotating the same tree twice yields the same ids.</p>
 */
public class DisplayIdAnnotator {
    private static final Logger logger = LoggerFactory.getLogger(DisplayIdAnnotator.class);

    private final String variableCssClass;

    public DisplayIdAnnotator(String variableCssClass) {
        this.variableCssClass = variableCssClass;
    }

    public AnnotationResult annotate(AugmentedFormula formula) {
        Pass pass = new Pass();
        String latex = formula.getChildren().stream()
                .map(pass::process)
                .collect(Collectors.joining(" "));
        logger.debug("Annotated formula with {} display id(s)", pass.counter);
        return new AnnotationResult(latex, formula, pass.scopes);
    }

    /**
     * Original symbols of every variable in the subtree, in document order.
     */
    public static List<String> collectVariableIds(AugmentedFormulaNode node) {
        List<String> ids = new ArrayList<>();
        collectVariableIds(node, ids);
        return ids;
    }

    private static void collectVariableIds(AugmentedFormulaNode node, List<String> ids) {
        if (node instanceof Variable) {
            ids.add(((Variable) node).getOriginalSymbol());
        }
        for (AugmentedFormulaNode child : node.getChildren()) {
            collectVariableIds(child, ids);
        }
    }

    private static String largeOperatorType(Script script) {
        if (script.getBase().getType() != NodeType.OP) {
            return null;
        }
        String operator = ((Op) script.getBase()).getOperator().toLowerCase(Locale.ROOT);
        if (operator.contains("sum")) {
            return "sum";
        }
        if (operator.contains("prod")) {
            return "prod";
        }
        if (operator.contains("int")) {
            return "int";
        }
        return null;
    }

    private final class Pass {
        private final List<ExpressionScope> scopes = new ArrayList<>();
        private int counter;

        private String process(AugmentedFormulaNode node) {
            switch (node.getType()) {
                case VARIABLE: {
                    Variable variable = (Variable) node;
                    variable.setCssId(variable.getOriginalSymbol());
                    return "\\cssId{" + variable.getOriginalSymbol() + "}{\\class{" + variableCssClass + "}{"
                            + variable.getBody().toLatex(LatexMode.NO_ID) + "}}";
                }
                case SYMBOL:
                    return tag(node, "symbol", ((MathSymbol) node).getValue(), false);
                case SCRIPT: {
                    Script script = (Script) node;
                    String base = process(script.getBase());
                    StringBuilder result = new StringBuilder();
                    if (script.getBase().getType() == NodeType.SCRIPT) {
                        result.append('{').append(base).append('}');
                    } else {
                        result.append(base);
                    }
                    if (script.getSub() != null) {
                        result.append("_{").append(process(script.getSub())).append('}');
                    }
                    if (script.getSup() != null) {
                        result.append("^{").append(process(script.getSup())).append('}');
                    }
                    String operatorType = largeOperatorType(script);
                    if (operatorType != null) {
                        return tag(script, operatorType, result.toString(), true);
                    }
                    if (script.getBase().getType() == NodeType.DELIMITED) {
                        return tag(script, "script-delim", result.toString(), true);
                    }
                    return result.toString();
                }
                case FRACTION: {
                    Fraction fraction = (Fraction) node;
                    String latex = "\\frac{" + process(fraction.getNumerator()) + "}{"
                            + process(fraction.getDenominator()) + "}";
                    return tag(fraction, "frac", latex, true);
                }
                case GROUP:
                    return "{" + processAll(((Group) node).getBody(), " ") + "}";
                case COLOR: {
                    Color color = (Color) node;
                    return "\\textcolor{" + color.getColor() + "}{" + processAll(color.getBody(), " ") + "}";
                }
                case BOX: {
                    Box box = (Box) node;
                    return "\\fcolorbox{" + box.getBorderColor() + "}{" + box.getBackgroundColor() + "}{$"
                            + process(box.getBody()) + "$}";
                }
                case BRACE: {
                    Brace brace = (Brace) node;
                    return (brace.isOver() ? "\\overbrace{" : "\\underbrace{") + process(brace.getBase()) + "}";
                }
                case TEXT:
                    return "\\text{" + ((Text) node).plainText() + "}";
                case SPACE:
                    return node.toLatex(LatexMode.NO_ID);
                case ARRAY: {
                    Aligned aligned = (Aligned) node;
                    int columns = aligned.columnCount();
                    String alignment = columns == 2 ? "rl" : "l".repeat(Math.max(columns, 1));
                    return "\\begin{array}{" + alignment + "}\n" + processGrid(aligned.getBody()) + "\n\\end{array}";
                }
                case MATRIX: {
                    Matrix matrix = (Matrix) node;
                    String environment = matrix.getMatrixType().environment();
                    String latex = "\\begin{" + environment + "}\n" + processGrid(matrix.getBody())
                            + "\n\\end{" + environment + "}";
                    return tag(matrix, "matrix", latex, true);
                }
                case DELIMITED: {
                    Delimited delimited = (Delimited) node;
                    String left = delimited.getLeft();
                    boolean controlWord = left.length() > 1 && left.startsWith("\\")
                            && Character.isLetter(left.charAt(left.length() - 1));
                    String latex = "\\left" + left + (controlWord ? " " : "") + processAll(delimited.getBody(), " ")
                            + "\\right" + delimited.getRight();
                    return tag(delimited, "delim", latex, true);
                }
                case ROOT: {
                    Root root = (Root) node;
                    if (root.getIndex() != null) {
                        String index = process(root.getIndex());
                        return "\\sqrt[" + index + "]{" + process(root.getBody()) + "}";
                    }
                    return "\\sqrt{" + process(root.getBody()) + "}";
                }
                case STRIKETHROUGH:
                    return "\\cancel{" + process(((Strikethrough) node).getBody()) + "}";
                case OP: {
                    Op op = (Op) node;
                    return op.isLimits() ? op.getOperator() + "\\limits" : op.getOperator();
                }
                case ACCENT: {
                    Accent accent = (Accent) node;
                    return accent.getLabel() + "{" + process(accent.getBase()) + "}";
                }
                default:
                    throw new IllegalStateException("Unhandled node type: " + node.getType());
            }
        }

        private String processAll(List<AugmentedFormulaNode> nodes, String separator) {
            return nodes.stream().map(this::process).collect(Collectors.joining(separator));
        }

        private String processGrid(List<List<AugmentedFormulaNode>> rows) {
            return rows.stream()
                    .map(row -> processAll(row, " & "))
                    .collect(Collectors.joining(" \\\\ "));
        }

        private String tag(AugmentedFormulaNode node, String kind, String latex, boolean scope) {
            String id = kind + "-" + counter++;
            node.setCssId(id);
            if (scope) {
                scopes.add(new ExpressionScope(id, kind, node.toLatex(LatexMode.NO_ID),
                        collectVariableIds(node)));
            }
            return "\\cssId{" + id + "}{" + latex + "}";
        }
    }
}
