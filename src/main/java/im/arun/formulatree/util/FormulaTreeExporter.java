package im.arun.formulatree.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.formulatree.model.Accent;
import im.arun.formulatree.model.AugmentedFormula;
import im.arun.formulatree.model.AugmentedFormulaNode;
import im.arun.formulatree.model.Box;
import im.arun.formulatree.model.Brace;
import im.arun.formulatree.model.Color;
import im.arun.formulatree.model.Delimited;
import im.arun.formulatree.model.LatexMode;
import im.arun.formulatree.model.MathSymbol;
import im.arun.formulatree.model.Matrix;
import im.arun.formulatree.model.Op;
import im.arun.formulatree.model.Space;
import im.arun.formulatree.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON view of a formula tree for inspector panes and debug logs.
 */
public class FormulaTreeExporter {
    private static final Logger logger = LoggerFactory.getLogger(FormulaTreeExporter.class);

    private final ObjectMapper objectMapper;

    public FormulaTreeExporter() {
        this.objectMapper = new ObjectMapper();
    }

    public ObjectNode toJsonNode(AugmentedFormula formula) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("latex", formula.toLatex(LatexMode.NO_ID).trim());
        ArrayNode children = root.putArray("children");
        for (AugmentedFormulaNode child : formula.getChildren()) {
            children.add(toJsonNode(child));
        }
        return root;
    }

    public ObjectNode toJsonNode(AugmentedFormulaNode node) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("type", node.getType().label());
        json.put("id", node.getId());
        if (node.getCssId() != null) {
            json.put("displayId", node.getCssId());
        }
        switch (node.getType()) {
            case SYMBOL:
                json.put("value", ((MathSymbol) node).getValue());
                break;
            case SPACE:
                json.put("text", ((Space) node).getText());
                break;
            case OP:
                json.put("operator", ((Op) node).getOperator());
                json.put("limits", ((Op) node).isLimits());
                break;
            case COLOR:
                json.put("color", ((Color) node).getColor());
                break;
            case BOX:
                json.put("borderColor", ((Box) node).getBorderColor());
                json.put("backgroundColor", ((Box) node).getBackgroundColor());
                break;
            case BRACE:
                json.put("over", ((Brace) node).isOver());
                break;
            case ACCENT:
                json.put("label", ((Accent) node).getLabel());
                break;
            case VARIABLE:
                json.put("variableLatex", ((Variable) node).getVariableLatex());
                json.put("originalSymbol", ((Variable) node).getOriginalSymbol());
                break;
            case MATRIX:
                json.put("matrixType", ((Matrix) node).getMatrixType().environment());
                json.put("rows", ((Matrix) node).rowCount());
                json.put("columns", ((Matrix) node).columnCount());
                break;
            case DELIMITED:
                json.put("left", ((Delimited) node).getLeft());
                json.put("right", ((Delimited) node).getRight());
                break;
            default:
                break;
        }
        if (!node.getChildren().isEmpty()) {
            ArrayNode children = json.putArray("children");
            for (AugmentedFormulaNode child : node.getChildren()) {
                children.add(toJsonNode(child));
            }
        }
        return json;
    }

    /**
     * Indented JSON of the whole tree; {@code "{}"} if serialization fails.
     */
    public String toJson(AugmentedFormula formula) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonNode(formula));
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize formula tree: {}", e.getMessage());
            return "{}";
        }
    }
}
