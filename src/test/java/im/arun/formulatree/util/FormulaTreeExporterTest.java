package im.arun.formulatree.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.formulatree.model.AugmentedFormula;
import im.arun.formulatree.render.DisplayIdAnnotator;
import im.arun.formulatree.tree.FormulaTreeBuilder;
import im.arun.formulatree.variable.VariablePatterns;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FormulaTreeExporterTest {

    private final FormulaTreeBuilder builder = new FormulaTreeBuilder();
    private final FormulaTreeExporter exporter = new FormulaTreeExporter();

    @Test
    void exportsTypesIdsAndFields() {
        ObjectNode json = exporter.toJsonNode(builder.deriveTree("\\frac{a}{b} + \\sum_{i}"));

        assertEquals("\\frac{a}{b} + \\sum_i", json.get("latex").asText().replace("\\limits", ""));
        JsonNode fraction = json.get("children").get(0);
        assertEquals("frac", fraction.get("type").asText());
        assertEquals("0", fraction.get("id").asText());
        assertEquals("0.numer", fraction.get("children").get(0).get("id").asText());
        assertEquals("a", fraction.get("children").get(0).get("value").asText());
        assertFalse(fraction.get("children").get(0).has("children"));

        JsonNode op = json.get("children").get(2).get("children").get(0);
        assertEquals("op", op.get("type").asText());
        assertEquals("\\sum", op.get("operator").asText());
        assertTrue(op.get("limits").asBoolean());
    }

    @Test
    void exportsVariablesAndDisplayIds() {
        List<String> symbols = List.of("x");
        AugmentedFormula formula = builder.deriveTreeWithVars("x = 1",
                new VariablePatterns(builder).parseVariableStrings(symbols), symbols);
        new DisplayIdAnnotator("formula-var-base").annotate(formula);

        JsonNode variable = exporter.toJsonNode(formula).get("children").get(0);

        assertEquals("variable", variable.get("type").asText());
        assertEquals("x", variable.get("originalSymbol").asText());
        assertEquals("x", variable.get("variableLatex").asText());
        assertEquals("x", variable.get("displayId").asText());
        assertFalse(variable.get("children").get(0).has("displayId"));
    }

    @Test
    void exportsMatrixShape() {
        JsonNode matrix = exporter.toJsonNode(builder.deriveTree("\\begin{bmatrix}1&2&3\\\\4&5&6\\end{bmatrix}"))
                .get("children").get(0);

        assertEquals("matrix", matrix.get("type").asText());
        assertEquals("bmatrix", matrix.get("matrixType").asText());
        assertEquals(2, matrix.get("rows").asInt());
        assertEquals(3, matrix.get("columns").asInt());
    }

    @Test
    void prettyJsonParsesBack() throws Exception {
        String json = exporter.toJson(builder.deriveTree("a_1"));

        assertTrue(json.contains("\n"));
        JsonNode parsed = new ObjectMapper().readTree(json);
        assertEquals("script", parsed.get("children").get(0).get("type").asText());
    }
}
