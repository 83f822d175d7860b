package im.arun.formulatree.service;

import im.arun.formulatree.config.FormulaConfig;
import im.arun.formulatree.lookup.ExpressionMatch;
import im.arun.formulatree.model.AugmentedFormula;
import im.arun.formulatree.model.LatexMode;
import im.arun.formulatree.model.MathSymbol;
import im.arun.formulatree.model.NodeType;
import im.arun.formulatree.parse.LatexParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FormulaServiceTest {

    private final FormulaService service = new FormulaService();

    @Test
    void usesBundledConfiguration() {
        assertEquals("formula-var-base", service.getConfig().getVariableCssClass());
    }

    @Test
    void checksFormulaCode() {
        assertTrue(service.checkFormulaCode("\\frac{a}{b}"));
        assertFalse(service.checkFormulaCode("\\frac{a}{b"));
        assertFalse(service.checkFormulaCode("\\boxed{a}"));
    }

    @Test
    void deriveTreePropagatesParseErrors() {
        assertThrows(LatexParseException.class, () -> service.deriveTree("\\nosuch"));
    }

    @Test
    void processesLatexForTheTypesetter() {
        String annotated = service.processLatexContent("v = \\frac{d}{t}", List.of("v", "d", "t"));

        assertTrue(annotated.startsWith("\\cssId{v}{\\class{formula-var-base}{v}}"), annotated);
        assertTrue(annotated.contains("\\cssId{d}{\\class{formula-var-base}{d}}"), annotated);
    }

    @Test
    void unprocessableLatexIsReturnedUnchanged() {
        assertEquals("\\frac{", service.processLatexContent("\\frac{", List.of("x")));
    }

    @Test
    void listsVariablesInDocumentOrder() {
        assertEquals(List.of("t", "v", "t"),
                service.getVariablesFromLatex("t + v^{t}", List.of("v", "t")));
        assertTrue(service.getVariablesFromLatex("\\frac{", List.of("v")).isEmpty());
    }

    @Test
    void findsExpressionAfterAnnotation() {
        List<String> symbols = List.of("m", "a");
        AugmentedFormula formula = service.deriveTreeWithVariables("F = m a", symbols);
        service.annotate(formula);

        ExpressionMatch match = service.findExpression(formula, "m a", symbols);

        assertNotNull(match);
        assertEquals(List.of("m", "a"), match.getElementIds());
    }

    @Test
    void configurationReachesTheGrouper() {
        FormulaConfig config = new FormulaConfig();
        config.setSyntheticVariablePrefix("v");
        FormulaService custom = new FormulaService(config);

        AugmentedFormula formula = custom.deriveTreeWithVariables("x + y", List.of("x"));

        assertEquals(NodeType.VARIABLE, formula.getChildren().get(0).getType());
        assertEquals("v-0", formula.getChildren().get(0).getId());
    }

    @Test
    void replacesNodes() {
        AugmentedFormula formula = service.deriveTree("a + a");

        AugmentedFormula replaced = service.replaceNodes(formula, node ->
                node instanceof MathSymbol && "a".equals(((MathSymbol) node).getValue())
                        ? ((MathSymbol) node).withValue("b")
                        : node);

        assertEquals("b + b ", replaced.toLatex(LatexMode.NO_ID));
        assertEquals("a + a ", formula.toLatex(LatexMode.NO_ID));
    }

    @Test
    void exportsJson() {
        String json = service.toJson(service.deriveTree("x"));

        assertTrue(json.contains("\"latex\" : \"x\""), json);
    }
}
