package im.arun.formulatree.variable;

import im.arun.formulatree.model.AugmentedFormula;
import im.arun.formulatree.model.AugmentedFormulaNode;
import im.arun.formulatree.model.MathSymbol;
import im.arun.formulatree.model.NodeType;
import im.arun.formulatree.tree.FormulaTreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

public class VariablePatternsTest {

    private final VariablePatterns patterns = new VariablePatterns(new FormulaTreeBuilder());

    @Test
    void parsesSymbolIntoPatternTree() {
        AugmentedFormula tree = patterns.parseVariableString("x_i");

        assertEquals(1, tree.getChildren().size());
        assertEquals(NodeType.SCRIPT, tree.getChildren().get(0).getType());
    }

    @Test
    void unparsableSymbolFallsBackToPlainSymbol() {
        AugmentedFormula tree = patterns.parseVariableString("\\nosuch");

        MathSymbol symbol = assertInstanceOf(MathSymbol.class, tree.getChildren().get(0));
        assertEquals(VariablePatterns.FALLBACK_ID, symbol.getId());
        assertEquals("\\nosuch", symbol.getValue());
    }

    @Test
    void parsesEverySymbolInOrder() {
        List<AugmentedFormula> trees = patterns.parseVariableStrings(List.of("a", "\\frac{", "b"));

        assertEquals(3, trees.size());
        assertEquals("a", ((MathSymbol) trees.get(0).getChildren().get(0)).getValue());
        assertEquals("\\frac{", ((MathSymbol) trees.get(1).getChildren().get(0)).getValue());
        assertEquals("b", ((MathSymbol) trees.get(2).getChildren().get(0)).getValue());
    }

    @Test
    void flattensToLeavesInDocumentOrder() {
        AugmentedFormula tree = new FormulaTreeBuilder().deriveTree("\\frac{a}{b_c} + d");

        List<AugmentedFormulaNode> leaves = VariablePatterns.flattenFormulaToTokens(tree);

        assertEquals(List.of("0.numer", "0.denom.base", "0.denom.sub", "1", "2"),
                leaves.stream().map(AugmentedFormulaNode::getId).toList());
    }

    @Test
    void variableTokens() {
        assertEquals(List.of("x", "i"), patterns.getVariableTokens("x_i"));
        assertEquals(List.of("\\alpha", "2"), patterns.getVariableTokens("\\alpha^2"));
        assertEquals(List.of("\\sin", "\\theta"), patterns.getVariableTokens("\\sin\\theta"));
    }
}
