package im.arun.formulatree.variable;

import im.arun.formulatree.config.FormulaConfig;
import im.arun.formulatree.model.AugmentedFormula;
import im.arun.formulatree.model.AugmentedFormulaNode;
import im.arun.formulatree.model.Fraction;
import im.arun.formulatree.model.Group;
import im.arun.formulatree.model.LatexMode;
import im.arun.formulatree.model.MathSymbol;
import im.arun.formulatree.model.Matrix;
import im.arun.formulatree.model.NodeType;
import im.arun.formulatree.model.Script;
import im.arun.formulatree.model.Variable;
import im.arun.formulatree.parse.LatexParser;
import im.arun.formulatree.tree.FormulaTreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VariableGrouperTest {

    private final FormulaTreeBuilder builder = new FormulaTreeBuilder();
    private final VariablePatterns patterns = new VariablePatterns(builder);

    private AugmentedFormula group(String latex, List<String> symbols) {
        return builder.deriveTreeWithVars(latex, patterns.parseVariableStrings(symbols), symbols);
    }

    @Test
    void longerPatternsAreGroupedFirst() {
        AugmentedFormula formula = group("x_i + x", List.of("x", "x_i"));

        assertEquals(3, formula.getChildren().size());
        Variable indexed = assertInstanceOf(Variable.class, formula.getChildren().get(0));
        assertEquals("x_i", indexed.getOriginalSymbol());
        assertEquals("x_i", indexed.getVariableLatex());
        assertInstanceOf(Script.class, indexed.getBody());

        Variable plain = assertInstanceOf(Variable.class, formula.getChildren().get(2));
        assertEquals("x", plain.getOriginalSymbol());
        assertInstanceOf(MathSymbol.class, plain.getBody());
    }

    @Test
    void indexBeforeEqualsInSubscriptIsNotWrapped() {
        AugmentedFormula formula = group("\\sum_{i=1}^{n} x_i", List.of("i"));

        Script sum = (Script) formula.getChildren().get(0);
        Group binding = assertInstanceOf(Group.class, sum.getSub());
        assertInstanceOf(MathSymbol.class, binding.getBody().get(0));
        assertEquals("=", ((MathSymbol) binding.getBody().get(1)).getValue());

        Variable start = assertInstanceOf(Variable.class, binding.getBody().get(2));
        assertTrue(start.getId().startsWith("var-eq-"), start.getId());
        assertEquals("i", start.getOriginalSymbol());
        assertEquals("1", ((MathSymbol) start.getBody()).getValue());

        Script term = (Script) formula.getChildren().get(1);
        Variable index = assertInstanceOf(Variable.class, term.getSub());
        assertEquals("i", index.getOriginalSymbol());
    }

    @Test
    void topLevelEqualityIsAnAssignment() {
        AugmentedFormula formula = group("i = 1", List.of("i"));

        assertInstanceOf(Variable.class, formula.getChildren().get(0));
        assertInstanceOf(MathSymbol.class, formula.getChildren().get(2));
    }

    @Test
    void equalityBindingCanBeDisabled() {
        FormulaConfig config = new FormulaConfig();
        config.setEqualityBinding(false);
        FormulaTreeBuilder plainBuilder = new FormulaTreeBuilder(new LatexParser(), new VariableGrouper(config));
        VariablePatterns plainPatterns = new VariablePatterns(plainBuilder);

        AugmentedFormula formula = plainBuilder.deriveTreeWithVars("\\sum_{i=1}^{n} x_i",
                plainPatterns.parseVariableStrings(List.of("i")), List.of("i"));

        Group binding = (Group) ((Script) formula.getChildren().get(0)).getSub();
        assertInstanceOf(Variable.class, binding.getBody().get(0));
        assertInstanceOf(MathSymbol.class, binding.getBody().get(2));
    }

    @Test
    void formulaWithoutOccurrencesIsUnchanged() {
        AugmentedFormula formula = builder.deriveTree("a + \\frac{b}{c}");

        AugmentedFormula grouped = new VariableGrouper().groupVariablesByTrees(formula,
                patterns.parseVariableStrings(List.of("z", "y_k")), List.of("z", "y_k"));

        assertSame(formula, grouped);
        assertEquals(builder.deriveTree("a + \\frac{b}{c}"), grouped);
    }

    @Test
    void inputFormulaIsLeftUntouched() {
        AugmentedFormula formula = builder.deriveTree("\\sum_{i=1}^{n} x_i");
        String before = formula.toLatex(LatexMode.NO_ID);
        AugmentedFormulaNode start = formula.findNode("0.sub.2");
        AugmentedFormulaNode index = formula.findNode("1.sub");

        AugmentedFormula grouped = new VariableGrouper().groupVariablesByTrees(formula,
                patterns.parseVariableStrings(List.of("i")), List.of("i"));

        assertEquals(before, formula.toLatex(LatexMode.NO_ID));
        assertSame(formula.findNode("0.sub"), start.getParent());
        assertSame(formula.findNode("0.sub.1"), start.getLeftSibling());
        assertNull(start.getRightSibling());
        assertSame(formula.findNode("1"), index.getParent());

        Set<AugmentedFormulaNode> inputNodes = Collections.newSetFromMap(new IdentityHashMap<>());
        inputNodes.addAll(formula.allNodes());
        for (AugmentedFormulaNode node : grouped.allNodes()) {
            assertFalse(inputNodes.contains(node), "shared node " + node.getId());
        }
    }

    @Test
    void braceGroupInputKeepsItsPlainLatex() {
        AugmentedFormula formula = builder.deriveTree("{a b} + c");
        String before = formula.toLatex(LatexMode.NO_ID);
        AugmentedFormulaNode braces = formula.getChildren().get(0);

        AugmentedFormula grouped = new VariableGrouper().groupVariablesByTrees(formula,
                patterns.parseVariableStrings(List.of("{a b}")), List.of("{a b}"));

        assertInstanceOf(Variable.class, grouped.getChildren().get(0));
        assertEquals(before, formula.toLatex(LatexMode.NO_ID));
        assertNull(braces.getParent());
        assertSame(braces, formula.getChildren().get(0));
    }

    @Test
    void groupingIsIdempotent() {
        List<String> symbols = List.of("x_i", "y");
        AugmentedFormula once = group("x_i + y = \\frac{y}{x_i}", symbols);
        String plain = once.toLatex(LatexMode.NO_ID);

        AugmentedFormula twice = new VariableGrouper().groupVariablesByTrees(once,
                patterns.parseVariableStrings(symbols), symbols);

        assertEquals(plain, twice.toLatex(LatexMode.NO_ID));
        assertEquals(once.allNodes().size(), twice.allNodes().size());
    }

    @Test
    void multiNodePatternIsWrappedInSyntheticGroup() {
        AugmentedFormula formula = group("a b + c", List.of("a b"));

        assertEquals(3, formula.getChildren().size());
        Variable variable = assertInstanceOf(Variable.class, formula.getChildren().get(0));
        Group body = assertInstanceOf(Group.class, variable.getBody());
        assertTrue(body.getId().startsWith("group-"), body.getId());
        assertEquals(2, body.getBody().size());
        assertEquals("a b", variable.getVariableLatex());
    }

    @Test
    void variablesInsideFractionsAndMatricesAreFound() {
        AugmentedFormula formula = group("\\frac{v}{t} \\begin{pmatrix}v&0\\\\0&v\\end{pmatrix}", List.of("v"));

        Fraction fraction = (Fraction) formula.getChildren().get(0);
        assertInstanceOf(Variable.class, fraction.getNumerator());
        Matrix matrix = (Matrix) formula.getChildren().get(1);
        assertEquals(NodeType.VARIABLE, matrix.getBody().get(0).get(0).getType());
        assertEquals(NodeType.SYMBOL, matrix.getBody().get(0).get(1).getType());
        assertEquals(NodeType.VARIABLE, matrix.getBody().get(1).get(1).getType());
    }

    @Test
    void syntheticIdsNeverRepeatAcrossPasses() {
        AugmentedFormula first = group("a + b", List.of("a"));
        assertEquals("var-0", first.getChildren().get(0).getId());

        AugmentedFormula second = new VariableGrouper().groupVariablesByTrees(first,
                patterns.parseVariableStrings(List.of("b")), List.of("b"));
        assertEquals("var-0", second.getChildren().get(0).getId());
        assertEquals("var-1", second.getChildren().get(2).getId());
    }

    @Test
    void missingSymbolFallsBackToPatternLatex() {
        AugmentedFormula formula = builder.deriveTreeWithVars("x_1", List.of(builder.deriveTree("x_1")), null);

        Variable variable = assertInstanceOf(Variable.class, formula.getChildren().get(0));
        assertEquals("x_1", variable.getOriginalSymbol());
    }

    @Test
    void complexityWeighsStructure() {
        assertEquals(1, VariableGrouper.complexity(builder.deriveTree("x")));
        assertEquals(5, VariableGrouper.complexity(builder.deriveTree("x_i")));
        assertEquals(6, VariableGrouper.complexity(builder.deriveTree("\\frac{a}{b}")));
    }
}
