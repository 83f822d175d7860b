package im.arun.formulatree.model;

import im.arun.formulatree.tree.FormulaTreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AugmentedFormulaTest {

    private final FormulaTreeBuilder builder = new FormulaTreeBuilder();

    @Test
    void equalityIgnoresIds() {
        AugmentedFormula built = builder.deriveTree("a+b");
        AugmentedFormula handMade = new AugmentedFormula(List.of(
                new MathSymbol("x", "a"), new MathSymbol("y", "+"), new MathSymbol("z", "b")));

        assertEquals(built, handMade);
        assertEquals(built.hashCode(), handMade.hashCode());
        assertNotEquals(built, builder.deriveTree("a-b"));
    }

    @Test
    void plainLatexSeparatesTopLevelNodesWithTrailingSpace() {
        assertEquals("x_i + y ", builder.deriveTree("x_i+y").toLatex(LatexMode.NO_ID));
    }

    @Test
    void contentOnlyDropsOwnMarkup() {
        AugmentedFormula formula = builder.deriveTree("\\textcolor{red}{x} \\cancel{y}");

        assertEquals("x y ", formula.toLatex(LatexMode.CONTENT_ONLY));
        assertEquals("\\textcolor{red}{x} \\cancel{y} ", formula.toLatex(LatexMode.NO_ID));
    }

    @Test
    void styledRangesMirrorPlainLatex() {
        for (String latex : List.of("x_i + \\frac{a}{b}", "\\textcolor{red}{x+y}", "\\sqrt[3]{x}",
                "\\begin{pmatrix}a&b\\\\c&d\\end{pmatrix}", "\\left( a \\right)^2", "\\text{if } x")) {
            AugmentedFormula formula = builder.deriveTree(latex);
            FormulaLatexRanges ranges = formula.toStyledRanges();

            assertEquals(formula.toLatex(LatexMode.NO_ID).trim(), ranges.text(), latex);
            assertEquals(ranges.text().length(), ranges.length());
        }
    }

    @Test
    void colorRangeCarriesHints() {
        FormulaLatexRanges ranges = builder.deriveTree("\\textcolor{red}{x}").toStyledRanges();

        StyledRange color = assertInstanceOf(StyledRange.class, ranges.getRanges().get(0));
        assertEquals("0", color.getId());
        assertEquals("\\textcolor{red}{", color.getLeft());
        assertEquals("red", color.getHints().getColor());
        assertEquals("Color: red", color.getHints().getTooltip());
        assertFalse(color.getHints().isNoMark());
    }

    @Test
    void adjacentUnstyledRangesAreCombined() {
        FormulaLatexRanges ranges = builder.deriveTree("\\frac{a}{b} + c").toStyledRanges().combined();

        assertEquals(1, ranges.getRanges().size());
        assertEquals(new UnstyledRange("\\frac{a}{b} + c"), ranges.getRanges().get(0));
    }

    @Test
    void combiningRecursesIntoStyledRanges() {
        List<FormulaLatexRange> combined = FormulaLatexRanges.combineUnstyledRanges(List.of(
                new UnstyledRange("a"),
                new StyledRange("s", "[", List.of(new UnstyledRange("b"), new UnstyledRange("c")), "]"),
                new UnstyledRange("d"),
                new UnstyledRange("e")));

        assertEquals(3, combined.size());
        StyledRange styled = (StyledRange) combined.get(1);
        assertEquals(List.of(new UnstyledRange("bc")), styled.getChildren());
        assertEquals(new UnstyledRange("de"), combined.get(2));
    }

    @Test
    void matchingComparesStructureNotIds() {
        AugmentedFormulaNode first = builder.deriveTree("x_i").getChildren().get(0);
        AugmentedFormulaNode second = new Script("other", new MathSymbol("b", "x"), new MathSymbol("s", "i"), null);

        assertTrue(first.matches(second));
        assertFalse(first.matches(new Script("s", new MathSymbol("b", "x"), null, new MathSymbol("p", "i"))));
        assertFalse(first.matches(new MathSymbol("x", "x")));
        assertFalse(first.matches(null));
    }

    @Test
    void boxesMatchOnlyWithTheSameColors() {
        AugmentedFormulaNode box = builder.deriveTree("\\fcolorbox{red}{white}{$x$}").getChildren().get(0);

        assertTrue(box.matches(builder.deriveTree("\\fcolorbox{red}{white}{$x$}").getChildren().get(0)));
        assertFalse(box.matches(builder.deriveTree("\\fcolorbox{blue}{black}{$x$}").getChildren().get(0)));
        assertFalse(box.matches(builder.deriveTree("\\fcolorbox{red}{black}{$x$}").getChildren().get(0)));
    }

    @Test
    void copiesKeepBackReferencesUntilReattached() {
        AugmentedFormula formula = builder.deriveTree("a+b");
        MathSymbol plus = (MathSymbol) formula.findNode("1");

        MathSymbol minus = plus.withValue("-");
        assertEquals("-", minus.getValue());
        assertEquals("1", minus.getId());
        assertSame(formula.findNode("0"), minus.getLeftSibling());

        AugmentedFormula rebuilt = new AugmentedFormula(List.of(minus));
        assertNull(rebuilt.getChildren().get(0).getLeftSibling());
        assertNull(rebuilt.getChildren().get(0).getRightSibling());
    }

    @Test
    void allNodesIsPreorder() {
        AugmentedFormula formula = builder.deriveTree("\\frac{a}{b} c");
        List<String> ids = formula.allNodes().stream().map(AugmentedFormulaNode::getId).toList();

        assertEquals(List.of("0", "0.numer", "0.denom", "1"), ids);
    }

    @Test
    void variableRendersAsItsBody() {
        Variable variable = new Variable("var-0", new MathSymbol("0", "x"), "x", "x");
        AugmentedFormula formula = new AugmentedFormula(List.of(variable));

        assertEquals("x ", formula.toLatex(LatexMode.NO_ID));
        assertEquals("\\cssId{var-0}{\\cssId{0}{x}} ", formula.toLatex(LatexMode.RENDER));
        StyledRange range = (StyledRange) formula.toStyledRanges().getRanges().get(0);
        assertEquals("Variable: x", range.getHints().getTooltip());
        assertSame(variable, formula.findNode("0").getParent());
    }

    @Test
    void scriptBracesOperandsThatWouldNotReparse() {
        MathSymbol x = new MathSymbol("b", "x");
        Fraction half = new Fraction("f", new MathSymbol("n", "1"), new MathSymbol("d", "2"));
        Script script = new Script("s", x, null, half);

        assertEquals("x^{\\frac{1}{2}}", script.toLatex(LatexMode.NO_ID));
        assertEquals("\\cssId{s}{\\cssId{b}{x}^{\\cssId{f}{\\frac{\\cssId{n}{1}}{\\cssId{d}{2}}}}}",
                script.toLatex(LatexMode.RENDER));
    }
}
