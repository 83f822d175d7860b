package im.arun.formulatree.parse;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LatexParserTest {

    private final LatexParser parser = new LatexParser();

    @Test
    void charactersAreClassified() {
        List<ParseNode> nodes = parser.parse("x+1");

        assertEquals(3, nodes.size());
        assertEquals(ParseNodeType.MATHORD, nodes.get(0).getType());
        assertEquals(ParseNodeType.ATOM, nodes.get(1).getType());
        assertEquals(ParseNodeType.TEXTORD, nodes.get(2).getType());
        assertEquals(2, nodes.get(2).getPosition());
    }

    @Test
    void whitespaceAndCommentsAreIgnoredInMathMode() {
        List<ParseNode> nodes = parser.parse("a   b % trailing comment\n c");

        assertEquals(3, nodes.size());
        assertEquals("c", nodes.get(2).getText());
    }

    @Test
    void scriptsAttachToTheirBase() {
        ParseNode script = parser.parse("x_{i}^2").get(0);

        assertEquals(ParseNodeType.SUPSUB, script.getType());
        assertEquals("x", script.getBase().getText());
        assertEquals(ParseNodeType.ORDGROUP, script.getSub().getType());
        assertEquals("2", script.getSup().getText());
    }

    @Test
    void primesBecomeSuperscriptAndMergeWithCaret() {
        ParseNode single = parser.parse("f'").get(0);
        assertEquals("\\prime", single.getSup().getText());

        ParseNode merged = parser.parse("f''^2").get(0);
        assertEquals(ParseNodeType.ORDGROUP, merged.getSup().getType());
        assertEquals(3, merged.getSup().getBody().size());
    }

    @Test
    void operatorsTrackLimits() {
        assertTrue(parser.parse("\\sum").get(0).isLimits());
        assertFalse(parser.parse("\\int").get(0).isLimits());
        assertTrue(parser.parse("\\int\\limits").get(0).isLimits());
        assertFalse(parser.parse("\\sum\\nolimits").get(0).isLimits());
        assertThrows(LatexParseException.class, () -> parser.parse("x\\limits"));
    }

    @Test
    void doubleScriptsAreRejected() {
        assertThrows(LatexParseException.class, () -> parser.parse("x_1_2"));
        assertThrows(LatexParseException.class, () -> parser.parse("x^1^2"));
        assertThrows(LatexParseException.class, () -> parser.parse("x^1'"));
    }

    @Test
    void colorSwitchRunsToTheEndOfTheGroup() {
        ParseNode group = parser.parse("{a \\color{red} b c}").get(0);

        assertEquals(2, group.getBody().size());
        ParseNode color = group.getBody().get(1);
        assertEquals(ParseNodeType.COLOR, color.getType());
        assertEquals("red", color.getColor());
        assertEquals(2, color.getBody().size());
    }

    @Test
    void sqrtReadsOptionalIndex() {
        ParseNode root = parser.parse("\\sqrt[3]{x}").get(0);

        assertEquals(ParseNodeType.SQRT, root.getType());
        assertEquals("3", root.getIndex().getBody().get(0).getText());
        assertEquals(ParseNodeType.ORDGROUP, root.getBase().getType());
        assertNull(parser.parse("\\sqrt{x}").get(0).getIndex());
    }

    @Test
    void textModeKeepsSpacesAndSwitchesBackToMath() {
        ParseNode text = parser.parse("\\text{a  b}").get(0);
        assertEquals(ParseNodeType.TEXT, text.getType());
        assertEquals(3, text.getBody().size());
        assertEquals(ParseNodeType.SPACING, text.getBody().get(1).getType());

        ParseNode box = parser.parse("\\fcolorbox{red}{white}{$x^2$}").get(0);
        assertEquals(ParseNodeType.ENCLOSE, box.getType());
        assertEquals("red", box.getBorderColor());
        assertEquals("white", box.getBackgroundColor());
        ParseNode math = box.getBase().getBody().get(0);
        assertEquals(ParseNodeType.STYLING, math.getType());
        assertEquals(ParseNodeType.SUPSUB, math.getBody().get(0).getType());
    }

    @Test
    void bracketedMatrixParsesAsLeftRightAroundArray() {
        ParseNode matrix = parser.parse("\\begin{bmatrix}1&2\\\\3&4\\\\\\end{bmatrix}").get(0);

        assertEquals(ParseNodeType.LEFTRIGHT, matrix.getType());
        assertEquals("[", matrix.getLeft());
        assertEquals("]", matrix.getRight());
        ParseNode array = matrix.getBody().get(0);
        assertEquals(ParseNodeType.ARRAY, array.getType());
        // the trailing \\ does not add a row
        assertEquals(2, array.getRows().size());
        assertEquals(2, array.getRows().get(1).size());
    }

    @Test
    void arrayEnvironmentSkipsColumnSpec() {
        ParseNode array = parser.parse("\\begin{array}{rl} a & b \\end{array}").get(0);

        assertEquals(ParseNodeType.ARRAY, array.getType());
        assertEquals(1, array.getRows().size());
        assertEquals("a", array.getRows().get(0).get(0).getBody().get(0).getText());
    }

    @Test
    void mismatchedEnvironmentIsRejected() {
        assertThrows(LatexParseException.class, () -> parser.parse("\\begin{matrix} a \\end{pmatrix}"));
        assertThrows(LatexParseException.class, () -> parser.parse("\\begin{tabular} a \\end{tabular}"));
    }

    @Test
    void leftRightNeedsKnownDelimiters() {
        ParseNode delimited = parser.parse("\\left\\langle x \\right|").get(0);
        assertEquals("\\langle", delimited.getLeft());
        assertEquals("|", delimited.getRight());

        assertThrows(LatexParseException.class, () -> parser.parse("\\left( x"));
        assertThrows(LatexParseException.class, () -> parser.parse("\\left x \\right)"));
        assertThrows(LatexParseException.class, () -> parser.parse("x \\right)"));
    }

    @Test
    void negationsUseAnHtmlAlternative() {
        ParseNode neq = parser.parse("\\neq").get(0);

        assertEquals(ParseNodeType.HTMLMATHML, neq.getType());
        ParseNode relation = neq.getHtml().get(0);
        assertEquals(ParseNodeType.MCLASS, relation.getType());
        assertEquals("\\@not", relation.getBody().get(0).getText());
        assertEquals("=", relation.getBody().get(1).getText());
    }

    @Test
    void notAndInternalCommandsAreOrds() {
        List<ParseNode> nodes = parser.parse("\\not\\@foo");

        assertEquals("\\@not", nodes.get(0).getText());
        assertEquals(ParseNodeType.TEXTORD, nodes.get(1).getType());
        assertEquals("\\@foo", nodes.get(1).getText());
    }

    @Test
    void unknownCommandReportsPosition() {
        LatexParseException e = assertThrows(LatexParseException.class, () -> parser.parse("a + \\foo"));

        assertEquals(4, e.getPosition());
        assertTrue(e.getMessage().startsWith("Undefined control sequence \\foo"));
    }

    @Test
    void unbalancedBracesAreRejected() {
        assertThrows(LatexParseException.class, () -> parser.parse("{a"));
        assertThrows(LatexParseException.class, () -> parser.parse("a}"));
        assertThrows(LatexParseException.class, () -> parser.parse("\\text{a"));
    }

    @Test
    void nestingBeyondLimitIsRejected() {
        LatexParser shallow = new LatexParser(3);

        assertEquals(1, shallow.parse("{{a}}").size());
        assertThrows(LatexParseException.class, () -> shallow.parse("{{{{a}}}}"));
    }

    @Test
    void lineBreakOutsideArrayIsKept() {
        List<ParseNode> nodes = parser.parse("a \\\\ b");

        assertEquals(ParseNodeType.CR, nodes.get(1).getType());
    }
}
