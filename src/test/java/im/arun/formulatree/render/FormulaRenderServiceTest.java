package im.arun.formulatree.render;

import im.arun.formulatree.model.AugmentedFormula;
import im.arun.formulatree.tree.FormulaTreeBuilder;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FormulaRenderServiceTest {

    private final AugmentedFormula formula = new FormulaTreeBuilder().deriveTree("\\frac{a}{b}");

    private static final class StubRenderer implements MathRenderer {
        private final boolean ready;

        StubRenderer(boolean ready) {
            this.ready = ready;
        }

        @Override
        public boolean isReady() {
            return ready;
        }

        @Override
        public String render(String latex) {
            return "<math>" + latex.trim() + "</math>";
        }
    }

    @Test
    void rendersPlainLatex() {
        RenderResult result = new FormulaRenderService(new StubRenderer(true)).updateFormula(formula);

        assertEquals("\\frac{a}{b}", result.getLatex().trim());
        assertEquals("<math>\\frac{a}{b}</math>", result.getOutput());
    }

    @Test
    void missingRendererIsRejected() {
        RenderPreconditionException e = assertThrows(RenderPreconditionException.class,
                () -> new FormulaRenderService(null).updateFormula(formula));
        assertEquals("No math renderer configured", e.getMessage());
    }

    @Test
    void rendererThatIsNotReadyIsRejected() {
        RenderPreconditionException e = assertThrows(RenderPreconditionException.class,
                () -> new FormulaRenderService(new StubRenderer(false)).updateFormula(formula));
        assertEquals("Math renderer is not ready", e.getMessage());
    }
}
