package im.arun.formulatree.render;

import im.arun.formulatree.model.AugmentedFormula;
import im.arun.formulatree.model.LatexMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands formulas to the typesetting engine.
 */
public class FormulaRenderService {
    private static final Logger logger = LoggerFactory.getLogger(FormulaRenderService.class);

    private final MathRenderer renderer;

    /**
     * @param renderer typesetting engine; may be null until one is configured
     */
    public FormulaRenderService(MathRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * Render the formula's plain LaTeX.
     *
     * @throws RenderPreconditionException if no renderer is configured or it is not ready
     */
    public RenderResult updateFormula(AugmentedFormula formula) {
        if (renderer == null) {
            throw new RenderPreconditionException("No math renderer configured");
        }
        if (!renderer.isReady()) {
            throw new RenderPreconditionException("Math renderer is not ready");
        }
        String latex = formula.toLatex(LatexMode.NO_ID);
        logger.debug("Rendering '{}'", latex);
        return new RenderResult(latex, renderer.render(latex));
    }
}
