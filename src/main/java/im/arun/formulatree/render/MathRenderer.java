package im.arun.formulatree.render;

/**
 * The typesetting engine that turns LaTeX into displayable output.
 */
public interface MathRenderer {

    /** Whether the engine has finished loading and can accept work. */
    boolean isReady();

    /**
     * Typeset the given LaTeX.
     *
     * @return renderer-specific output, e.g. SVG or HTML markup
     */
    String render(String latex);
}
