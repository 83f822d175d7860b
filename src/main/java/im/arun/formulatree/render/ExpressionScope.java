package im.arun.formulatree.render;

import lombok.Value;

import java.util.List;

/**
 * A structural element tagged with a display id during annotation, such as a sum or
 * a fraction, so layout code can find its bounding box.
 */
@Value
public class ExpressionScope {
    String id;
    /** Kind of element: {@code sum}, {@code frac}, {@code matrix}, ... */
    String type;
    /** Plain LaTeX of the element. */
    String latex;
    /** Original symbols of the variables inside the element. */
    List<String> variables;
}
