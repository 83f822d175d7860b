package im.arun.formulatree.render;

import im.arun.formulatree.model.AugmentedFormula;
import lombok.Value;

import java.util.List;

@Value
public class AnnotationResult {
    String latex;
    AugmentedFormula tree;
    List<ExpressionScope> scopes;
}
