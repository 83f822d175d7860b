package im.arun.formulatree.lookup;

import im.arun.formulatree.model.AugmentedFormulaNode;
import lombok.Value;

import java.util.List;

/**
 * Where an expression occurs in a formula, and the display ids to highlight for it.
 */
@Value
public class ExpressionMatch {
    List<AugmentedFormulaNode> matchedNodes;
    /** Distinct display ids of the matched subtrees, in document order. */
    List<String> elementIds;
}
