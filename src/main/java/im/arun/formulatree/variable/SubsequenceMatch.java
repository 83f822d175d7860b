package im.arun.formulatree.variable;

import im.arun.formulatree.model.AugmentedFormulaNode;
import lombok.Value;

import java.util.List;

/**
 * A run of sibling nodes matching a pattern; indices are inclusive.
 */
@Value
public class SubsequenceMatch {
    int startIndex;
    int endIndex;
    List<AugmentedFormulaNode> nodes;
}
