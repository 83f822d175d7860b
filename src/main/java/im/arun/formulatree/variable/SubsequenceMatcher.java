package im.arun.formulatree.variable;

import im.arun.formulatree.model.AugmentedFormulaNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural search for contiguous runs of nodes. Shared by variable grouping and
 * expression lookup.
 */
public final class SubsequenceMatcher {

    private SubsequenceMatcher() {
    }

    /**
     * Non-overlapping runs of {@code children} that match {@code pattern} node by node,
     * scanning left to right.
     */
    public static List<SubsequenceMatch> findMatchingSubsequences(List<AugmentedFormulaNode> children,
                                                                  List<AugmentedFormulaNode> pattern) {
        List<SubsequenceMatch> matches = new ArrayList<>();
        if (pattern.isEmpty()) {
            return matches;
        }
        int i = 0;
        while (i <= children.size() - pattern.size()) {
            List<AugmentedFormulaNode> window = children.subList(i, i + pattern.size());
            if (subsequenceMatches(window, pattern)) {
                matches.add(new SubsequenceMatch(i, i + pattern.size() - 1, List.copyOf(window)));
                i += pattern.size();
            } else {
                i++;
            }
        }
        return matches;
    }

    public static boolean subsequenceMatches(List<AugmentedFormulaNode> subsequence,
                                             List<AugmentedFormulaNode> pattern) {
        if (subsequence.size() != pattern.size()) {
            return false;
        }
        for (int i = 0; i < subsequence.size(); i++) {
            if (!subsequence.get(i).matches(pattern.get(i))) {
                return false;
            }
        }
        return true;
    }
}
