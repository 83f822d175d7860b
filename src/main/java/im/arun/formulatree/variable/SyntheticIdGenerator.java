package im.arun.formulatree.variable;

import im.arun.formulatree.model.AugmentedFormula;

import java.util.Collection;

/**
 * Deterministic ids for nodes synthesized by tree transformations, of the form
 * {@code <prefix>-<n>}. A single counter is shared by all prefixes.
 */
public class SyntheticIdGenerator {
    private int next;

    public SyntheticIdGenerator(int start) {
        this.next = start;
    }

    /**
     * Generator whose counter starts above every synthetic id already in the formula,
     * so generated ids never collide with ones from an earlier pass.
     */
    public static SyntheticIdGenerator seededFrom(AugmentedFormula formula, Collection<String> prefixes) {
        int max = -1;
        for (String id : formula.getIdIndex().keySet()) {
            for (String prefix : prefixes) {
                String marker = prefix + "-";
                if (id.startsWith(marker) && isDigits(id.substring(marker.length()))) {
                    max = Math.max(max, Integer.parseInt(id.substring(marker.length())));
                }
            }
        }
        return new SyntheticIdGenerator(max + 1);
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty() || s.length() > 9) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public String next(String prefix) {
        return prefix + "-" + next++;
    }
}
