package im.arun.formulatree.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level list of editor ranges for a whole formula.
 */
@Value
public class FormulaLatexRanges {
    List<FormulaLatexRange> ranges;

    public FormulaLatexRanges(List<FormulaLatexRange> ranges) {
        this.ranges = List.copyOf(ranges);
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        ranges.forEach(range -> sb.append(range.text()));
        return sb.toString();
    }

    public int length() {
        return ranges.stream().mapToInt(FormulaLatexRange::length).sum();
    }

    public FormulaLatexRanges combined() {
        return new FormulaLatexRanges(combineUnstyledRanges(ranges));
    }

    /**
     * Merges adjacent unstyled ranges, recursing into styled ranges.
     */
    public static List<FormulaLatexRange> combineUnstyledRanges(List<FormulaLatexRange> ranges) {
        List<FormulaLatexRange> result = new ArrayList<>();
        for (FormulaLatexRange range : ranges) {
            if (range instanceof StyledRange) {
                StyledRange styled = (StyledRange) range;
                result.add(new StyledRange(styled.getId(), styled.getLeft(),
                        combineUnstyledRanges(styled.getChildren()), styled.getRight(), styled.getHints()));
            } else if (!result.isEmpty() && result.get(result.size() - 1) instanceof UnstyledRange) {
                UnstyledRange previous = (UnstyledRange) result.remove(result.size() - 1);
                result.add(new UnstyledRange(previous.getText() + range.text()));
            } else {
                result.add(range);
            }
        }
        return result;
    }
}
