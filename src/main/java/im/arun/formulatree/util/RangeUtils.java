package im.arun.formulatree.util;

import im.arun.formulatree.model.IdRange;
import im.arun.formulatree.model.LatexRange;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for combining serialized LaTeX fragments and their id spans.
 */
public final class RangeUtils {

    private RangeUtils() {
    }

    /**
     * Concatenate fragments into one, shifting each fragment's id spans by the running
     * offset. Every fragment is expected to be serialized at offset 0.
     *
     * @param elements fragments in output order; literals carry no ids
     * @param offset   position of the first character in the caller's output
     * @param id       id recorded for the whole consolidated span, or null
     */
    public static LatexRange consolidateRanges(List<LatexRange> elements, int offset, String id) {
        int adjustedOffset = offset;
        StringBuilder combined = new StringBuilder();
        Map<String, IdRange> ranges = new LinkedHashMap<>();
        for (LatexRange element : elements) {
            combined.append(element.getLatex());
            for (Map.Entry<String, IdRange> entry : element.getRanges().entrySet()) {
                ranges.put(entry.getKey(), entry.getValue().shift(adjustedOffset));
            }
            adjustedOffset += element.getLatex().length();
        }
        if (id != null) {
            ranges.put(id, new IdRange(offset, adjustedOffset));
        }
        return new LatexRange(combined.toString(), ranges);
    }

    public static LatexRange consolidateRanges(List<LatexRange> elements, int offset) {
        return consolidateRanges(elements, offset, null);
    }
}
