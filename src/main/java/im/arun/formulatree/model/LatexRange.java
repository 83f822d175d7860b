package im.arun.formulatree.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A LaTeX fragment together with the spans of every node id it contains.
 * A plain literal is a range with no ids.
 */
@Value
public class LatexRange {
    String latex;
    Map<String, IdRange> ranges;

    public LatexRange(String latex, Map<String, IdRange> ranges) {
        this.latex = latex;
        this.ranges = Collections.unmodifiableMap(new LinkedHashMap<>(ranges));
    }

    public static LatexRange literal(String latex) {
        return new LatexRange(latex, Map.of());
    }

    public IdRange rangeOf(String id) {
        return ranges.get(id);
    }

    /**
     * Substring of the fragment covered by the given id, or null when the id is absent.
     */
    public String substringOf(String id) {
        IdRange range = ranges.get(id);
        return range == null ? null : latex.substring(range.getStart(), range.getEnd());
    }
}
