package im.arun.formulatree.util;

import im.arun.formulatree.model.IdRange;
import im.arun.formulatree.model.LatexRange;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class RangeUtilsTest {

    @Test
    void shiftsChildRangesByRunningOffset() {
        LatexRange a = new LatexRange("a", Map.of("x", new IdRange(0, 1)));
        LatexRange b = new LatexRange("bb", Map.of("y", new IdRange(0, 2)));

        LatexRange combined = RangeUtils.consolidateRanges(
                List.of(LatexRange.literal("\\frac{"), a, LatexRange.literal("}{"), b, LatexRange.literal("}")),
                10, "f");

        assertEquals("\\frac{a}{bb}", combined.getLatex());
        assertEquals(new IdRange(16, 17), combined.rangeOf("x"));
        assertEquals(new IdRange(19, 21), combined.rangeOf("y"));
        assertEquals(new IdRange(10, 22), combined.rangeOf("f"));
    }

    @Test
    void withoutIdOnlyChildRangesAreKept() {
        LatexRange combined = RangeUtils.consolidateRanges(
                List.of(new LatexRange("a", Map.of("x", new IdRange(0, 1))), LatexRange.literal(" ")), 0);

        assertEquals("a ", combined.getLatex());
        assertEquals(1, combined.getRanges().size());
        assertEquals("a", combined.substringOf("x"));
        assertNull(combined.substringOf("missing"));
    }
}
