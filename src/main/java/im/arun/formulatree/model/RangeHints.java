package im.arun.formulatree.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Decoration payload for a {@link StyledRange}. Every field is optional.
 */
@Value
@Builder
@AllArgsConstructor
public class RangeHints {
    String color;
    String tooltip;
    boolean noMark;

    public static final RangeHints NONE = new RangeHints(null, null, false);
}
