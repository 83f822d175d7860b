package im.arun.formulatree.model;

import lombok.Value;

/**
 * Half-open character span {@code [start, end)} of a node inside serialized LaTeX.
 */
@Value
public class IdRange {
    int start;
    int end;

    public IdRange shift(int delta) {
        return new IdRange(start + delta, end + delta);
    }

    public int length() {
        return end - start;
    }
}
