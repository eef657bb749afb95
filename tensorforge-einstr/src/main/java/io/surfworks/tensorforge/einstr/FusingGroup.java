package io.surfworks.tensorforge.einstr;

/**
 * Half-open range {@code [start, end)} of output positions collapsed into one physical axis.
 *
 * @param start first fused position
 * @param end   position after the last fused one; equal to {@code start} for an empty group
 */
public record FusingGroup(int start, int end) {

    public FusingGroup {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid fusing group [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    /**
     * Re-maps both boundaries after the placeholder at {@code ellipsisPosition} became
     * {@code runLength} ids. Boundaries at or before the placeholder do not move.
     */
    public FusingGroup expand(int ellipsisPosition, int runLength) {
        return new FusingGroup(shift(start, ellipsisPosition, runLength), shift(end, ellipsisPosition, runLength));
    }

    private static int shift(int boundary, int ellipsisPosition, int runLength) {
        return boundary > ellipsisPosition ? boundary + runLength - 1 : boundary;
    }
}
