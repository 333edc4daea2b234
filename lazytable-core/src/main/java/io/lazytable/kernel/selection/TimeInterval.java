package io.lazytable.kernel.selection;

/**
 * Half-open interval of frame indices {@code [start, end)}.
 */
public record TimeInterval(long start, long end) {

    public TimeInterval {
        if (end < start) {
            throw new IllegalArgumentException("end must not precede start: [" + start + ", " + end + ")");
        }
    }

    public long duration() {
        return end - start;
    }

    public boolean contains(long frameIndex) {
        return frameIndex >= start && frameIndex < end;
    }
}
