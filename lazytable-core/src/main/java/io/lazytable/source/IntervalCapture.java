package io.lazytable.source;

import java.util.Objects;

/**
 * How intervals named by a row source become table rows.
 *
 * @param mode         which part of each interval anchors the row
 * @param captureRange half width, in frames, of the window built around the anchor
 */
public record IntervalCapture(Mode mode, long captureRange) {

    public static final long DEFAULT_CAPTURE_RANGE = 30_000;

    public enum Mode {
        /** Use each interval unchanged. */
        AS_IS,
        /** Window of {@code captureRange} frames either side of the interval start. */
        AROUND_START,
        /** Window of {@code captureRange} frames either side of the interval end. */
        AROUND_END
    }

    public IntervalCapture {
        Objects.requireNonNull(mode, "mode");
        if (captureRange < 0) {
            throw new IllegalArgumentException("captureRange must be non-negative: " + captureRange);
        }
    }

    public static IntervalCapture defaults() {
        return new IntervalCapture(Mode.AROUND_START, DEFAULT_CAPTURE_RANGE);
    }

    public static IntervalCapture asIs() {
        return new IntervalCapture(Mode.AS_IS, 0);
    }

    public static IntervalCapture aroundStart(long captureRange) {
        return new IntervalCapture(Mode.AROUND_START, captureRange);
    }

    public static IntervalCapture aroundEnd(long captureRange) {
        return new IntervalCapture(Mode.AROUND_END, captureRange);
    }
}
