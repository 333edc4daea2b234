package io.lazytable.kernel.selection;

import java.util.Objects;

/**
 * Immutable mapping from frame index to absolute time.
 * <p>
 * A time frame is shared by reference: a selector and every window sliced from it
 * point at the same instance.
 */
public final class TimeFrame {

    private final String name;
    private final long[] times;

    private TimeFrame(String name, long[] times) {
        this.name = name;
        this.times = times;
    }

    /**
     * Create a time frame from explicit per-frame times.
     *
     * @param name  display name of the time base
     * @param times absolute time of each frame, non-decreasing
     */
    public static TimeFrame of(String name, long... times) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(times, "times");
        for (int i = 1; i < times.length; i++) {
            if (times[i] < times[i - 1]) {
                throw new IllegalArgumentException("times must be non-decreasing at frame " + i);
            }
        }
        return new TimeFrame(name, times.clone());
    }

    /**
     * Create a time frame whose frame {@code i} occurs at time {@code i}.
     */
    public static TimeFrame sequential(String name, int frameCount) {
        if (frameCount < 0) {
            throw new IllegalArgumentException("frameCount must be non-negative: " + frameCount);
        }
        long[] times = new long[frameCount];
        for (int i = 0; i < frameCount; i++) {
            times[i] = i;
        }
        return new TimeFrame(Objects.requireNonNull(name, "name"), times);
    }

    public String name() {
        return name;
    }

    public int totalFrameCount() {
        return times.length;
    }

    /**
     * Absolute time of a frame.
     *
     * @throws IndexOutOfBoundsException if the frame does not exist
     */
    public long timeAt(long frameIndex) {
        if (frameIndex < 0 || frameIndex >= times.length) {
            throw new IndexOutOfBoundsException("frame index out of range: " + frameIndex);
        }
        return times[(int) frameIndex];
    }

    @Override
    public String toString() {
        return "TimeFrame[" + name + ", frames=" + times.length + "]";
    }
}
