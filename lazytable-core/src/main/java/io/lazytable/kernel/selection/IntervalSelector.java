package io.lazytable.kernel.selection;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rows addressed by half-open frame intervals {@code [start, end)} of a shared {@link TimeFrame}.
 */
public final class IntervalSelector implements RowSelector {

    private final long[] starts;
    private final long[] ends;
    private final int from;
    private final int length;
    private final TimeFrame timeFrame;

    private IntervalSelector(long[] starts, long[] ends, int from, int length, TimeFrame timeFrame) {
        this.starts = starts;
        this.ends = ends;
        this.from = from;
        this.length = length;
        this.timeFrame = timeFrame;
    }

    /**
     * Create a selector over the given intervals, in row order.
     */
    public static IntervalSelector of(TimeFrame timeFrame, List<TimeInterval> intervals) {
        Objects.requireNonNull(timeFrame, "timeFrame");
        Objects.requireNonNull(intervals, "intervals");
        int size = intervals.size();
        long[] starts = new long[size];
        long[] ends = new long[size];
        for (int i = 0; i < size; i++) {
            TimeInterval interval = Objects.requireNonNull(intervals.get(i), "interval");
            starts[i] = interval.start();
            ends[i] = interval.end();
        }
        return new IntervalSelector(starts, ends, 0, size, timeFrame);
    }

    public static IntervalSelector of(TimeFrame timeFrame, TimeInterval... intervals) {
        return of(timeFrame, List.of(intervals));
    }

    @Override
    public SelectorKind kind() {
        return SelectorKind.INTERVAL;
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public IntervalSelector slice(int offset, int count) {
        Ranges.checkSlice(offset, count, length);
        return new IntervalSelector(starts, ends, from + offset, count, timeFrame);
    }

    @Override
    public RowDescriptor describe(int row) {
        return new RowDescriptor.Interval(row, intervalAt(row), timeFrame);
    }

    @Override
    public Optional<TimeFrame> timeFrame() {
        return Optional.of(timeFrame);
    }

    /**
     * The time base, never null.
     */
    public TimeFrame frame() {
        return timeFrame;
    }

    public TimeInterval intervalAt(int row) {
        Ranges.checkRow(row, length);
        return new TimeInterval(starts[from + row], ends[from + row]);
    }

    public long startAt(int row) {
        Ranges.checkRow(row, length);
        return starts[from + row];
    }

    public long endAt(int row) {
        Ranges.checkRow(row, length);
        return ends[from + row];
    }

    @Override
    public String toString() {
        return "IntervalSelector[length=" + length + ", timeFrame=" + timeFrame + "]";
    }
}
