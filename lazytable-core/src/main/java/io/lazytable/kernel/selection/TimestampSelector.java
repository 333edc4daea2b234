package io.lazytable.kernel.selection;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Rows addressed by frame indices of a shared {@link TimeFrame}, one time point per row.
 */
public final class TimestampSelector implements RowSelector {

    private final long[] timestamps;
    private final int from;
    private final int length;
    private final TimeFrame timeFrame;

    private TimestampSelector(long[] timestamps, int from, int length, TimeFrame timeFrame) {
        this.timestamps = timestamps;
        this.from = from;
        this.length = length;
        this.timeFrame = timeFrame;
    }

    /**
     * Create a selector over a copy of the given frame indices.
     *
     * @param timeFrame  the time base the indices refer to
     * @param timestamps frame indices, in row order
     */
    public static TimestampSelector of(TimeFrame timeFrame, long... timestamps) {
        Objects.requireNonNull(timeFrame, "timeFrame");
        Objects.requireNonNull(timestamps, "timestamps");
        long[] copy = timestamps.clone();
        return new TimestampSelector(copy, 0, copy.length, timeFrame);
    }

    @Override
    public SelectorKind kind() {
        return SelectorKind.TIMESTAMP;
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public TimestampSelector slice(int offset, int count) {
        Ranges.checkSlice(offset, count, length);
        return new TimestampSelector(timestamps, from + offset, count, timeFrame);
    }

    @Override
    public RowDescriptor describe(int row) {
        return new RowDescriptor.Timestamp(row, timestampAt(row), timeFrame);
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

    public long timestampAt(int row) {
        Ranges.checkRow(row, length);
        return timestamps[from + row];
    }

    public long[] toLongArray() {
        return Arrays.copyOfRange(timestamps, from, from + length);
    }

    @Override
    public String toString() {
        return "TimestampSelector[length=" + length + ", timeFrame=" + timeFrame + "]";
    }
}
