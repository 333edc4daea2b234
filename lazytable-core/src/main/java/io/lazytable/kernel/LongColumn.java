package io.lazytable.kernel;

import java.util.Arrays;
import java.util.Objects;

/**
 * Scalar {@code long} column backed by a primitive array.
 */
public final class LongColumn implements ColumnVector {

    private final long[] values;

    private LongColumn(long[] values) {
        this.values = values;
    }

    public static LongColumn of(long... values) {
        Objects.requireNonNull(values, "values");
        return new LongColumn(values.clone());
    }

    @Override
    public OutputType type() {
        return OutputType.LONG;
    }

    @Override
    public int size() {
        return values.length;
    }

    public long get(int row) {
        if (row < 0 || row >= values.length) {
            throw new IndexOutOfBoundsException("row out of range: " + row);
        }
        return values[row];
    }

    public long[] toLongArray() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "LongColumn" + Arrays.toString(values);
    }
}
