package io.lazytable.kernel;

import java.util.Arrays;
import java.util.Objects;

/**
 * Scalar {@code int} column backed by a primitive array.
 */
public final class IntColumn implements ColumnVector {

    private final int[] values;

    private IntColumn(int[] values) {
        this.values = values;
    }

    public static IntColumn of(int... values) {
        Objects.requireNonNull(values, "values");
        return new IntColumn(values.clone());
    }

    @Override
    public OutputType type() {
        return OutputType.INT;
    }

    @Override
    public int size() {
        return values.length;
    }

    /**
     * Get the value at a row.
     *
     * @throws IndexOutOfBoundsException if the row is past the column
     */
    public int get(int row) {
        if (row < 0 || row >= values.length) {
            throw new IndexOutOfBoundsException("row out of range: " + row);
        }
        return values[row];
    }

    public int[] toIntArray() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "IntColumn" + Arrays.toString(values);
    }
}
