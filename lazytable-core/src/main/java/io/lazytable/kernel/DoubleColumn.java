package io.lazytable.kernel;

import java.util.Arrays;
import java.util.Objects;

/**
 * Scalar {@code double} column backed by a primitive array.
 */
public final class DoubleColumn implements ColumnVector {

    private final double[] values;

    private DoubleColumn(double[] values) {
        this.values = values;
    }

    public static DoubleColumn of(double... values) {
        Objects.requireNonNull(values, "values");
        return new DoubleColumn(values.clone());
    }

    @Override
    public OutputType type() {
        return OutputType.DOUBLE;
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
    public double get(int row) {
        if (row < 0 || row >= values.length) {
            throw new IndexOutOfBoundsException("row out of range: " + row);
        }
        return values[row];
    }

    public double[] toDoubleArray() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "DoubleColumn" + Arrays.toString(values);
    }
}
