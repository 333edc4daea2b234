package io.lazytable.kernel;

import java.util.Arrays;
import java.util.Objects;

/**
 * Scalar {@code float} column. Formatted like {@link DoubleColumn}.
 */
public final class FloatColumn implements ColumnVector {

    private final float[] values;

    private FloatColumn(float[] values) {
        this.values = values;
    }

    public static FloatColumn of(float... values) {
        Objects.requireNonNull(values, "values");
        return new FloatColumn(values.clone());
    }

    @Override
    public OutputType type() {
        return OutputType.FLOAT;
    }

    @Override
    public int size() {
        return values.length;
    }

    public float get(int row) {
        if (row < 0 || row >= values.length) {
            throw new IndexOutOfBoundsException("row out of range: " + row);
        }
        return values[row];
    }

    public float[] toFloatArray() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "FloatColumn" + Arrays.toString(values);
    }
}
