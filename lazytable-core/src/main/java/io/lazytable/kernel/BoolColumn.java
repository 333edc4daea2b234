package io.lazytable.kernel;

import java.util.Arrays;
import java.util.Objects;

/**
 * Scalar {@code boolean} column backed by a primitive array.
 */
public final class BoolColumn implements ColumnVector {

    private final boolean[] values;

    private BoolColumn(boolean[] values) {
        this.values = values;
    }

    public static BoolColumn of(boolean... values) {
        Objects.requireNonNull(values, "values");
        return new BoolColumn(values.clone());
    }

    @Override
    public OutputType type() {
        return OutputType.BOOL;
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
    public boolean get(int row) {
        if (row < 0 || row >= values.length) {
            throw new IndexOutOfBoundsException("row out of range: " + row);
        }
        return values[row];
    }

    public boolean[] toBooleanArray() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "BoolColumn" + Arrays.toString(values);
    }
}
