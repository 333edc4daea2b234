package io.lazytable.runtime;

import io.lazytable.kernel.BoolColumn;
import io.lazytable.kernel.ColumnVector;
import io.lazytable.kernel.DoubleColumn;
import io.lazytable.kernel.FloatColumn;
import io.lazytable.kernel.IntColumn;
import io.lazytable.kernel.LongColumn;
import io.lazytable.kernel.VectorColumn;

import java.util.Locale;

/**
 * Canonical display strings for realized cell values.
 * <p>
 * Floating point values use three fixed decimals, integers their decimal form,
 * booleans {@code true}/{@code false}, and vectors the comma-joined form of their
 * elements. Formatting never throws: rows past the end of a column and unknown column
 * implementations produce placeholder strings.
 */
public final class ValueFormatter {

    public static final String NOT_AVAILABLE = "N/A";
    public static final String UNSUPPORTED = "?";
    static final String MISSING_NUMBER = "NaN";
    static final String MISSING_BOOL = "false";

    private ValueFormatter() {
    }

    /**
     * Format one cell of a realized column.
     *
     * @param column the column, may be null
     * @param row    row within the column
     * @return the display string, never null
     */
    public static String format(ColumnVector column, int row) {
        if (column == null) {
            return NOT_AVAILABLE;
        }
        if (row < 0 || row >= column.size()) {
            return missingValue(column);
        }
        if (column instanceof DoubleColumn doubles) {
            return formatDouble(doubles.get(row));
        }
        if (column instanceof FloatColumn floats) {
            return formatDouble(floats.get(row));
        }
        if (column instanceof IntColumn ints) {
            return Integer.toString(ints.get(row));
        }
        if (column instanceof LongColumn longs) {
            return Long.toString(longs.get(row));
        }
        if (column instanceof BoolColumn bools) {
            return formatBool(bools.get(row));
        }
        if (column instanceof VectorColumn vectors) {
            return joinVector(vectors, row);
        }
        return UNSUPPORTED;
    }

    public static String formatDouble(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    public static String formatBool(boolean value) {
        return value ? "true" : "false";
    }

    private static String missingValue(ColumnVector column) {
        if (column instanceof DoubleColumn || column instanceof FloatColumn
                || column instanceof IntColumn || column instanceof LongColumn) {
            return MISSING_NUMBER;
        }
        if (column instanceof BoolColumn) {
            return MISSING_BOOL;
        }
        return NOT_AVAILABLE;
    }

    private static String joinVector(VectorColumn column, int row) {
        StringBuilder out = new StringBuilder();
        switch (column.elementType()) {
            case DOUBLE -> {
                for (double value : column.doubles(row)) {
                    separate(out).append(formatDouble(value));
                }
            }
            case FLOAT -> {
                for (float value : column.floats(row)) {
                    separate(out).append(formatDouble(value));
                }
            }
            case INT -> {
                for (int value : column.ints(row)) {
                    separate(out).append(value);
                }
            }
            case LONG -> {
                for (long value : column.longs(row)) {
                    separate(out).append(value);
                }
            }
            case BOOL -> {
                for (boolean value : column.booleans(row)) {
                    separate(out).append(formatBool(value));
                }
            }
            default -> {
                return UNSUPPORTED;
            }
        }
        return out.toString();
    }

    private static StringBuilder separate(StringBuilder out) {
        if (out.length() > 0) {
            out.append(',');
        }
        return out;
    }
}
