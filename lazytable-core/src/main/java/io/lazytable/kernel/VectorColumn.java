package io.lazytable.kernel;

import java.lang.reflect.Array;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Column whose cells are variable-length vectors of one element type.
 * <p>
 * Each row is stored as its own primitive array ({@code double[]} for a
 * {@code vector<double>} column, and so on). Accessors return copies.
 */
public final class VectorColumn implements ColumnVector {

    private final OutputType type;
    private final Object[] rows;

    private VectorColumn(ValueType elementType, Object[] rows) {
        this.type = OutputType.vectorOf(elementType);
        this.rows = rows;
    }

    public static VectorColumn ofBooleans(List<boolean[]> rows) {
        return new VectorColumn(ValueType.BOOL, copyRows(rows, boolean[]::clone));
    }

    public static VectorColumn ofInts(List<int[]> rows) {
        return new VectorColumn(ValueType.INT, copyRows(rows, int[]::clone));
    }

    public static VectorColumn ofLongs(List<long[]> rows) {
        return new VectorColumn(ValueType.LONG, copyRows(rows, long[]::clone));
    }

    public static VectorColumn ofFloats(List<float[]> rows) {
        return new VectorColumn(ValueType.FLOAT, copyRows(rows, float[]::clone));
    }

    public static VectorColumn ofDoubles(List<double[]> rows) {
        return new VectorColumn(ValueType.DOUBLE, copyRows(rows, double[]::clone));
    }

    private static <A> Object[] copyRows(List<A> rows, UnaryOperator<A> copier) {
        Objects.requireNonNull(rows, "rows");
        Object[] copy = new Object[rows.size()];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = copier.apply(Objects.requireNonNull(rows.get(i), "row " + i));
        }
        return copy;
    }

    @Override
    public OutputType type() {
        return type;
    }

    @Override
    public int size() {
        return rows.length;
    }

    public ValueType elementType() {
        return type.elementType();
    }

    public int elementCount(int row) {
        return Array.getLength(rowAt(row));
    }

    public boolean[] booleans(int row) {
        requireElementType(ValueType.BOOL);
        return ((boolean[]) rowAt(row)).clone();
    }

    public int[] ints(int row) {
        requireElementType(ValueType.INT);
        return ((int[]) rowAt(row)).clone();
    }

    public long[] longs(int row) {
        requireElementType(ValueType.LONG);
        return ((long[]) rowAt(row)).clone();
    }

    public float[] floats(int row) {
        requireElementType(ValueType.FLOAT);
        return ((float[]) rowAt(row)).clone();
    }

    public double[] doubles(int row) {
        requireElementType(ValueType.DOUBLE);
        return ((double[]) rowAt(row)).clone();
    }

    private Object rowAt(int row) {
        if (row < 0 || row >= rows.length) {
            throw new IndexOutOfBoundsException("row out of range: " + row);
        }
        return rows[row];
    }

    private void requireElementType(ValueType expected) {
        if (type.elementType() != expected) {
            throw new IllegalStateException("column holds " + type + ", not vector<" + expected.typeName() + ">");
        }
    }

    @Override
    public String toString() {
        return "VectorColumn[" + type + ", size=" + rows.length + "]";
    }
}
