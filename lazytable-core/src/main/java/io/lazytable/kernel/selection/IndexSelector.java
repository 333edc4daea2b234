package io.lazytable.kernel.selection;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Rows addressed by plain integer indices into some underlying entity list.
 */
public final class IndexSelector implements RowSelector {

    private final int[] indices;
    private final int from;
    private final int length;

    private IndexSelector(int[] indices, int from, int length) {
        this.indices = indices;
        this.from = from;
        this.length = length;
    }

    /**
     * Create a selector over a copy of the given indices.
     */
    public static IndexSelector of(int... indices) {
        Objects.requireNonNull(indices, "indices");
        for (int index : indices) {
            if (index < 0) {
                throw new IllegalArgumentException("index must be non-negative: " + index);
            }
        }
        int[] copy = indices.clone();
        return new IndexSelector(copy, 0, copy.length);
    }

    /**
     * Create a selector over {@code 0, 1, ..., count - 1}.
     */
    public static IndexSelector range(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        int[] indices = new int[count];
        for (int i = 0; i < count; i++) {
            indices[i] = i;
        }
        return new IndexSelector(indices, 0, count);
    }

    @Override
    public SelectorKind kind() {
        return SelectorKind.INDEX;
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public IndexSelector slice(int offset, int count) {
        Ranges.checkSlice(offset, count, length);
        return new IndexSelector(indices, from + offset, count);
    }

    @Override
    public RowDescriptor describe(int row) {
        return new RowDescriptor.Index(row, indexAt(row));
    }

    @Override
    public Optional<TimeFrame> timeFrame() {
        return Optional.empty();
    }

    public int indexAt(int row) {
        Ranges.checkRow(row, length);
        return indices[from + row];
    }

    public int[] toIntArray() {
        return Arrays.copyOfRange(indices, from, from + length);
    }

    @Override
    public String toString() {
        return "IndexSelector[length=" + length + "]";
    }
}
