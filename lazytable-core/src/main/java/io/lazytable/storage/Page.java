package io.lazytable.storage;

import io.lazytable.kernel.ColumnVector;
import io.lazytable.kernel.selection.RowSelector;

import java.util.List;

/**
 * A fully materialized, contiguous block of rows of a logical table.
 * <p>
 * Pages are immutable: they are created by {@link PageBuilder} and discarded on
 * eviction or invalidation, never updated in place.
 */
public final class Page {

    private final int pageIndex;
    private final int startRow;
    private final RowSelector window;
    private final List<ColumnVector> columns;

    Page(int pageIndex, int startRow, RowSelector window, List<ColumnVector> columns) {
        this.pageIndex = pageIndex;
        this.startRow = startRow;
        this.window = window;
        this.columns = List.copyOf(columns);
    }

    public int pageIndex() {
        return pageIndex;
    }

    /**
     * Row of the logical table held at local row 0.
     */
    public int startRow() {
        return startRow;
    }

    public int rowCount() {
        return window.length();
    }

    public RowSelector window() {
        return window;
    }

    public int columnCount() {
        return columns.size();
    }

    public ColumnVector column(int columnIndex) {
        if (columnIndex < 0 || columnIndex >= columns.size()) {
            throw new IndexOutOfBoundsException("column out of range: " + columnIndex);
        }
        return columns.get(columnIndex);
    }

    public List<ColumnVector> columns() {
        return columns;
    }

    @Override
    public String toString() {
        return "Page[index=" + pageIndex + ", startRow=" + startRow + ", rows=" + rowCount()
                + ", columns=" + columns.size() + "]";
    }
}
