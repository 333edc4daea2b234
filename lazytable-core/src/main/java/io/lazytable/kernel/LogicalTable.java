package io.lazytable.kernel;

import io.lazytable.kernel.selection.IndexSelector;
import io.lazytable.kernel.selection.RowSelector;

import java.util.List;
import java.util.Objects;

/**
 * The full conceptual table: every row the selector addresses times every configured
 * column. It is never materialized as a whole.
 * <p>
 * Immutable. Reconfiguring a table means replacing the instance.
 */
public final class LogicalTable {

    private static final LogicalTable EMPTY = new LogicalTable(IndexSelector.range(0), List.of());

    private final RowSelector selector;
    private final List<ColumnSpec> columnSpecs;

    private LogicalTable(RowSelector selector, List<ColumnSpec> columnSpecs) {
        this.selector = selector;
        this.columnSpecs = columnSpecs;
    }

    public static LogicalTable of(RowSelector selector, List<ColumnSpec> columnSpecs) {
        Objects.requireNonNull(selector, "selector");
        Objects.requireNonNull(columnSpecs, "columnSpecs");
        return new LogicalTable(selector, List.copyOf(columnSpecs));
    }

    /**
     * A table with no rows and no columns.
     */
    public static LogicalTable empty() {
        return EMPTY;
    }

    public RowSelector selector() {
        return selector;
    }

    public List<ColumnSpec> columnSpecs() {
        return columnSpecs;
    }

    public int totalRows() {
        return selector.length();
    }

    public int columnCount() {
        return columnSpecs.size();
    }

    public ColumnSpec column(int columnIndex) {
        if (columnIndex < 0 || columnIndex >= columnSpecs.size()) {
            throw new IndexOutOfBoundsException("column out of range: " + columnIndex);
        }
        return columnSpecs.get(columnIndex);
    }

    /**
     * Number of pages needed to cover every row at the given page size.
     */
    public int pageCount(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        return (int) (((long) totalRows() + pageSize - 1) / pageSize);
    }

    @Override
    public String toString() {
        return "LogicalTable[rows=" + totalRows() + ", columns=" + columnSpecs.size()
                + ", selector=" + selector.kind() + "]";
    }
}
