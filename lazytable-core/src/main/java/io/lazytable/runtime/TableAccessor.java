package io.lazytable.runtime;

import io.lazytable.core.LazyTableConfiguration;
import io.lazytable.kernel.ColumnComputer;
import io.lazytable.kernel.ColumnSpec;
import io.lazytable.kernel.LogicalTable;
import io.lazytable.kernel.selection.RowDescriptor;
import io.lazytable.kernel.selection.RowSelector;
import io.lazytable.storage.BuildFailure;
import io.lazytable.storage.Page;
import io.lazytable.storage.PageBuilder;
import io.lazytable.storage.PageCache;
import io.lazytable.storage.PageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Random access to the cells of a logical table whose values are computed on demand.
 * <p>
 * Rows are grouped into pages of {@link #pageSize()} rows. The first access to a row
 * materializes its whole page through the configured {@link ColumnComputer}; later
 * accesses are served from a bounded page cache owned by this accessor.
 * <p>
 * Error handling:
 * <ul>
 *   <li>an invalid row or column index is a caller bug and throws {@link IndexOutOfBoundsException}</li>
 *   <li>a page that cannot be built yields {@link #ERROR_CELL} for its cells; the rest of the
 *       table stays readable</li>
 * </ul>
 * <p>
 * <b>Thread-safety:</b> every public method synchronizes on this accessor, so reconfiguration
 * never overlaps a page build. Builds run on the calling thread.
 */
public final class TableAccessor {

    private static final Logger LOG = LoggerFactory.getLogger(TableAccessor.class);

    /**
     * Cell text returned for every cell of a page that failed to build.
     */
    public static final String ERROR_CELL = "Error";

    private final PageCache pageCache;
    private final Set<Integer> reportedFailures = new HashSet<>();

    private LogicalTable table = LogicalTable.empty();
    private int pageSize;

    public TableAccessor(ColumnComputer computer) {
        this(computer, LazyTableConfiguration.defaults());
    }

    public TableAccessor(ColumnComputer computer, LazyTableConfiguration configuration) {
        Objects.requireNonNull(computer, "computer");
        Objects.requireNonNull(configuration, "configuration");
        this.pageSize = configuration.pageSize();
        this.pageCache = new PageCache(new PageBuilder(computer), configuration.pageSize(),
                configuration.cacheCapacity(), configuration.evictionPolicy());
    }

    // Configuration

    /**
     * Replace the table. Every cached page is dropped; the next read reflects the new table.
     *
     * @param selector    row addressing of the new table
     * @param columnSpecs columns of the new table, in display order
     */
    public synchronized void configure(RowSelector selector, List<ColumnSpec> columnSpecs) {
        this.table = LogicalTable.of(selector, columnSpecs);
        rebind();
        LOG.info("Configured table: {} rows x {} columns, {} selector, page size {}",
                table.totalRows(), table.columnCount(), selector.kind(), pageSize);
    }

    /**
     * Change the number of rows per page. Every cached page is dropped.
     *
     * @throws IllegalArgumentException if {@code pageSize} is not positive
     */
    public synchronized void setPageSize(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.pageSize = pageSize;
        rebind();
        LOG.debug("Page size set to {}", pageSize);
    }

    /**
     * Reset to an empty table with no rows and no columns.
     */
    public synchronized void clear() {
        this.table = LogicalTable.empty();
        rebind();
    }

    private void rebind() {
        pageCache.bind(table, pageSize);
        reportedFailures.clear();
    }

    // Reads

    public synchronized int rowCount() {
        return table.totalRows();
    }

    public synchronized int columnCount() {
        return table.columnCount();
    }

    /**
     * Display name of a column.
     *
     * @throws IndexOutOfBoundsException for an invalid column
     */
    public synchronized String header(int column) {
        return table.column(column).name();
    }

    /**
     * One-based label of a row, as shown in a row header.
     *
     * @throws IndexOutOfBoundsException for an invalid row
     */
    public synchronized String rowHeader(int row) {
        checkRow(row);
        return Integer.toString(row + 1);
    }

    /**
     * Display text of a cell.
     *
     * @param row    row in {@code [0, rowCount())}
     * @param column column in {@code [0, columnCount())}
     * @return the formatted value, or {@link #ERROR_CELL} if the row's page cannot be built
     * @throws IndexOutOfBoundsException for an invalid row or column
     */
    public synchronized String cell(int row, int column) {
        checkRow(row);
        if (column < 0 || column >= table.columnCount()) {
            throw new IndexOutOfBoundsException("column out of range: " + column + " (column count " + table.columnCount() + ")");
        }
        int pageIndex = row / pageSize;
        int localRow = row % pageSize;

        PageResult result = pageCache.getPage(pageIndex);
        if (result instanceof PageResult.Failed failed) {
            report(failed.failure());
            return ERROR_CELL;
        }
        Page page = ((PageResult.Built) result).page();
        return ValueFormatter.format(page.column(column), localRow);
    }

    /**
     * What a row stands for in its source (index, timestamp or interval).
     *
     * @throws IndexOutOfBoundsException for an invalid row
     */
    public synchronized RowDescriptor rowDescriptor(int row) {
        checkRow(row);
        return table.selector().describe(row);
    }

    private void checkRow(int row) {
        if (row < 0 || row >= table.totalRows()) {
            throw new IndexOutOfBoundsException("row out of range: " + row + " (row count " + table.totalRows() + ")");
        }
    }

    private void report(BuildFailure failure) {
        if (reportedFailures.add(failure.pageIndex())) {
            LOG.warn("Could not materialize {}", failure.describe(), failure.cause());
        } else {
            LOG.debug("Page {} still failing: {}", failure.pageIndex(), failure.message());
        }
    }

    // Diagnostics

    public synchronized int pageSize() {
        return pageSize;
    }

    public synchronized LogicalTable table() {
        return table;
    }

    public synchronized int cachedPageCount() {
        return pageCache.size();
    }

    public synchronized List<Integer> cachedPageIndices() {
        return pageCache.cachedPageIndices();
    }

    /**
     * Number of pages built successfully since this accessor was created.
     */
    public synchronized long materializedPageCount() {
        return pageCache.materializedPageCount();
    }
}
