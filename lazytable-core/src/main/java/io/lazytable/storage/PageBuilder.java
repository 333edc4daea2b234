package io.lazytable.storage;

import io.lazytable.kernel.ColumnComputer;
import io.lazytable.kernel.ColumnSpec;
import io.lazytable.kernel.ColumnVector;
import io.lazytable.kernel.ComputeResult;
import io.lazytable.kernel.selection.RowSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Materializes one {@link Page} by asking a {@link ColumnComputer} for every column
 * of a window.
 * <p>
 * Columns are computed in spec order. The first column that fails aborts the whole
 * build: no partially computed page is ever returned. A column fails when the computer
 * reports a failure, throws, returns a column of the wrong length, or returns a column
 * of a type other than the one declared by its spec.
 * <p>
 * The builder holds no state besides the computer, so the same window and specs always
 * produce the same page when the computer is deterministic.
 */
public final class PageBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(PageBuilder.class);

    private final ColumnComputer computer;

    public PageBuilder(ColumnComputer computer) {
        this.computer = Objects.requireNonNull(computer, "computer");
    }

    /**
     * Build a page.
     *
     * @param pageIndex index of the page being built
     * @param startRow  logical row of the window's first row
     * @param window    rows of the page
     * @param specs     columns to compute, in display order
     * @return the built page, or the first column failure
     */
    public PageResult build(int pageIndex, int startRow, RowSelector window, List<ColumnSpec> specs) {
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(specs, "specs");

        long startNanos = System.nanoTime();
        List<ColumnVector> realized = new ArrayList<>(specs.size());
        boolean published = false;
        try {
            for (ColumnSpec spec : specs) {
                ComputeResult result;
                try {
                    result = computer.compute(window, spec);
                } catch (RuntimeException e) {
                    return failed(pageIndex, spec, "computer threw " + e.getClass().getSimpleName(), e);
                }
                if (result == null) {
                    return failed(pageIndex, spec, "computer returned no result", null);
                }
                if (result instanceof ComputeResult.Failure failure) {
                    return failed(pageIndex, spec, failure.message(), failure.cause());
                }
                ColumnVector column = ((ComputeResult.Success) result).column();
                if (column.size() != window.length()) {
                    return failed(pageIndex, spec,
                            "computed " + column.size() + " values for a window of " + window.length() + " rows", null);
                }
                if (!spec.outputType().equals(column.type())) {
                    return failed(pageIndex, spec,
                            "computed " + column.type() + " but column is declared " + spec.outputType(), null);
                }
                realized.add(column);
            }
            Page page = new Page(pageIndex, startRow, window, realized);
            published = true;
            if (LOG.isDebugEnabled()) {
                LOG.debug("Built page {} ({} rows x {} columns) in {} us",
                        pageIndex, window.length(), specs.size(), (System.nanoTime() - startNanos) / 1_000);
            }
            return new PageResult.Built(page);
        } finally {
            if (!published) {
                // drop columns computed before the failing one
                realized.clear();
            }
        }
    }

    private static PageResult failed(int pageIndex, ColumnSpec spec, String message, Throwable cause) {
        return new PageResult.Failed(new BuildFailure(pageIndex, spec.name(), message, cause));
    }
}
