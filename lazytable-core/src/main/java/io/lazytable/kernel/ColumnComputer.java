package io.lazytable.kernel;

import io.lazytable.kernel.selection.RowSelector;

/**
 * Computes the values of one column for an arbitrary window of rows.
 * <p>
 * A successful result must hold exactly {@code window.length()} values. Failures are
 * reported through {@link ComputeResult#failure(String)} rather than thrown.
 */
@FunctionalInterface
public interface ColumnComputer {

    ComputeResult compute(RowSelector window, ColumnSpec spec);
}
