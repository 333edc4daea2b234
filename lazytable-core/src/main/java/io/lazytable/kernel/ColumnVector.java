package io.lazytable.kernel;

/**
 * One realized column of a page: a value per row of the window it was computed for.
 * <p>
 * Implementations are immutable.
 */
public interface ColumnVector {

    OutputType type();

    int size();
}
