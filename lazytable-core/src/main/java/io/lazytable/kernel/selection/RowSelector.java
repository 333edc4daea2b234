package io.lazytable.kernel.selection;

import java.util.Optional;

/**
 * The ordered row-addressing space of a logical table.
 * <p>
 * A selector only describes which rows exist and what each row stands for; it never
 * holds cell values. The set of kinds is closed: every implementation answers
 * {@link #slice(int, int)} with a selector of its own kind, so callers never need
 * to inspect the concrete type to carve out a window.
 * <p>
 * Selectors are immutable. Slices share the backing storage and the
 * {@link TimeFrame} of their parent.
 */
public sealed interface RowSelector permits IndexSelector, TimestampSelector, IntervalSelector {

    SelectorKind kind();

    /**
     * Number of rows addressed by this selector. O(1).
     */
    int length();

    /**
     * Contiguous sub-range {@code [offset, offset + count)} of this selector.
     *
     * @param offset first row of the window
     * @param count  number of rows in the window, zero allowed
     * @return a selector of the same kind with {@code length() == count}
     * @throws IndexOutOfBoundsException if the range does not fit in this selector
     */
    RowSelector slice(int offset, int count);

    /**
     * Reverse lookup of what a row stands for.
     *
     * @param row row within this selector
     * @return the addressing value of the row
     * @throws IndexOutOfBoundsException if the row is not in this selector
     */
    RowDescriptor describe(int row);

    /**
     * The time base shared by this selector and all of its slices, if any.
     */
    Optional<TimeFrame> timeFrame();

    default boolean isEmpty() {
        return length() == 0;
    }
}
