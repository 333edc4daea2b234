package io.lazytable.kernel.selection;

final class Ranges {

    private Ranges() {
    }

    static void checkSlice(int offset, int count, int length) {
        if (offset < 0) {
            throw new IndexOutOfBoundsException("offset must be non-negative: " + offset);
        }
        if (count < 0) {
            throw new IndexOutOfBoundsException("count must be non-negative: " + count);
        }
        if ((long) offset + count > length) {
            throw new IndexOutOfBoundsException(
                    "window [" + offset + ", " + ((long) offset + count) + ") exceeds length " + length);
        }
    }

    static void checkRow(int row, int length) {
        if (row < 0 || row >= length) {
            throw new IndexOutOfBoundsException("row out of range: " + row + " (length " + length + ")");
        }
    }
}
