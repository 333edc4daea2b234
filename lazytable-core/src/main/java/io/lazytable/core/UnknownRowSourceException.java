package io.lazytable.core;

/**
 * Thrown when a textual row source cannot be resolved into a row selector,
 * either because its prefix is not recognized or because the data it names
 * is missing from the catalog.
 */
public class UnknownRowSourceException extends LazyTableException {

    private final String rowSource;

    public UnknownRowSourceException(String rowSource, String message) {
        super(message + ": " + rowSource);
        this.rowSource = rowSource;
    }

    public String rowSource() {
        return rowSource;
    }
}
