package io.lazytable.storage;

import java.util.Objects;

/**
 * Why a page could not be materialized.
 *
 * @param pageIndex  page that was being built
 * @param columnName first column whose computation failed
 * @param message    description of the failure
 * @param cause      underlying exception, may be null
 */
public record BuildFailure(int pageIndex, String columnName, String message, Throwable cause) {

    public BuildFailure {
        Objects.requireNonNull(columnName, "columnName");
        Objects.requireNonNull(message, "message");
    }

    public String describe() {
        return "page " + pageIndex + ", column '" + columnName + "': " + message;
    }
}
