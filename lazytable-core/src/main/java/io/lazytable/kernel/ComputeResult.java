package io.lazytable.kernel;

import java.util.Objects;

/**
 * Outcome of a single {@link ColumnComputer} call.
 */
public sealed interface ComputeResult {

    static ComputeResult success(ColumnVector column) {
        return new Success(column);
    }

    static ComputeResult failure(String message) {
        return new Failure(message, null);
    }

    static ComputeResult failure(String message, Throwable cause) {
        return new Failure(message, cause);
    }

    record Success(ColumnVector column) implements ComputeResult {
        public Success {
            Objects.requireNonNull(column, "column");
        }
    }

    /**
     * @param message what went wrong
     * @param cause   underlying exception, may be null
     */
    record Failure(String message, Throwable cause) implements ComputeResult {
        public Failure {
            Objects.requireNonNull(message, "message");
        }
    }
}
