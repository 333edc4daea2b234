package io.lazytable.core;

public class LazyTableException extends RuntimeException {

    public LazyTableException(Throwable cause) {
        super(cause);
    }

    public LazyTableException(String message, Throwable cause) {
        super(message, cause);
    }

    public LazyTableException(String message) {
        super(message);
    }

}
