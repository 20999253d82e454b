package io.modelgate.core.backend;

public class BackendException extends RuntimeException {
    private final int statusCode;

    public BackendException(String message) {
        this(message, -1, null);
    }

    public BackendException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public BackendException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public BackendException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
