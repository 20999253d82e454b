package io.modelgate.core.gateway;

/**
 * The caller named a backend that was never registered, or nothing is registered at all.
 * This is a caller error and is never retried.
 */
public class UnknownBackendException extends IllegalArgumentException {

    public UnknownBackendException(String message) {
        super(message);
    }
}
