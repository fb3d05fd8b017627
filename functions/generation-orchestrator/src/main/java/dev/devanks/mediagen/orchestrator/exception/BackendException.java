package dev.devanks.mediagen.orchestrator.exception;

/**
 * The remote service answered, but not with something we can use (non-OK envelope, missing fields).
 */
public class BackendException extends RuntimeException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
