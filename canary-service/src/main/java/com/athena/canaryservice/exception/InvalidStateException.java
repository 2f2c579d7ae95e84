package com.athena.canaryservice.exception;

/**
 * A lifecycle transition was requested from a phase that does not allow it.
 */
public class InvalidStateException extends RuntimeException {
    public InvalidStateException(String message) {
        super(message);
    }
}
