package com.athena.canaryservice.exception;

/**
 * A model artifact could not be turned into a usable predictor.
 * {@link #isNotFound()} distinguishes a missing artifact from a corrupt one.
 */
public class ModelLoadException extends RuntimeException {

    private final String path;
    private final boolean notFound;

    public ModelLoadException(String path, String message, boolean notFound) {
        super(message);
        this.path = path;
        this.notFound = notFound;
    }

    public ModelLoadException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.notFound = false;
    }

    public String getPath() {
        return path;
    }

    public boolean isNotFound() {
        return notFound;
    }
}
