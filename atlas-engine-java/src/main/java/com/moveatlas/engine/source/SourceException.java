package com.moveatlas.engine.source;

/**
 * Failure of a call into one of the chain sources.
 */
public class SourceException extends RuntimeException {

    private final String operation;
    private final boolean notFound;

    public SourceException(String operation, String message) {
        this(operation, message, null, false);
    }

    public SourceException(String operation, String message, Throwable cause) {
        this(operation, message, cause, false);
    }

    private SourceException(String operation, String message, Throwable cause, boolean notFound) {
        super(operation + ": " + message, cause);
        this.operation = operation;
        this.notFound = notFound;
    }

    /** The requested package or object does not exist on the queried network. */
    public static SourceException notFound(String operation, String message) {
        return new SourceException(operation, message, null, true);
    }

    public String getOperation() { return operation; }
    public boolean isNotFound()   { return notFound; }
}
