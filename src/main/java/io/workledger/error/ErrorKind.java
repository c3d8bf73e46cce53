package io.workledger.error;

/**
 * Machine-readable failure kinds surfaced at the transport boundary.
 */
public enum ErrorKind {
    NOT_FOUND(404, 3, false),
    DUPLICATE(409, 4, false),
    INVALID_ARGUMENT(400, 2, false),
    STALE_LEASE(409, 5, false),
    BACKEND_FAILURE(503, 6, true),
    UNKNOWN(500, 1, false);

    private final int statusCode;
    private final int exitCode;
    private final boolean retryable;

    ErrorKind(int statusCode, int exitCode, boolean retryable) {
        this.statusCode = statusCode;
        this.exitCode = exitCode;
        this.retryable = retryable;
    }

    public int statusCode() {
        return statusCode;
    }

    public int exitCode() {
        return exitCode;
    }

    public boolean retryable() {
        return retryable;
    }
}
