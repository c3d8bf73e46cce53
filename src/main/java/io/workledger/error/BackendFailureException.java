package io.workledger.error;

public final class BackendFailureException extends WorkLedgerException {
    public BackendFailureException(String message, Throwable cause) {
        super(ErrorKind.BACKEND_FAILURE, message, cause);
    }
}
