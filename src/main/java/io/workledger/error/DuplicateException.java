package io.workledger.error;

public final class DuplicateException extends WorkLedgerException {
    public DuplicateException(String message, Throwable cause) {
        super(ErrorKind.DUPLICATE, message, cause);
    }
}
