package io.workledger.error;

public abstract class WorkLedgerException extends RuntimeException {
    private final ErrorKind kind;

    protected WorkLedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WorkLedgerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
