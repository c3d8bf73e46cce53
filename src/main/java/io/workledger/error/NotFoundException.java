package io.workledger.error;

public final class NotFoundException extends WorkLedgerException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
