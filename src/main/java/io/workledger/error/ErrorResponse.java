package io.workledger.error;

/**
 * Transport-level failure triple. Anything that is not a {@link WorkLedgerException} is reported
 * as {@link ErrorKind#UNKNOWN} with its original message.
 */
public record ErrorResponse(int statusCode, ErrorKind kind, String message) {

    public static ErrorResponse from(Throwable error) {
        if (error instanceof WorkLedgerException) {
            WorkLedgerException known = (WorkLedgerException) error;
            return new ErrorResponse(known.kind().statusCode(), known.kind(), known.getMessage());
        }
        String message = error.getMessage() == null ? error.getClass().getName() : error.getMessage();
        return new ErrorResponse(ErrorKind.UNKNOWN.statusCode(), ErrorKind.UNKNOWN, message);
    }

    public boolean retryable() {
        return kind.retryable();
    }

    public int exitCode() {
        return kind.exitCode();
    }
}
