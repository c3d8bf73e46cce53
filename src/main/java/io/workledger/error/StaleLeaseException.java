package io.workledger.error;

/**
 * The caller's lease epoch no longer matches the Request: the lock was reclaimed (and possibly
 * granted to another worker) after the caller claimed it.
 */
public final class StaleLeaseException extends WorkLedgerException {
    private final long requestId;
    private final long expectedEpoch;

    public StaleLeaseException(long requestId, long expectedEpoch) {
        super(ErrorKind.STALE_LEASE, "request " + requestId + " is no longer leased with epoch " + expectedEpoch);
        this.requestId = requestId;
        this.expectedEpoch = expectedEpoch;
    }

    public long requestId() {
        return requestId;
    }

    public long expectedEpoch() {
        return expectedEpoch;
    }
}
