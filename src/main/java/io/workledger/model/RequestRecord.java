package io.workledger.model;

import java.util.Map;

public record RequestRecord(
        long requestId,
        String scope,
        String name,
        String requester,
        RequestType requestType,
        String transformTag,
        RequestStatus status,
        RequestLocking locking,
        int priority,
        int lifetime,
        Long workloadId,
        Map<String, Object> requestMetadata,
        Map<String, Object> processingMetadata,
        long leaseEpoch,
        Long lockedAtMs,
        long createdAtMs,
        long updatedAtMs,
        Long expiredAtMs
) {
    public RequestRecord withLeaseEpoch(long epoch) {
        return new RequestRecord(requestId, scope, name, requester, requestType, transformTag, status, locking,
                priority, lifetime, workloadId, requestMetadata, processingMetadata, epoch, lockedAtMs,
                createdAtMs, updatedAtMs, expiredAtMs);
    }
}
