package io.workledger.model;

import java.util.Map;

/**
 * Insert payload for a Request. {@code status}, {@code locking}, {@code priority} and
 * {@code lifetime} default to New, Idle, 0 and the configured lifetime when left {@code null}.
 */
public record NewRequest(
        String scope,
        String name,
        String requester,
        RequestType requestType,
        String transformTag,
        RequestStatus status,
        RequestLocking locking,
        Integer priority,
        Integer lifetime,
        Long workloadId,
        Map<String, Object> requestMetadata,
        Map<String, Object> processingMetadata
) {
    public NewRequest {
        status = status == null ? RequestStatus.NEW : status;
        locking = locking == null ? RequestLocking.IDLE : locking;
        priority = priority == null ? 0 : priority;
    }

    public static NewRequest of(String scope, String name, RequestType requestType) {
        return new NewRequest(scope, name, null, requestType, null, null, null, null, null, null, null, null);
    }

    public NewRequest withStatus(RequestStatus value) {
        return new NewRequest(scope, name, requester, requestType, transformTag, value, locking, priority, lifetime,
                workloadId, requestMetadata, processingMetadata);
    }

    public NewRequest withPriority(int value) {
        return new NewRequest(scope, name, requester, requestType, transformTag, status, locking, value, lifetime,
                workloadId, requestMetadata, processingMetadata);
    }

    public NewRequest withRequestMetadata(Map<String, Object> value) {
        return new NewRequest(scope, name, requester, requestType, transformTag, status, locking, priority, lifetime,
                workloadId, value, processingMetadata);
    }
}
