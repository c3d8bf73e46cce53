package io.workledger.model;

import java.util.Map;

public record TransformRecord(
        long transformId,
        TransformType transformType,
        String transformTag,
        int priority,
        TransformStatus status,
        int retries,
        Long expiredAtMs,
        Map<String, Object> transformMetadata,
        long createdAtMs,
        long updatedAtMs
) {
}
