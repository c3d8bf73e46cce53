package io.workledger.model;

import java.util.Map;

public record NewTransform(
        TransformType transformType,
        String transformTag,
        Integer priority,
        TransformStatus status,
        Integer retries,
        Long expiredAtMs,
        Map<String, Object> transformMetadata
) {
    public NewTransform {
        priority = priority == null ? 0 : priority;
        status = status == null ? TransformStatus.NEW : status;
        retries = retries == null ? 0 : retries;
    }

    /**
     * Workload id carried in the transform metadata, or {@code null} when the metadata has none.
     */
    public Object workloadId() {
        return transformMetadata == null ? null : transformMetadata.get("workload_id");
    }
}
