package io.workledger.model;

import java.util.Map;
import java.util.Optional;

public record CollectionRecord(
        long collId,
        long transformId,
        String scope,
        String name,
        CollectionType collType,
        CollectionStatus status,
        int totalFiles,
        long bytes,
        Integer storageId,
        Long processingId,
        int retries,
        Long expiredAtMs,
        Map<String, Object> collMetadata,
        long createdAtMs,
        long updatedAtMs
) {
    /**
     * Lineage recorded on output collections by the transform commit; empty for input and log
     * collections.
     */
    public Optional<CollectionLineage> lineage() {
        return CollectionLineage.parse(collMetadata);
    }
}
