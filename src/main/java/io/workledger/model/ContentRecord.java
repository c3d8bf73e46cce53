package io.workledger.model;

import java.util.Map;

public record ContentRecord(
        long contentId,
        long collId,
        String scope,
        String name,
        Long minId,
        Long maxId,
        ContentType contentType,
        ContentStatus status,
        long bytes,
        String md5,
        String adler32,
        Long processingId,
        Integer storageId,
        int retries,
        String path,
        Long expiredAtMs,
        Map<String, Object> contentMetadata,
        long createdAtMs,
        long updatedAtMs
) {
    public ContentIdentity identity() {
        return ContentIdentity.of(collId, scope, name, contentType, minId, maxId);
    }
}
