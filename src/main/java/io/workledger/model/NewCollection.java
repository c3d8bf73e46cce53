package io.workledger.model;

import java.util.Map;

public record NewCollection(
        String scope,
        String name,
        CollectionType collType,
        CollectionStatus status,
        Integer totalFiles,
        Long bytes,
        Integer storageId,
        Long processingId,
        Integer retries,
        Long expiredAtMs,
        Map<String, Object> collMetadata
) {
    public NewCollection {
        collType = collType == null ? CollectionType.DATASET : collType;
        status = status == null ? CollectionStatus.NEW : status;
        totalFiles = totalFiles == null ? 0 : totalFiles;
        bytes = bytes == null ? 0L : bytes;
        retries = retries == null ? 0 : retries;
    }

    public static NewCollection of(String scope, String name) {
        return new NewCollection(scope, name, null, null, null, null, null, null, null, null, null);
    }

    public NewCollection withMetadata(Map<String, Object> value) {
        return new NewCollection(scope, name, collType, status, totalFiles, bytes, storageId, processingId, retries,
                expiredAtMs, value);
    }
}
