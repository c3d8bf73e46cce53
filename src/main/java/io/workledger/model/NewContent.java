package io.workledger.model;

import java.util.Map;

/**
 * Insert payload for a Content. Type, status, size and retries default to File, New, 0 and 0;
 * a {@code null} expiry is filled in by the store from the configured content expiry.
 */
public record NewContent(
        long collId,
        String scope,
        String name,
        Long minId,
        Long maxId,
        ContentType contentType,
        ContentStatus status,
        Long bytes,
        String md5,
        String adler32,
        Long processingId,
        Integer storageId,
        Integer retries,
        String path,
        Long expiredAtMs,
        Map<String, Object> contentMetadata
) {
    public NewContent {
        contentType = contentType == null ? ContentType.FILE : contentType;
        status = status == null ? ContentStatus.NEW : status;
        bytes = bytes == null ? 0L : bytes;
        retries = retries == null ? 0 : retries;
    }

    public static NewContent file(long collId, String scope, String name) {
        return new NewContent(collId, scope, name, null, null, ContentType.FILE, null, null, null, null, null, null,
                null, null, null, null);
    }

    public static NewContent range(long collId, String scope, String name, ContentType type, long minId, long maxId) {
        return new NewContent(collId, scope, name, minId, maxId, type, null, null, null, null, null, null,
                null, null, null, null);
    }

    public NewContent withStatus(ContentStatus value) {
        return new NewContent(collId, scope, name, minId, maxId, contentType, value, bytes, md5, adler32,
                processingId, storageId, retries, path, expiredAtMs, contentMetadata);
    }

    public NewContent withMetadata(Map<String, Object> value) {
        return new NewContent(collId, scope, name, minId, maxId, contentType, status, bytes, md5, adler32,
                processingId, storageId, retries, path, expiredAtMs, value);
    }

    public ContentIdentity identity() {
        return ContentIdentity.of(collId, scope, name, contentType, minId, maxId);
    }
}
