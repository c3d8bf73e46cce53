package io.workledger.storage;

import io.workledger.model.ContentIdentity;
import io.workledger.model.ContentStatus;
import io.workledger.model.ContentType;

/**
 * One entry of a bulk status/path update. The row is addressed by {@code contentId} when present,
 * otherwise by its {@link ContentIdentity}: a File by name alone, another type by its range, and an
 * entry without a type by the range on whichever single content carries it.
 */
public record ContentStatusUpdate(
        Long contentId,
        Long collId,
        String scope,
        String name,
        ContentType contentType,
        Long minId,
        Long maxId,
        ContentStatus status,
        String path
) {
    public static ContentStatusUpdate byId(long contentId, ContentStatus status, String path) {
        return new ContentStatusUpdate(contentId, null, null, null, null, null, null, status, path);
    }

    public static ContentStatusUpdate byIdentity(long collId, String scope, String name, ContentType type,
                                                 Long minId, Long maxId, ContentStatus status, String path) {
        return new ContentStatusUpdate(null, collId, scope, name, type, minId, maxId, status, path);
    }

    public static ContentStatusUpdate byIdentity(long collId, String scope, String name, Long minId, Long maxId,
                                                 ContentStatus status, String path) {
        return byIdentity(collId, scope, name, null, minId, maxId, status, path);
    }

    ContentIdentity identity() {
        return ContentIdentity.of(collId, scope, name, contentType, minId, maxId);
    }
}
