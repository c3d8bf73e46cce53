package io.workledger.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.workledger.model.ContentStatus;
import io.workledger.model.Enums;
import io.workledger.util.Jsons;

import java.util.Map;

public final class ContentUpdate extends FieldUpdate {

    public static ContentUpdate create() {
        return new ContentUpdate();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ContentUpdate fromFields(Map<String, Object> fields) {
        ContentUpdate update = new ContentUpdate();
        if (fields == null) {
            return update;
        }
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            String field = e.getKey();
            Object raw = e.getValue();
            switch (field) {
                case "status" -> update.status(Enums.parse(ContentStatus.class, raw));
                case "bytes" -> update.bytes(toLong(field, raw));
                case "md5" -> update.md5(raw == null ? null : String.valueOf(raw));
                case "adler32" -> update.adler32(raw == null ? null : String.valueOf(raw));
                case "processingId" -> update.processingId(toLong(field, raw));
                case "storageId" -> update.storageId(toInt(field, raw));
                case "retries" -> update.retries(toInt(field, raw));
                case "path" -> update.path(raw == null ? null : String.valueOf(raw));
                case "expiredAtMs" -> update.expiredAtMs(toLong(field, raw));
                case "contentMetadata" -> update.contentMetadata(toMetadata(field, raw));
                default -> throw unknownField("content", field);
            }
        }
        return update;
    }

    public ContentUpdate status(ContentStatus value) {
        put("status", Enums.name(value));
        return this;
    }

    public ContentUpdate bytes(Long value) {
        put("bytes", value);
        return this;
    }

    public ContentUpdate md5(String value) {
        put("md5", value);
        return this;
    }

    public ContentUpdate adler32(String value) {
        put("adler32", value);
        return this;
    }

    public ContentUpdate processingId(Long value) {
        put("processing_id", value);
        return this;
    }

    public ContentUpdate storageId(Integer value) {
        put("storage_id", value);
        return this;
    }

    public ContentUpdate retries(Integer value) {
        put("retries", value);
        return this;
    }

    public ContentUpdate path(String value) {
        put("path", value);
        return this;
    }

    public ContentUpdate expiredAtMs(Long value) {
        put("expired_at_ms", value);
        return this;
    }

    public ContentUpdate contentMetadata(Map<String, Object> value) {
        put("content_metadata", Jsons.encodeMetadata(value));
        return this;
    }
}
