package io.workledger.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.workledger.model.CollectionStatus;
import io.workledger.model.CollectionType;
import io.workledger.model.Enums;
import io.workledger.util.Jsons;

import java.util.Map;

public final class CollectionUpdate extends FieldUpdate {

    public static CollectionUpdate create() {
        return new CollectionUpdate();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CollectionUpdate fromFields(Map<String, Object> fields) {
        CollectionUpdate update = new CollectionUpdate();
        if (fields == null) {
            return update;
        }
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            String field = e.getKey();
            Object raw = e.getValue();
            switch (field) {
                case "collType" -> update.collType(Enums.parse(CollectionType.class, raw));
                case "status" -> update.status(Enums.parse(CollectionStatus.class, raw));
                case "totalFiles" -> update.totalFiles(toInt(field, raw));
                case "bytes" -> update.bytes(toLong(field, raw));
                case "storageId" -> update.storageId(toInt(field, raw));
                case "processingId" -> update.processingId(toLong(field, raw));
                case "retries" -> update.retries(toInt(field, raw));
                case "expiredAtMs" -> update.expiredAtMs(toLong(field, raw));
                case "collMetadata" -> update.collMetadata(toMetadata(field, raw));
                default -> throw unknownField("collection", field);
            }
        }
        return update;
    }

    public CollectionUpdate collType(CollectionType value) {
        put("coll_type", Enums.name(value));
        return this;
    }

    public CollectionUpdate status(CollectionStatus value) {
        put("status", Enums.name(value));
        return this;
    }

    public CollectionUpdate totalFiles(Integer value) {
        put("total_files", value);
        return this;
    }

    public CollectionUpdate bytes(Long value) {
        put("bytes", value);
        return this;
    }

    public CollectionUpdate storageId(Integer value) {
        put("storage_id", value);
        return this;
    }

    public CollectionUpdate processingId(Long value) {
        put("processing_id", value);
        return this;
    }

    public CollectionUpdate retries(Integer value) {
        put("retries", value);
        return this;
    }

    public CollectionUpdate expiredAtMs(Long value) {
        put("expired_at_ms", value);
        return this;
    }

    public CollectionUpdate collMetadata(Map<String, Object> value) {
        put("coll_metadata", Jsons.encodeMetadata(value));
        return this;
    }
}
