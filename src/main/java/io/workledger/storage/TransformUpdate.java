package io.workledger.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.workledger.model.Enums;
import io.workledger.model.TransformStatus;
import io.workledger.model.TransformType;
import io.workledger.util.Jsons;

import java.util.Map;

public final class TransformUpdate extends FieldUpdate {

    public static TransformUpdate create() {
        return new TransformUpdate();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TransformUpdate fromFields(Map<String, Object> fields) {
        TransformUpdate update = new TransformUpdate();
        if (fields == null) {
            return update;
        }
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            String field = e.getKey();
            Object raw = e.getValue();
            switch (field) {
                case "transformType" -> update.transformType(Enums.parse(TransformType.class, raw));
                case "transformTag" -> update.transformTag(raw == null ? null : String.valueOf(raw));
                case "priority" -> update.priority(toInt(field, raw));
                case "status" -> update.status(Enums.parse(TransformStatus.class, raw));
                case "retries" -> update.retries(toInt(field, raw));
                case "expiredAtMs" -> update.expiredAtMs(toLong(field, raw));
                case "transformMetadata" -> update.transformMetadata(toMetadata(field, raw));
                default -> throw unknownField("transform", field);
            }
        }
        return update;
    }

    public TransformUpdate transformType(TransformType value) {
        put("transform_type", Enums.name(value));
        return this;
    }

    public TransformUpdate transformTag(String value) {
        put("transform_tag", value);
        return this;
    }

    public TransformUpdate priority(Integer value) {
        put("priority", value);
        return this;
    }

    public TransformUpdate status(TransformStatus value) {
        put("status", Enums.name(value));
        return this;
    }

    public TransformUpdate retries(Integer value) {
        put("retries", value);
        return this;
    }

    public TransformUpdate expiredAtMs(Long value) {
        put("expired_at_ms", value);
        return this;
    }

    public TransformUpdate transformMetadata(Map<String, Object> value) {
        put("transform_metadata", Jsons.encodeMetadata(value));
        return this;
    }
}
