package io.workledger.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.workledger.model.Enums;
import io.workledger.model.RequestLocking;
import io.workledger.model.RequestStatus;
import io.workledger.model.RequestType;
import io.workledger.util.Jsons;

import java.util.Map;

public final class RequestUpdate extends FieldUpdate {

    public static RequestUpdate create() {
        return new RequestUpdate();
    }

    /**
     * Builds an update from loosely typed fields, as found in JSON payloads. Keys use the Java
     * field names ({@code status}, {@code processingMetadata}, ...).
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RequestUpdate fromFields(Map<String, Object> fields) {
        RequestUpdate update = new RequestUpdate();
        if (fields == null) {
            return update;
        }
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            String field = e.getKey();
            Object raw = e.getValue();
            switch (field) {
                case "requester" -> update.requester(raw == null ? null : String.valueOf(raw));
                case "requestType" -> update.requestType(Enums.parse(RequestType.class, raw));
                case "transformTag" -> update.transformTag(raw == null ? null : String.valueOf(raw));
                case "status" -> update.status(Enums.parse(RequestStatus.class, raw));
                case "locking" -> update.locking(Enums.parse(RequestLocking.class, raw));
                case "priority" -> update.priority(toInt(field, raw));
                case "workloadId" -> update.workloadId(toLong(field, raw));
                case "requestMetadata" -> update.requestMetadata(toMetadata(field, raw));
                case "processingMetadata" -> update.processingMetadata(toMetadata(field, raw));
                default -> throw unknownField("request", field);
            }
        }
        return update;
    }

    public RequestUpdate requester(String value) {
        put("requester", value);
        return this;
    }

    public RequestUpdate requestType(RequestType value) {
        put("request_type", Enums.name(value));
        return this;
    }

    public RequestUpdate transformTag(String value) {
        put("transform_tag", value);
        return this;
    }

    public RequestUpdate status(RequestStatus value) {
        put("status", Enums.name(value));
        return this;
    }

    /**
     * Setting Idle also clears the lock timestamp.
     */
    public RequestUpdate locking(RequestLocking value) {
        put("locking", Enums.name(value));
        if (value == RequestLocking.IDLE) {
            put("locked_at_ms", null);
        }
        return this;
    }

    public RequestUpdate priority(Integer value) {
        put("priority", value);
        return this;
    }

    public RequestUpdate workloadId(Long value) {
        put("workload_id", value);
        return this;
    }

    public RequestUpdate requestMetadata(Map<String, Object> value) {
        put("request_metadata", Jsons.encodeMetadata(value));
        return this;
    }

    public RequestUpdate processingMetadata(Map<String, Object> value) {
        put("processing_metadata", Jsons.encodeMetadata(value));
        return this;
    }

    RequestUpdate copy() {
        RequestUpdate out = new RequestUpdate();
        columns().forEach(out::put);
        return out;
    }

    RequestUpdate lifetime(int days, Long expiredAtMs) {
        put("lifetime", days);
        put("expired_at_ms", expiredAtMs);
        return this;
    }
}
