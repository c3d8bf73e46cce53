package io.workledger.commit;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.workledger.error.InvalidArgumentException;
import io.workledger.storage.TransformUpdate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field changes for an existing Transform. In JSON this is a flat object whose
 * {@code transformId} names the target and whose other keys are the fields to change.
 */
public record TransformExtension(long transformId, TransformUpdate update) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TransformExtension fromFields(Map<String, Object> fields) {
        if (fields == null || !(fields.get("transformId") instanceof Number)) {
            throw new InvalidArgumentException("Transform to extend needs a numeric transformId");
        }
        Map<String, Object> rest = new LinkedHashMap<>(fields);
        long transformId = ((Number) rest.remove("transformId")).longValue();
        return new TransformExtension(transformId, TransformUpdate.fromFields(rest));
    }
}
