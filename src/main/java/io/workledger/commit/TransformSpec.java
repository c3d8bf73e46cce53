package io.workledger.commit;

import io.workledger.model.NewTransform;
import io.workledger.model.TransformStatus;
import io.workledger.model.TransformType;

import java.util.Map;

/**
 * A Transform to create, with the Collections it owns.
 */
public record TransformSpec(
        TransformType transformType,
        String transformTag,
        Integer priority,
        TransformStatus status,
        Integer retries,
        Long expiredAtMs,
        Map<String, Object> transformMetadata,
        CollectionSet collections
) {
    public static TransformSpec of(TransformType type, Map<String, Object> metadata, CollectionSet collections) {
        return new TransformSpec(type, null, null, null, null, null, metadata, collections);
    }

    public NewTransform toNewTransform() {
        return new NewTransform(transformType, transformTag, priority, status, retries, expiredAtMs, transformMetadata);
    }
}
