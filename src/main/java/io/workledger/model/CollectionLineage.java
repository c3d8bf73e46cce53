package io.workledger.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derivation record embedded in an output collection's metadata: the owning transform, the
 * workload that produced it and the sibling input/log collections created in the same commit.
 */
public record CollectionLineage(
        long transformId,
        Object workloadId,
        List<Long> inputCollections,
        List<Long> logCollections
) {
    public static final String TRANSFORM_ID = "transform_id";
    public static final String WORKLOAD_ID = "workload_id";
    public static final String INPUT_COLLECTIONS = "input_collections";
    public static final String LOG_COLLECTIONS = "log_collections";

    public CollectionLineage {
        inputCollections = inputCollections == null ? List.of() : List.copyOf(inputCollections);
        logCollections = logCollections == null ? List.of() : List.copyOf(logCollections);
    }

    /**
     * Merges the lineage keys over {@code base}; lineage keys replace caller values with the same
     * name, other caller keys are kept.
     */
    public Map<String, Object> mergeInto(Map<String, Object> base) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (base != null) {
            out.putAll(base);
        }
        out.put(TRANSFORM_ID, transformId);
        out.put(WORKLOAD_ID, workloadId);
        out.put(INPUT_COLLECTIONS, inputCollections);
        out.put(LOG_COLLECTIONS, logCollections);
        return out;
    }

    public static Optional<CollectionLineage> parse(Map<String, Object> metadata) {
        if (metadata == null || !(metadata.get(TRANSFORM_ID) instanceof Number)) {
            return Optional.empty();
        }
        return Optional.of(new CollectionLineage(
                ((Number) metadata.get(TRANSFORM_ID)).longValue(),
                metadata.get(WORKLOAD_ID),
                ids(metadata.get(INPUT_COLLECTIONS)),
                ids(metadata.get(LOG_COLLECTIONS))
        ));
    }

    private static List<Long> ids(Object raw) {
        if (!(raw instanceof List)) {
            return Collections.emptyList();
        }
        List<Long> out = new ArrayList<>();
        for (Object item : (List<?>) raw) {
            if (item instanceof Number) {
                out.add(((Number) item).longValue());
            }
        }
        return out;
    }
}
