package io.workledger.commit;

import io.workledger.model.NewCollection;

import java.util.List;

/**
 * Collections created together with one Transform, grouped by role.
 */
public record CollectionSet(
        List<NewCollection> inputCollections,
        List<NewCollection> outputCollections,
        List<NewCollection> logCollections
) {
    public CollectionSet {
        inputCollections = inputCollections == null ? List.of() : List.copyOf(inputCollections);
        outputCollections = outputCollections == null ? List.of() : List.copyOf(outputCollections);
        logCollections = logCollections == null ? List.of() : List.copyOf(logCollections);
    }

    public boolean isEmpty() {
        return inputCollections.isEmpty() && outputCollections.isEmpty() && logCollections.isEmpty();
    }
}
