package io.workledger.commit;

import java.util.List;

public record CommitOutcome(long requestId, List<AddedTransform> addedTransforms, List<Long> extendedTransforms) {

    public record AddedTransform(
            long transformId,
            List<Long> inputCollections,
            List<Long> outputCollections,
            List<Long> logCollections
    ) {
    }
}
