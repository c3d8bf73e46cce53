package io.workledger.commit;

import io.workledger.error.InvalidArgumentException;
import io.workledger.storage.RequestUpdate;

import java.util.List;

/**
 * Input of {@link TransformCommitter#commit}.
 *
 * @param leaseEpoch epoch returned by the claim; when set, the Request update only applies while
 *                   the caller still holds that lease
 */
public record CommitRequest(
        long requestId,
        RequestUpdate requestParameters,
        List<TransformSpec> transformsToAdd,
        List<TransformExtension> transformsToExtend,
        Long leaseEpoch
) {
    public CommitRequest {
        transformsToAdd = withoutNulls("transformsToAdd", transformsToAdd);
        transformsToExtend = withoutNulls("transformsToExtend", transformsToExtend);
    }

    private static <T> List<T> withoutNulls(String field, List<T> values) {
        if (values == null) {
            return List.of();
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new InvalidArgumentException(field + "[" + i + "] is null");
            }
        }
        return List.copyOf(values);
    }
}
