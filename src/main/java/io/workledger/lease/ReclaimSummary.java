package io.workledger.lease;

import java.util.List;

public record ReclaimSummary(int reclaimed, List<Long> requestIds, long cutoffMs) {
    public ReclaimSummary {
        requestIds = requestIds == null ? List.of() : List.copyOf(requestIds);
    }
}
