package io.workledger.lease;

import io.workledger.model.RequestStatus;
import io.workledger.model.RequestType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Selection for {@link LeasingEngine#claim}.
 *
 * @param statuses          eligible statuses, must not be empty
 * @param requestType       restrict to one type, or {@code null}
 * @param timePeriodSeconds only Requests not updated for this long, or {@code null}
 * @param lock              take the lease on every returned Request
 * @param bulkSize          maximum rows, or {@code null} for the configured default
 */
public record ClaimFilter(
        Set<RequestStatus> statuses,
        RequestType requestType,
        Long timePeriodSeconds,
        boolean lock,
        Integer bulkSize
) {
    public ClaimFilter {
        statuses = statuses == null || statuses.isEmpty() ? Set.of() : Set.copyOf(statuses);
    }

    public static ClaimFilter locking(RequestStatus first, RequestStatus... rest) {
        return new ClaimFilter(EnumSet.of(first, rest), null, null, true, null);
    }

    public ClaimFilter withType(RequestType value) {
        return new ClaimFilter(statuses, value, timePeriodSeconds, lock, bulkSize);
    }

    public ClaimFilter withTimePeriod(Long seconds) {
        return new ClaimFilter(statuses, requestType, seconds, lock, bulkSize);
    }

    public ClaimFilter withLock(boolean value) {
        return new ClaimFilter(statuses, requestType, timePeriodSeconds, value, bulkSize);
    }

    public ClaimFilter withBulkSize(Integer value) {
        return new ClaimFilter(statuses, requestType, timePeriodSeconds, lock, value);
    }
}
