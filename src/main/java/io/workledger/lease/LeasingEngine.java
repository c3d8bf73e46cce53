package io.workledger.lease;

import io.workledger.error.InvalidArgumentException;
import io.workledger.model.RequestRecord;
import io.workledger.storage.Database;
import io.workledger.storage.RequestStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Claims Requests for exclusive processing and recovers claims whose holder went away.
 *
 * <p>A locking claim runs its select and every {@code Idle -> Locking} flip inside one immediate
 * transaction, so two workers claiming with the same filter never receive the same Request. Each
 * flip bumps the Request's lease epoch; the epoch returned with the claim fences later commits
 * and releases against a lease that was reclaimed in between.
 */
public final class LeasingEngine {
    private static final Logger log = LoggerFactory.getLogger(LeasingEngine.class);

    private final Database database;
    private final RequestStore requests;

    public LeasingEngine(Database database, RequestStore requests) {
        this.database = database;
        this.requests = requests;
    }

    public List<RequestRecord> claim(ClaimFilter filter) {
        return claim(filter, System.currentTimeMillis());
    }

    /**
     * Returns the matching Requests as they were before the claim (status that made them
     * eligible, locking Idle), each carrying the lease epoch granted by this call.
     */
    public List<RequestRecord> claim(ClaimFilter filter, long nowMs) {
        if (filter == null || filter.statuses().isEmpty()) {
            throw new InvalidArgumentException("Claim needs at least one request status");
        }
        int limit = filter.bulkSize() == null || filter.bulkSize() <= 0
                ? database.config().bulkSize()
                : filter.bulkSize();
        Long updatedBeforeMs = filter.timePeriodSeconds() == null
                ? null
                : nowMs - filter.timePeriodSeconds() * 1000L;
        if (!filter.lock()) {
            return database.withConnection("claim", c -> requests.findClaimCandidates(
                    c, filter.statuses(), filter.requestType(), updatedBeforeMs, false, limit));
        }
        List<RequestRecord> claimed = database.inTransaction("claim", c -> {
            List<RequestRecord> out = new ArrayList<>();
            for (RequestRecord candidate : requests.findClaimCandidates(
                    c, filter.statuses(), filter.requestType(), updatedBeforeMs, true, limit)) {
                Optional<Long> epoch = requests.markLocked(c, candidate.requestId(), nowMs);
                if (epoch.isPresent()) {
                    out.add(candidate.withLeaseEpoch(epoch.get()));
                }
            }
            return out;
        });
        log.debug("Claimed {} requests for statuses {}", claimed.size(), filter.statuses());
        return claimed;
    }

    public ReclaimSummary reclaimExpiredLocks(long timePeriodSeconds) {
        return reclaimExpiredLocks(timePeriodSeconds, System.currentTimeMillis());
    }

    /**
     * Resets to Idle every Request locked more than {@code timePeriodSeconds} before {@code nowMs}.
     * Lease epochs are left alone, so the previous holder's epoch no longer matches once the
     * Request is claimed again.
     */
    public ReclaimSummary reclaimExpiredLocks(long timePeriodSeconds, long nowMs) {
        if (timePeriodSeconds < 0) {
            throw new InvalidArgumentException("time period must not be negative: " + timePeriodSeconds);
        }
        long cutoffMs = nowMs - timePeriodSeconds * 1000L;
        List<Long> reclaimed = database.inTransaction("reclaim locks", c -> {
            List<Long> out = new ArrayList<>();
            for (Long requestId : requests.findExpiredLocks(c, cutoffMs)) {
                if (requests.resetExpiredLock(c, requestId, cutoffMs, nowMs)) {
                    out.add(requestId);
                }
            }
            return out;
        });
        if (!reclaimed.isEmpty()) {
            log.info("Reclaimed {} expired request locks: {}", reclaimed.size(), reclaimed);
        }
        return new ReclaimSummary(reclaimed.size(), reclaimed, cutoffMs);
    }

    /**
     * Gives a lease back without touching anything else. With {@code leaseEpoch} the release is
     * rejected with a stale-lease error unless the caller is still the holder.
     */
    public void release(long requestId, Long leaseEpoch) {
        database.inTransaction("release lease", c -> {
            requests.release(c, requestId, leaseEpoch);
            return null;
        });
    }
}
