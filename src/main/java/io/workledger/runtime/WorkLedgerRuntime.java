package io.workledger.runtime;

import io.workledger.commit.CommitOutcome;
import io.workledger.commit.CommitRequest;
import io.workledger.commit.TransformCommitter;
import io.workledger.config.WorkLedgerConfig;
import io.workledger.lease.ClaimFilter;
import io.workledger.lease.LeasingEngine;
import io.workledger.lease.LockRecoverySweeper;
import io.workledger.lease.ReclaimSummary;
import io.workledger.model.ContentIdentity;
import io.workledger.model.ContentRecord;
import io.workledger.model.ContentStatus;
import io.workledger.model.ContentType;
import io.workledger.model.NewContent;
import io.workledger.model.NewRequest;
import io.workledger.model.RequestRecord;
import io.workledger.observability.AuditLogger;
import io.workledger.storage.CollectionStore;
import io.workledger.storage.ContentStatusUpdate;
import io.workledger.storage.ContentStore;
import io.workledger.storage.Database;
import io.workledger.storage.RequestStore;
import io.workledger.storage.RequestUpdate;
import io.workledger.storage.TransformStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class WorkLedgerRuntime {
    private static final Logger log = LoggerFactory.getLogger(WorkLedgerRuntime.class);

    private final WorkLedgerConfig config;
    private final Database database;
    private final RequestStore requestStore;
    private final TransformStore transformStore;
    private final CollectionStore collectionStore;
    private final ContentStore contentStore;
    private final LeasingEngine leasingEngine;
    private final TransformCommitter committer;
    private final AuditLogger auditLogger;

    public WorkLedgerRuntime(WorkLedgerConfig config) {
        this.config = config;
        this.database = new Database(config);
        this.requestStore = new RequestStore(database);
        this.transformStore = new TransformStore(database);
        this.collectionStore = new CollectionStore(database);
        this.contentStore = new ContentStore(database);
        this.leasingEngine = new LeasingEngine(database, requestStore);
        this.committer = new TransformCommitter(database, requestStore, transformStore, collectionStore);
        this.auditLogger = new AuditLogger(config.auditFile());
    }

    public void init() {
        database.init();
    }

    public WorkLedgerConfig config() {
        return config;
    }

    public RequestStore requests() {
        return requestStore;
    }

    public TransformStore transforms() {
        return transformStore;
    }

    public CollectionStore collections() {
        return collectionStore;
    }

    public ContentStore contents() {
        return contentStore;
    }

    public AuditLogger audit() {
        return auditLogger;
    }

    public long addRequest(NewRequest request) {
        return requestStore.add(request);
    }

    public RequestRecord getRequest(long requestId) {
        return requestStore.get(requestId);
    }

    public RequestRecord getRequestByWorkloadId(long workloadId) {
        return requestStore.getByWorkloadId(workloadId);
    }

    public void updateRequest(long requestId, RequestUpdate update) {
        requestStore.update(requestId, update);
    }

    public void extendRequest(long requestId, int lifetimeDays) {
        requestStore.extendLifetime(requestId, lifetimeDays);
    }

    public void cancelRequest(long requestId) {
        requestStore.cancel(requestId);
    }

    public List<RequestRecord> claim(ClaimFilter filter, String actor) {
        List<RequestRecord> claimed = leasingEngine.claim(filter);
        if (filter.lock() && !claimed.isEmpty()) {
            List<Map<String, Object>> leases = claimed.stream()
                    .map(r -> Map.<String, Object>of("request_id", r.requestId(), "lease_epoch", r.leaseEpoch()))
                    .toList();
            recordAudit(AuditLogger.AuditEvent.of("request.claim", actor, "ok", null,
                    Map.of("statuses", filter.statuses(), "leases", leases)));
        }
        return claimed;
    }

    public void release(long requestId, Long leaseEpoch, String actor) {
        leasingEngine.release(requestId, leaseEpoch);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("lease_epoch", leaseEpoch);
        recordAudit(AuditLogger.AuditEvent.of("request.release", actor, "ok", requestId, details));
    }

    /**
     * @param timePeriodSeconds lock age that counts as abandoned, or {@code null} for the configured
     *                          lock timeout
     */
    public ReclaimSummary reclaimExpiredLocks(Long timePeriodSeconds) {
        long period = timePeriodSeconds == null ? config.lockTimeoutSeconds() : timePeriodSeconds;
        ReclaimSummary summary = leasingEngine.reclaimExpiredLocks(period);
        if (summary.reclaimed() > 0) {
            auditReclaim(summary);
        }
        return summary;
    }

    /**
     * A sweeper using the configured lock timeout and interval. The caller owns its lifecycle.
     */
    public LockRecoverySweeper newSweeper() {
        return new LockRecoverySweeper(leasingEngine, config.lockTimeoutSeconds(), config.sweepIntervalMs(),
                this::auditReclaim);
    }

    public CommitOutcome commitTransforms(CommitRequest request, String actor) {
        CommitOutcome outcome = committer.commit(request);
        recordAudit(AuditLogger.AuditEvent.of("request.commit", actor, "ok", request.requestId(),
                Map.of("lease_epoch", request.leaseEpoch() == null ? "none" : request.leaseEpoch(),
                        "added_transforms", outcome.addedTransforms(),
                        "extended_transforms", outcome.extendedTransforms())));
        return outcome;
    }

    public List<Long> addContents(List<NewContent> contents, Integer bulkSize, boolean returningId, String actor) {
        int size = bulkSize == null ? config.bulkSize() : bulkSize;
        ContentStore.BulkInsert result = contentStore.insertBulk(contents, size, returningId);
        recordAudit(AuditLogger.AuditEvent.of("contents.add", actor, "ok", null,
                Map.of("count", result.ids().size(), "batches", result.batches())));
        return result.ids();
    }

    public long getContentId(long collId, String scope, String name, ContentType type, Long minId, Long maxId) {
        return contentStore.getContentId(ContentIdentity.of(collId, scope, name, type, minId, maxId));
    }

    public ContentRecord getContent(long contentId) {
        return contentStore.getContent(contentId);
    }

    public List<ContentRecord> getMatchContents(long collId, String scope, String name, ContentType type,
                                                Long minId, Long maxId) {
        return contentStore.getMatchContents(collId, scope, name, type, minId, maxId);
    }

    public List<ContentRecord> getContents(String scope, String name, Long collId, Set<ContentStatus> statuses) {
        return contentStore.getContents(scope, name, collId, statuses);
    }

    public void updateContents(List<ContentStatusUpdate> updates) {
        contentStore.updateContents(updates);
    }

    public Map<ContentStatus, Long> countContentsByStatus(Long collId) {
        return contentStore.countByStatus(collId);
    }

    public List<Database.SchemaMigrationRow> listSchemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    // Runs after the audited change has committed, so a write failure is logged rather than thrown.
    private void recordAudit(AuditLogger.AuditEvent event) {
        try {
            auditLogger.log(event);
        } catch (UncheckedIOException e) {
            log.error("Failed to append audit row {} for request {}", event.action(), event.requestId(), e);
        }
    }

    private void auditReclaim(ReclaimSummary summary) {
        recordAudit(AuditLogger.AuditEvent.of("request.reclaim", "lock-sweeper", "ok", null,
                Map.of("reclaimed", summary.reclaimed(), "request_ids", summary.requestIds(),
                        "cutoff_ms", summary.cutoffMs())));
    }
}
