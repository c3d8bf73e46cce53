package io.workledger.storage;

import io.workledger.error.InvalidArgumentException;
import io.workledger.error.NotFoundException;
import io.workledger.error.StaleLeaseException;
import io.workledger.model.Enums;
import io.workledger.model.NewRequest;
import io.workledger.model.RequestLocking;
import io.workledger.model.RequestRecord;
import io.workledger.model.RequestStatus;
import io.workledger.model.RequestType;
import io.workledger.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Requests table access. Besides the entity operations this class owns the claim, reclaim and
 * release statements; the transactional choreography around them lives in the leasing engine.
 */
public final class RequestStore {
    static final String COLUMNS = """
            request_id,scope,name,requester,request_type,transform_tag,status,locking,priority,lifetime,
            workload_id,request_metadata,processing_metadata,lease_epoch,locked_at_ms,created_at_ms,
            updated_at_ms,expired_at_ms""";

    private final Database database;

    public RequestStore(Database database) {
        this.database = database;
    }

    public long add(NewRequest request) {
        return database.inTransaction("request", c -> add(c, request));
    }

    public long add(Connection c, NewRequest request) throws SQLException {
        requireText("scope", request.scope());
        requireText("name", request.name());
        int lifetime = request.lifetime() == null || request.lifetime() <= 0
                ? database.config().requestLifetimeDays()
                : request.lifetime();
        long nowMs = System.currentTimeMillis();
        String sql = "INSERT INTO requests(" + COLUMNS.replace("request_id,", "")
                + ") VALUES(" + Rows.placeholders(17) + ")";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, request.scope());
            ps.setString(2, request.name());
            ps.setString(3, request.requester());
            ps.setString(4, Enums.name(request.requestType()));
            ps.setString(5, request.transformTag());
            ps.setString(6, request.status().name());
            ps.setString(7, request.locking().name());
            ps.setInt(8, request.priority());
            ps.setInt(9, lifetime);
            Rows.bind(ps, 10, workloadIdOf(request));
            ps.setString(11, Jsons.encodeMetadata(request.requestMetadata()));
            ps.setString(12, Jsons.encodeMetadata(request.processingMetadata()));
            ps.setLong(13, 0L);
            Rows.bind(ps, 14, request.locking() == RequestLocking.LOCKING ? nowMs : null);
            ps.setLong(15, nowMs);
            ps.setLong(16, nowMs);
            ps.setLong(17, nowMs + Duration.ofDays(lifetime).toMillis());
            ps.executeUpdate();
        }
        return lastInsertRowId(c);
    }

    public RequestRecord get(long requestId) {
        return database.withConnection("request", c -> get(c, requestId));
    }

    public RequestRecord get(Connection c, long requestId) throws SQLException {
        return find(c, requestId).orElseThrow(() -> new NotFoundException("Request " + requestId + " cannot be found"));
    }

    public Optional<RequestRecord> find(Connection c, long requestId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM requests WHERE request_id=?")) {
            ps.setLong(1, requestId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Most recently created Request carrying {@code workloadId}.
     */
    public RequestRecord getByWorkloadId(long workloadId) {
        return database.withConnection("request", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM requests WHERE workload_id=? ORDER BY request_id DESC LIMIT 1")) {
                ps.setLong(1, workloadId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new NotFoundException("Request with workload_id " + workloadId + " cannot be found");
                    }
                    return map(rs);
                }
            }
        });
    }

    public List<RequestRecord> list(Set<RequestStatus> statuses, RequestType type, int limit) {
        return database.withConnection("request", c -> {
            StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM requests WHERE 1=1");
            if (statuses != null && !statuses.isEmpty()) {
                sql.append(" AND status IN (").append(Rows.placeholders(statuses.size())).append(")");
            }
            if (type != null) {
                sql.append(" AND request_type=?");
            }
            sql.append(" ORDER BY request_id ASC LIMIT ?");
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                int i = 1;
                if (statuses != null && !statuses.isEmpty()) {
                    i = Rows.bindNames(ps, i, statuses);
                }
                if (type != null) {
                    ps.setString(i++, type.name());
                }
                ps.setInt(i, Math.max(1, limit));
                return readAll(ps);
            }
        });
    }

    public void update(long requestId, RequestUpdate update) {
        database.inTransaction("request", c -> {
            update(c, requestId, update);
            return null;
        });
    }

    public void update(Connection c, long requestId, RequestUpdate update) throws SQLException {
        FieldUpdate.applyExisting(c, "requests", "request_id", requestId, update, "Request");
    }

    /**
     * Applies {@code update} only while the caller still holds lease {@code leaseEpoch}. Unless the
     * update sets {@code locking} itself, the lease is released in the same statement.
     *
     * @throws StaleLeaseException when the row exists but the lease moved on
     */
    public void updateUnderLease(Connection c, long requestId, long leaseEpoch, RequestUpdate update)
            throws SQLException {
        RequestUpdate effective = update == null ? RequestUpdate.create() : update.copy();
        if (!effective.contains("locking")) {
            effective.locking(RequestLocking.IDLE);
        }
        int rows = FieldUpdate.apply(c, "requests", "request_id", requestId, effective,
                "locking=? AND lease_epoch=?", RequestLocking.LOCKING.name(), leaseEpoch);
        if (rows == 0) {
            if (find(c, requestId).isEmpty()) {
                throw new NotFoundException("Request " + requestId + " cannot be found");
            }
            throw new StaleLeaseException(requestId, leaseEpoch);
        }
    }

    /**
     * Sets a new lifetime counted from now.
     */
    public void extendLifetime(long requestId, int lifetimeDays) {
        if (lifetimeDays <= 0) {
            throw new InvalidArgumentException("Lifetime must be a positive number of days: " + lifetimeDays);
        }
        long expiredAtMs = System.currentTimeMillis() + Duration.ofDays(lifetimeDays).toMillis();
        update(requestId, RequestUpdate.create().lifetime(lifetimeDays, expiredAtMs));
    }

    public void cancel(long requestId) {
        update(requestId, RequestUpdate.create().status(RequestStatus.TO_CANCEL));
    }

    public void delete(long requestId) {
        database.inTransaction("request", c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM requests WHERE request_id=?")) {
                ps.setLong(1, requestId);
                if (ps.executeUpdate() == 0) {
                    throw new NotFoundException("Request " + requestId + " cannot be found");
                }
            }
            return null;
        });
    }

    /**
     * Candidate rows for a claim, best first: highest priority, then least recently updated.
     *
     * @param updatedBeforeMs only rows last updated before this instant, or {@code null}
     * @param idleOnly        restrict to rows nobody holds
     */
    public List<RequestRecord> findClaimCandidates(Connection c, Set<RequestStatus> statuses, RequestType type,
                                                   Long updatedBeforeMs, boolean idleOnly, int limit)
            throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM requests WHERE status IN (")
                .append(Rows.placeholders(statuses.size())).append(")");
        if (type != null) {
            sql.append(" AND request_type=?");
        }
        if (updatedBeforeMs != null) {
            sql.append(" AND updated_at_ms<?");
        }
        if (idleOnly) {
            sql.append(" AND locking=?");
        }
        sql.append(" ORDER BY priority DESC, updated_at_ms ASC, request_id ASC LIMIT ?");
        try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = Rows.bindNames(ps, 1, statuses);
            if (type != null) {
                ps.setString(i++, type.name());
            }
            if (updatedBeforeMs != null) {
                ps.setLong(i++, updatedBeforeMs);
            }
            if (idleOnly) {
                ps.setString(i++, RequestLocking.IDLE.name());
            }
            ps.setInt(i, limit);
            return readAll(ps);
        }
    }

    /**
     * Flips one Idle row to Locking and bumps its lease epoch.
     *
     * @return the granted epoch, or empty when another worker got there first
     */
    public Optional<Long> markLocked(Connection c, long requestId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE requests SET locking=?,lease_epoch=lease_epoch+1,locked_at_ms=?,updated_at_ms=? WHERE request_id=? AND locking=?")) {
            ps.setString(1, RequestLocking.LOCKING.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setLong(4, requestId);
            ps.setString(5, RequestLocking.IDLE.name());
            if (ps.executeUpdate() == 0) {
                return Optional.empty();
            }
        }
        try (PreparedStatement ps = c.prepareStatement("SELECT lease_epoch FROM requests WHERE request_id=?")) {
            ps.setLong(1, requestId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong("lease_epoch")) : Optional.empty();
            }
        }
    }

    /**
     * Ids of Locking rows whose lock is older than {@code cutoffMs}. Rows set to Locking through a
     * plain update carry no lock time and fall back to their update time.
     */
    public List<Long> findExpiredLocks(Connection c, long cutoffMs) throws SQLException {
        List<Long> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT request_id FROM requests WHERE locking=? AND COALESCE(locked_at_ms,updated_at_ms)<? ORDER BY request_id ASC")) {
            ps.setString(1, RequestLocking.LOCKING.name());
            ps.setLong(2, cutoffMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getLong("request_id"));
                }
            }
        }
        return out;
    }

    public boolean resetExpiredLock(Connection c, long requestId, long cutoffMs, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE requests SET locking=?,locked_at_ms=NULL,updated_at_ms=? WHERE request_id=? AND locking=? AND COALESCE(locked_at_ms,updated_at_ms)<?")) {
            ps.setString(1, RequestLocking.IDLE.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, requestId);
            ps.setString(4, RequestLocking.LOCKING.name());
            ps.setLong(5, cutoffMs);
            return ps.executeUpdate() == 1;
        }
    }

    /**
     * Sets the row back to Idle. With an epoch the release only succeeds for the current holder.
     */
    public void release(Connection c, long requestId, Long leaseEpoch) throws SQLException {
        if (leaseEpoch != null) {
            updateUnderLease(c, requestId, leaseEpoch, RequestUpdate.create());
            return;
        }
        update(c, requestId, RequestUpdate.create().locking(RequestLocking.IDLE));
    }

    public static RequestRecord map(ResultSet rs) throws SQLException {
        return new RequestRecord(
                rs.getLong("request_id"),
                rs.getString("scope"),
                rs.getString("name"),
                rs.getString("requester"),
                Enums.parse(RequestType.class, rs.getString("request_type")),
                rs.getString("transform_tag"),
                RequestStatus.valueOf(rs.getString("status")),
                RequestLocking.valueOf(rs.getString("locking")),
                rs.getInt("priority"),
                rs.getInt("lifetime"),
                Rows.nullableLong(rs, "workload_id"),
                Jsons.decodeMetadata(rs.getString("request_metadata")),
                Jsons.decodeMetadata(rs.getString("processing_metadata")),
                rs.getLong("lease_epoch"),
                Rows.nullableLong(rs, "locked_at_ms"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                Rows.nullableLong(rs, "expired_at_ms")
        );
    }

    private static List<RequestRecord> readAll(PreparedStatement ps) throws SQLException {
        List<RequestRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
        }
        return out;
    }

    private static Long workloadIdOf(NewRequest request) {
        Map<String, Object> metadata = request.requestMetadata();
        if (metadata == null || metadata.get("workload_id") == null) {
            return request.workloadId();
        }
        Object raw = metadata.get("workload_id");
        if (raw instanceof Number) {
            return ((Number) raw).longValue();
        }
        try {
            return Long.parseLong(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("request_metadata.workload_id is not an integer: " + raw, e);
        }
    }

    static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException(field + " is required");
        }
    }

    static long lastInsertRowId(Connection c) throws SQLException {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }
}
