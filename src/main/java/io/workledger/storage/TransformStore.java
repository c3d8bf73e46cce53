package io.workledger.storage;

import io.workledger.error.NotFoundException;
import io.workledger.model.Enums;
import io.workledger.model.NewTransform;
import io.workledger.model.TransformRecord;
import io.workledger.model.TransformStatus;
import io.workledger.model.TransformType;
import io.workledger.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public final class TransformStore {
    static final String COLUMNS = "transform_id,transform_type,transform_tag,priority,status,retries,expired_at_ms,"
            + "transform_metadata,created_at_ms,updated_at_ms";

    private final Database database;

    public TransformStore(Database database) {
        this.database = database;
    }

    public long add(NewTransform transform) {
        return database.inTransaction("transform", c -> add(c, transform));
    }

    public long add(Connection c, NewTransform transform) throws SQLException {
        long nowMs = System.currentTimeMillis();
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO transforms(transform_type,transform_tag,priority,status,retries,expired_at_ms,transform_metadata,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,?,?)")) {
            ps.setString(1, Enums.name(transform.transformType()));
            ps.setString(2, transform.transformTag());
            ps.setInt(3, transform.priority());
            ps.setString(4, transform.status().name());
            ps.setInt(5, transform.retries());
            Rows.bind(ps, 6, transform.expiredAtMs());
            ps.setString(7, Jsons.encodeMetadata(transform.transformMetadata()));
            ps.setLong(8, nowMs);
            ps.setLong(9, nowMs);
            ps.executeUpdate();
        }
        return RequestStore.lastInsertRowId(c);
    }

    public TransformRecord get(long transformId) {
        return database.withConnection("transform", c -> get(c, transformId));
    }

    public TransformRecord get(Connection c, long transformId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM transforms WHERE transform_id=?")) {
            ps.setLong(1, transformId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new NotFoundException("Transform " + transformId + " cannot be found");
                }
                return map(rs);
            }
        }
    }

    public List<TransformRecord> listByStatus(Set<TransformStatus> statuses, int limit) {
        return database.withConnection("transform", c -> {
            StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM transforms");
            if (statuses != null && !statuses.isEmpty()) {
                sql.append(" WHERE status IN (").append(Rows.placeholders(statuses.size())).append(")");
            }
            sql.append(" ORDER BY priority DESC, transform_id ASC LIMIT ?");
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                int i = 1;
                if (statuses != null && !statuses.isEmpty()) {
                    i = Rows.bindNames(ps, i, statuses);
                }
                ps.setInt(i, Math.max(1, limit));
                List<TransformRecord> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(map(rs));
                    }
                }
                return out;
            }
        });
    }

    public void update(long transformId, TransformUpdate update) {
        database.inTransaction("transform", c -> {
            update(c, transformId, update);
            return null;
        });
    }

    public void update(Connection c, long transformId, TransformUpdate update) throws SQLException {
        FieldUpdate.applyExisting(c, "transforms", "transform_id", transformId, update, "Transform");
    }

    /**
     * Deletes a Transform. Collections still referencing it make this an invalid argument.
     */
    public void delete(long transformId) {
        database.inTransaction("transform", c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM transforms WHERE transform_id=?")) {
                ps.setLong(1, transformId);
                if (ps.executeUpdate() == 0) {
                    throw new NotFoundException("Transform " + transformId + " cannot be found");
                }
            }
            return null;
        });
    }

    public static TransformRecord map(ResultSet rs) throws SQLException {
        return new TransformRecord(
                rs.getLong("transform_id"),
                Enums.parse(TransformType.class, rs.getString("transform_type")),
                rs.getString("transform_tag"),
                rs.getInt("priority"),
                TransformStatus.valueOf(rs.getString("status")),
                rs.getInt("retries"),
                Rows.nullableLong(rs, "expired_at_ms"),
                Jsons.decodeMetadata(rs.getString("transform_metadata")),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }
}
