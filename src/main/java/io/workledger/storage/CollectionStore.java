package io.workledger.storage;

import io.workledger.error.InvalidArgumentException;
import io.workledger.error.NotFoundException;
import io.workledger.model.CollectionRecord;
import io.workledger.model.CollectionStatus;
import io.workledger.model.CollectionType;
import io.workledger.model.NewCollection;
import io.workledger.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

public final class CollectionStore {
    static final String COLUMNS = "coll_id,transform_id,scope,name,coll_type,status,total_files,bytes,storage_id,"
            + "processing_id,retries,expired_at_ms,coll_metadata,created_at_ms,updated_at_ms";

    private final Database database;

    public CollectionStore(Database database) {
        this.database = database;
    }

    public long add(long transformId, NewCollection collection) {
        return database.inTransaction("collection", c -> add(c, transformId, collection));
    }

    public long add(Connection c, long transformId, NewCollection collection) throws SQLException {
        RequestStore.requireText("scope", collection.scope());
        RequestStore.requireText("name", collection.name());
        long nowMs = System.currentTimeMillis();
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO collections(" + COLUMNS.replace("coll_id,", "") + ") VALUES(" + Rows.placeholders(14) + ")")) {
            ps.setLong(1, transformId);
            ps.setString(2, collection.scope());
            ps.setString(3, collection.name());
            ps.setString(4, collection.collType().name());
            ps.setString(5, collection.status().name());
            ps.setInt(6, collection.totalFiles());
            ps.setLong(7, collection.bytes());
            Rows.bind(ps, 8, collection.storageId());
            Rows.bind(ps, 9, collection.processingId());
            ps.setInt(10, collection.retries());
            Rows.bind(ps, 11, collection.expiredAtMs());
            ps.setString(12, Jsons.encodeMetadata(collection.collMetadata()));
            ps.setLong(13, nowMs);
            ps.setLong(14, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (SqlErrors.isUniqueViolation(e)) {
                throw SqlErrors.duplicate("collection", "transform_id:scope:name(" + transformId + ":"
                        + collection.scope() + ":" + collection.name() + ")", e);
            }
            throw e;
        }
        return RequestStore.lastInsertRowId(c);
    }

    public CollectionRecord get(long collId) {
        return database.withConnection("collection", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM collections WHERE coll_id=?")) {
                ps.setLong(1, collId);
                return single(ps, "Collection " + collId + " cannot be found");
            }
        });
    }

    public CollectionRecord get(long transformId, String scope, String name) {
        return database.withConnection("collection", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM collections WHERE transform_id=? AND scope=? AND name=?")) {
                ps.setLong(1, transformId);
                ps.setString(2, scope);
                ps.setString(3, name);
                return single(ps, "Collection " + scope + ":" + name + " of transform " + transformId
                        + " cannot be found");
            }
        });
    }

    public List<CollectionRecord> listByTransform(long transformId) {
        return database.withConnection("collection", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM collections WHERE transform_id=? ORDER BY coll_id ASC")) {
                ps.setLong(1, transformId);
                return readAll(ps);
            }
        });
    }

    /**
     * Collections in {@code scope} whose name contains {@code namePattern}.
     */
    public List<CollectionRecord> listByScopeName(String scope, String namePattern) {
        if (scope == null || namePattern == null) {
            throw new InvalidArgumentException("scope and name are both required");
        }
        return database.withConnection("collection", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM collections WHERE scope=? AND name LIKE ? ORDER BY coll_id ASC")) {
                ps.setString(1, scope);
                ps.setString(2, "%" + namePattern + "%");
                return readAll(ps);
            }
        });
    }

    public void update(long collId, CollectionUpdate update) {
        database.inTransaction("collection", c -> {
            FieldUpdate.applyExisting(c, "collections", "coll_id", collId, update, "Collection");
            return null;
        });
    }

    public void delete(long collId) {
        database.inTransaction("collection", c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM collections WHERE coll_id=?")) {
                ps.setLong(1, collId);
                if (ps.executeUpdate() == 0) {
                    throw new NotFoundException("Collection " + collId + " cannot be found");
                }
            }
            return null;
        });
    }

    public static CollectionRecord map(ResultSet rs) throws SQLException {
        return new CollectionRecord(
                rs.getLong("coll_id"),
                rs.getLong("transform_id"),
                rs.getString("scope"),
                rs.getString("name"),
                CollectionType.valueOf(rs.getString("coll_type")),
                CollectionStatus.valueOf(rs.getString("status")),
                rs.getInt("total_files"),
                rs.getLong("bytes"),
                Rows.nullableInt(rs, "storage_id"),
                Rows.nullableLong(rs, "processing_id"),
                rs.getInt("retries"),
                Rows.nullableLong(rs, "expired_at_ms"),
                Jsons.decodeMetadata(rs.getString("coll_metadata")),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static CollectionRecord single(PreparedStatement ps, String notFound) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                throw new NotFoundException(notFound);
            }
            return map(rs);
        }
    }

    private static List<CollectionRecord> readAll(PreparedStatement ps) throws SQLException {
        List<CollectionRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
        }
        return out;
    }
}
