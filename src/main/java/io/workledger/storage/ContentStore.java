package io.workledger.storage;

import io.workledger.error.InvalidArgumentException;
import io.workledger.error.NotFoundException;
import io.workledger.model.ContentIdentity;
import io.workledger.model.ContentRecord;
import io.workledger.model.ContentStatus;
import io.workledger.model.ContentType;
import io.workledger.model.NewContent;
import io.workledger.util.Chunks;
import io.workledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ContentStore {
    private static final Logger log = LoggerFactory.getLogger(ContentStore.class);
    static final String COLUMNS = "content_id,coll_id,scope,name,min_id,max_id,content_type,status,bytes,md5,adler32,"
            + "processing_id,storage_id,retries,path,expired_at_ms,content_metadata,created_at_ms,updated_at_ms";
    private static final String INSERT = "INSERT INTO contents(" + COLUMNS.replace("content_id,", "")
            + ") VALUES(" + Rows.placeholders(18) + ")";

    private final Database database;

    public ContentStore(Database database) {
        this.database = database;
    }

    public long add(NewContent content) {
        return database.inTransaction("content", c -> add(c, content));
    }

    /**
     * @return the new id, or {@code null} when {@code returningId} is false
     */
    public Long add(NewContent content, boolean returningId) {
        long id = add(content);
        return returningId ? id : null;
    }

    public long add(Connection c, NewContent content) throws SQLException {
        validate(content);
        try (PreparedStatement ps = c.prepareStatement(INSERT)) {
            bindInsert(ps, content, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (SqlErrors.isUniqueViolation(e)) {
                throw SqlErrors.duplicate("content", identityKey(content), e);
            }
            throw e;
        }
        return RequestStore.lastInsertRowId(c);
    }

    /**
     * Inserts {@code contents} in chunks of {@code bulkSize}, one JDBC batch per chunk, all inside
     * one transaction. A duplicate anywhere fails the whole call.
     *
     * @return one entry per input, in input order: the new id, or {@code null} when ids were not
     * requested
     */
    public List<Long> addContents(List<NewContent> contents, int bulkSize, boolean returningId) {
        return insertBulk(contents, bulkSize, returningId).ids();
    }

    public BulkInsert insertBulk(List<NewContent> contents, int bulkSize, boolean returningId) {
        if (contents == null || contents.isEmpty()) {
            return new BulkInsert(List.of(), 0);
        }
        int size = bulkSize <= 0 ? database.config().bulkSize() : bulkSize;
        contents.forEach(ContentStore::validate);
        List<List<NewContent>> chunks = Chunks.partition(contents, size);
        BulkInsert result = database.inTransaction("content", c -> {
            List<Long> out = new ArrayList<>(contents.size());
            int batches = 0;
            try (PreparedStatement ps = c.prepareStatement(INSERT)) {
                for (List<NewContent> chunk : chunks) {
                    long nowMs = System.currentTimeMillis();
                    for (NewContent content : chunk) {
                        bindInsert(ps, content, nowMs);
                        ps.addBatch();
                    }
                    try {
                        ps.executeBatch();
                    } catch (SQLException e) {
                        if (SqlErrors.isUniqueViolation(e)) {
                            throw SqlErrors.duplicate("content", "batch " + identityKey(chunk.get(0))
                                    + " .. " + identityKey(chunk.get(chunk.size() - 1)), e);
                        }
                        throw e;
                    }
                    batches++;
                    // Rowids are handed out contiguously while this transaction holds the write lock.
                    long last = RequestStore.lastInsertRowId(c);
                    for (int i = chunk.size() - 1; i >= 0; i--) {
                        out.add(returningId ? last - i : null);
                    }
                }
            }
            return new BulkInsert(Collections.unmodifiableList(out), batches);
        });
        log.debug("Inserted {} contents in {} batches", contents.size(), result.batches());
        return result;
    }

    public record BulkInsert(List<Long> ids, int batches) {
    }

    public long getContentId(ContentIdentity identity) {
        return database.withConnection("content", c -> {
            try (PreparedStatement ps = identityQuery(c, "content_id", identity)) {
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw notFound(identity);
                    }
                    return rs.getLong("content_id");
                }
            }
        });
    }

    public long getContentId(long collId, String scope, String name, ContentType type, Long minId, Long maxId) {
        return getContentId(ContentIdentity.of(collId, scope, name, type, minId, maxId));
    }

    public ContentRecord getContent(long contentId) {
        return database.withConnection("content", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM contents WHERE content_id=?")) {
                ps.setLong(1, contentId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new NotFoundException("Content " + contentId + " cannot be found");
                    }
                    return map(rs);
                }
            }
        });
    }

    public ContentRecord getContent(ContentIdentity identity) {
        return database.withConnection("content", c -> {
            try (PreparedStatement ps = identityQuery(c, COLUMNS, identity)) {
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw notFound(identity);
                    }
                    return map(rs);
                }
            }
        });
    }

    /**
     * Contents covering the requested range. Files match by name; other types match every stored
     * range with {@code min_id <= minId} and {@code max_id >= maxId}. Without a type and without a
     * full range, every content of that name matches.
     */
    public List<ContentRecord> getMatchContents(long collId, String scope, String name, ContentType type,
                                                Long minId, Long maxId) {
        boolean ranged = minId != null && maxId != null;
        if (type != null && type != ContentType.FILE && !ranged) {
            throw new InvalidArgumentException("min_id and max_id are required to match " + type + " contents");
        }
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS)
                .append(" FROM contents WHERE coll_id=? AND scope=? AND name=?");
        if (type != null) {
            sql.append(" AND content_type=?");
        }
        if (type != ContentType.FILE && ranged) {
            sql.append(" AND min_id<=? AND max_id>=?");
        }
        sql.append(" ORDER BY content_id ASC");
        return database.withConnection("content", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                int i = 1;
                ps.setLong(i++, collId);
                ps.setString(i++, scope);
                ps.setString(i++, name);
                if (type != null) {
                    ps.setString(i++, type.name());
                }
                if (type != ContentType.FILE && ranged) {
                    ps.setLong(i++, minId);
                    ps.setLong(i, maxId);
                }
                return readAll(ps);
            }
        });
    }

    /**
     * Filtered listing. {@code name} is a substring pattern and only applies together with
     * {@code scope}; at least one of (scope and name), {@code collId} or {@code statuses} must be
     * given.
     */
    public List<ContentRecord> getContents(String scope, String name, Long collId, Set<ContentStatus> statuses) {
        boolean byName = scope != null && !scope.isBlank() && name != null && !name.isBlank();
        boolean byStatus = statuses != null && !statuses.isEmpty();
        if (!byName && collId == null && !byStatus) {
            throw new InvalidArgumentException(
                    "Both (scope:" + scope + " and name:" + name + ") and coll_id:" + collId + " status:" + statuses
                            + " are not fully provided");
        }
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM contents WHERE 1=1");
        if (collId != null) {
            sql.append(" AND coll_id=?");
        }
        if (byName) {
            sql.append(" AND scope=? AND name LIKE ?");
        }
        if (byStatus) {
            sql.append(" AND status IN (").append(Rows.placeholders(statuses.size())).append(")");
        }
        sql.append(" ORDER BY content_id ASC");
        return database.withConnection("content", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                int i = 1;
                if (collId != null) {
                    ps.setLong(i++, collId);
                }
                if (byName) {
                    ps.setString(i++, scope);
                    ps.setString(i++, "%" + name + "%");
                }
                if (byStatus) {
                    Rows.bindNames(ps, i, statuses);
                }
                return readAll(ps);
            }
        });
    }

    /**
     * Number of contents per status, optionally within one collection. Statuses with no contents
     * are absent from the result.
     */
    public Map<ContentStatus, Long> countByStatus(Long collId) {
        String sql = collId == null
                ? "SELECT status, COUNT(*) AS n FROM contents GROUP BY status"
                : "SELECT status, COUNT(*) AS n FROM contents WHERE coll_id=? GROUP BY status";
        return database.withConnection("content statistics", c -> {
            Map<ContentStatus, Long> out = new EnumMap<>(ContentStatus.class);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                if (collId != null) {
                    ps.setLong(1, collId);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.put(ContentStatus.valueOf(rs.getString("status")), rs.getLong("n"));
                    }
                }
            }
            return out;
        });
    }

    public void update(long contentId, ContentUpdate update) {
        database.inTransaction("content", c -> {
            FieldUpdate.applyExisting(c, "contents", "content_id", contentId, update, "Content");
            return null;
        });
    }

    /**
     * Sets status and path on every addressed content in one transaction. An entry that matches no
     * row aborts the whole call.
     */
    public void updateContents(List<ContentStatusUpdate> updates) {
        if (updates == null || updates.isEmpty()) {
            return;
        }
        for (ContentStatusUpdate u : updates) {
            if (u.contentId() == null && (u.collId() == null || u.scope() == null || u.name() == null)) {
                throw new InvalidArgumentException("Content update needs content_id or coll_id, scope and name: " + u);
            }
            if (u.status() == null) {
                throw new InvalidArgumentException("Content update needs a status: " + u);
            }
        }
        database.inTransaction("content", c -> {
            long nowMs = System.currentTimeMillis();
            try (PreparedStatement byId = c.prepareStatement(
                    "UPDATE contents SET status=?,path=?,updated_at_ms=? WHERE content_id=?")) {
                for (ContentStatusUpdate u : updates) {
                    int rows;
                    if (u.contentId() != null) {
                        bindStatus(byId, u, nowMs);
                        byId.setLong(4, u.contentId());
                        rows = byId.executeUpdate();
                    } else {
                        rows = updateByIdentity(c, u, nowMs);
                    }
                    if (rows == 0) {
                        throw new NotFoundException("Content cannot be found: " + u);
                    }
                    if (rows > 1) {
                        throw new InvalidArgumentException(
                                "Content update matches " + rows + " contents, give a content_type: " + u);
                    }
                }
            }
            return null;
        });
    }

    private static int updateByIdentity(Connection c, ContentStatusUpdate u, long nowMs) throws SQLException {
        ContentIdentity identity = u.identity();
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE contents SET status=?,path=?,updated_at_ms=? WHERE " + identityPredicate(identity))) {
            bindStatus(ps, u, nowMs);
            bindIdentity(ps, 4, identity);
            return ps.executeUpdate();
        }
    }

    private static void bindStatus(PreparedStatement ps, ContentStatusUpdate u, long nowMs) throws SQLException {
        ps.setString(1, u.status().name());
        ps.setString(2, u.path());
        ps.setLong(3, nowMs);
    }

    public void delete(long contentId) {
        database.inTransaction("content", c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM contents WHERE content_id=?")) {
                ps.setLong(1, contentId);
                if (ps.executeUpdate() == 0) {
                    throw new NotFoundException("Content " + contentId + " cannot be found");
                }
            }
            return null;
        });
    }

    public static ContentRecord map(ResultSet rs) throws SQLException {
        return new ContentRecord(
                rs.getLong("content_id"),
                rs.getLong("coll_id"),
                rs.getString("scope"),
                rs.getString("name"),
                Rows.nullableLong(rs, "min_id"),
                Rows.nullableLong(rs, "max_id"),
                ContentType.valueOf(rs.getString("content_type")),
                ContentStatus.valueOf(rs.getString("status")),
                rs.getLong("bytes"),
                rs.getString("md5"),
                rs.getString("adler32"),
                Rows.nullableLong(rs, "processing_id"),
                Rows.nullableInt(rs, "storage_id"),
                rs.getInt("retries"),
                rs.getString("path"),
                Rows.nullableLong(rs, "expired_at_ms"),
                Jsons.decodeMetadata(rs.getString("content_metadata")),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private PreparedStatement identityQuery(Connection c, String columns, ContentIdentity identity) throws SQLException {
        PreparedStatement ps = c.prepareStatement("SELECT " + columns + " FROM contents WHERE "
                + identityPredicate(identity) + " ORDER BY content_id ASC LIMIT 1");
        bindIdentity(ps, 1, identity);
        return ps;
    }

    // Files are keyed by name alone; an untyped identity matches the range on any type.
    private static String identityPredicate(ContentIdentity identity) {
        return switch (identity.kind()) {
            case UNRANGED -> "coll_id=? AND scope=? AND name=? AND content_type=?";
            case RANGED -> "coll_id=? AND scope=? AND name=? AND content_type=? AND min_id IS ? AND max_id IS ?";
            case UNTYPED -> "coll_id=? AND scope=? AND name=? AND min_id IS ? AND max_id IS ?";
        };
    }

    private static void bindIdentity(PreparedStatement ps, int index, ContentIdentity identity) throws SQLException {
        int i = index;
        ps.setLong(i++, identity.collId());
        ps.setString(i++, identity.scope());
        ps.setString(i++, identity.name());
        switch (identity.kind()) {
            case UNRANGED -> ps.setString(i, ContentType.FILE.name());
            case RANGED -> {
                ContentIdentity.Ranged ranged = (ContentIdentity.Ranged) identity;
                ps.setString(i++, ranged.contentType().name());
                Rows.bind(ps, i++, ranged.minId());
                Rows.bind(ps, i, ranged.maxId());
            }
            case UNTYPED -> {
                ContentIdentity.Untyped untyped = (ContentIdentity.Untyped) identity;
                Rows.bind(ps, i++, untyped.minId());
                Rows.bind(ps, i, untyped.maxId());
            }
            default -> throw new IllegalStateException("Unknown identity kind: " + identity.kind());
        }
    }

    private void bindInsert(PreparedStatement ps, NewContent content, long nowMs) throws SQLException {
        Long expiredAtMs = content.expiredAtMs() != null
                ? content.expiredAtMs()
                : nowMs + Duration.ofDays(database.config().contentExpiryDays()).toMillis();
        ps.setLong(1, content.collId());
        ps.setString(2, content.scope());
        ps.setString(3, content.name());
        Rows.bind(ps, 4, content.minId());
        Rows.bind(ps, 5, content.maxId());
        ps.setString(6, content.contentType().name());
        ps.setString(7, content.status().name());
        ps.setLong(8, content.bytes());
        ps.setString(9, content.md5());
        ps.setString(10, content.adler32());
        Rows.bind(ps, 11, content.processingId());
        Rows.bind(ps, 12, content.storageId());
        ps.setInt(13, content.retries());
        ps.setString(14, content.path());
        ps.setLong(15, expiredAtMs);
        ps.setString(16, Jsons.encodeMetadata(content.contentMetadata()));
        ps.setLong(17, nowMs);
        ps.setLong(18, nowMs);
    }

    private static void validate(NewContent content) {
        RequestStore.requireText("scope", content.scope());
        RequestStore.requireText("name", content.name());
    }

    private static String identityKey(NewContent content) {
        return "coll_id:scope:name:content_type:min_id:max_id(" + content.collId() + ":" + content.scope() + ":"
                + content.name() + ":" + content.contentType() + ":" + content.minId() + ":" + content.maxId() + ")";
    }

    private static NotFoundException notFound(ContentIdentity identity) {
        return new NotFoundException("Content " + identity + " cannot be found");
    }

    private static List<ContentRecord> readAll(PreparedStatement ps) throws SQLException {
        List<ContentRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
        }
        return out;
    }
}
