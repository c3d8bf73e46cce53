package io.workledger.storage;

import io.workledger.error.InvalidArgumentException;
import io.workledger.error.NotFoundException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Column changes for one row. Subclasses expose typed setters per updatable field; values are
 * already in storage form (enum names, JSON text). {@code updated_at_ms} is always stamped.
 */
public abstract class FieldUpdate {
    private final Map<String, Object> columns = new LinkedHashMap<>();

    protected final void put(String column, Object value) {
        columns.put(column, value);
    }

    public final boolean isEmpty() {
        return columns.isEmpty();
    }

    public final boolean contains(String column) {
        return columns.containsKey(column);
    }

    public final Map<String, Object> columns() {
        return Collections.unmodifiableMap(columns);
    }

    protected static InvalidArgumentException unknownField(String entity, String field) {
        return new InvalidArgumentException("Unknown or read-only " + entity + " field: " + field);
    }

    protected static Integer toInt(String field, Object raw) {
        Long value = toLong(field, raw);
        return value == null ? null : Math.toIntExact(value);
    }

    protected static Long toLong(String field, Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number) {
            return ((Number) raw).longValue();
        }
        try {
            return Long.parseLong(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Field " + field + " is not an integer: " + raw, e);
        }
    }

    @SuppressWarnings("unchecked")
    protected static Map<String, Object> toMetadata(String field, Object raw) {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map)) {
            throw new InvalidArgumentException("Field " + field + " must be a JSON object");
        }
        return (Map<String, Object>) raw;
    }

    /**
     * Applies the update to the row {@code idColumn = id}, with an optional extra predicate
     * appended verbatim and bound after the id.
     *
     * @return affected rows
     */
    static int apply(Connection c, String table, String idColumn, long id, FieldUpdate update,
                     String extraPredicate, Object... extraParams) throws SQLException {
        StringBuilder sql = new StringBuilder("UPDATE ").append(table).append(" SET ");
        for (String column : update.columns.keySet()) {
            sql.append(column).append("=?,");
        }
        sql.append("updated_at_ms=? WHERE ").append(idColumn).append("=?");
        if (extraPredicate != null) {
            sql.append(" AND ").append(extraPredicate);
        }
        try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            for (Object value : update.columns.values()) {
                Rows.bind(ps, i++, value);
            }
            ps.setLong(i++, System.currentTimeMillis());
            ps.setLong(i++, id);
            for (Object extra : extraParams) {
                Rows.bind(ps, i++, extra);
            }
            return ps.executeUpdate();
        }
    }

    static void applyExisting(Connection c, String table, String idColumn, long id, FieldUpdate update,
                              String entity) throws SQLException {
        if (update.isEmpty()) {
            throw new InvalidArgumentException("Update for " + entity + " " + id + " has no fields");
        }
        if (apply(c, table, idColumn, id, update, null) == 0) {
            throw new NotFoundException(entity + " " + id + " cannot be found");
        }
    }
}
