package io.workledger.storage;

import io.workledger.config.WorkLedgerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite backend: schema bootstrap, connection factory and the transaction template every store
 * goes through.
 *
 * <p>Connections open write transactions with {@code BEGIN IMMEDIATE}, so a transaction that reads
 * and then writes holds the database write lock from its first statement. Concurrent writers wait
 * up to the configured busy timeout.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "workledger.schema.migration.v1";

    private final WorkLedgerConfig config;
    private final String jdbcUrl;

    public Database(WorkLedgerConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public WorkLedgerConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
        log.info("Initialized database at {}", config.dbFile());
    }

    public Connection openConnection() throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setBusyTimeout(config.busyTimeoutMs());
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return DriverManager.getConnection(jdbcUrl, sqlite.toProperties());
    }

    /**
     * Runs {@code work} inside one transaction on a fresh connection. The transaction commits when
     * {@code work} returns and rolls back on any exception. {@link SQLException}s are translated
     * by {@link SqlErrors}; runtime exceptions propagate unchanged.
     */
    public <T> T inTransaction(String action, SqlWork<T> work) {
        try (Connection c = openConnection()) {
            c.setAutoCommit(false);
            try {
                T out = work.run(c);
                c.commit();
                return out;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw SqlErrors.translate(action, e);
        }
    }

    /**
     * Runs {@code work} on a fresh auto-commit connection.
     */
    public <T> T withConnection(String action, SqlWork<T> work) {
        try (Connection c = openConnection()) {
            return work.run(c);
        } catch (SQLException e) {
            throw SqlErrors.translate(action, e);
        }
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS requests (
                        request_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        scope TEXT NOT NULL,
                        name TEXT NOT NULL,
                        requester TEXT,
                        request_type TEXT,
                        transform_tag TEXT,
                        status TEXT NOT NULL,
                        locking TEXT NOT NULL,
                        priority INTEGER NOT NULL DEFAULT 0,
                        lifetime INTEGER NOT NULL,
                        workload_id INTEGER,
                        request_metadata TEXT,
                        processing_metadata TEXT,
                        lease_epoch INTEGER NOT NULL DEFAULT 0,
                        locked_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        expired_at_ms INTEGER
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS transforms (
                        transform_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        transform_type TEXT,
                        transform_tag TEXT,
                        priority INTEGER NOT NULL DEFAULT 0,
                        status TEXT NOT NULL,
                        retries INTEGER NOT NULL DEFAULT 0,
                        expired_at_ms INTEGER,
                        transform_metadata TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS collections (
                        coll_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        transform_id INTEGER NOT NULL,
                        scope TEXT NOT NULL,
                        name TEXT NOT NULL,
                        coll_type TEXT NOT NULL,
                        status TEXT NOT NULL,
                        total_files INTEGER NOT NULL DEFAULT 0,
                        bytes INTEGER NOT NULL DEFAULT 0,
                        storage_id INTEGER,
                        processing_id INTEGER,
                        retries INTEGER NOT NULL DEFAULT 0,
                        expired_at_ms INTEGER,
                        coll_metadata TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        UNIQUE(transform_id, scope, name),
                        FOREIGN KEY(transform_id) REFERENCES transforms(transform_id)
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS contents (
                        content_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        coll_id INTEGER NOT NULL,
                        scope TEXT NOT NULL,
                        name TEXT NOT NULL,
                        min_id INTEGER,
                        max_id INTEGER,
                        content_type TEXT NOT NULL,
                        status TEXT NOT NULL,
                        bytes INTEGER NOT NULL DEFAULT 0,
                        md5 TEXT,
                        adler32 TEXT,
                        processing_id INTEGER,
                        storage_id INTEGER,
                        retries INTEGER NOT NULL DEFAULT 0,
                        path TEXT,
                        expired_at_ms INTEGER,
                        content_metadata TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(coll_id) REFERENCES collections(coll_id)
                    )
                    """);
            // Unranged files collide on (coll_id, scope, name) whatever their range columns hold.
            st.execute("""
                    CREATE UNIQUE INDEX IF NOT EXISTS uq_contents_identity
                    ON contents(coll_id, scope, name, content_type, IFNULL(min_id, -1), IFNULL(max_id, -1))
                    """);
            st.execute("""
                    CREATE UNIQUE INDEX IF NOT EXISTS uq_contents_file
                    ON contents(coll_id, scope, name) WHERE content_type = 'FILE'
                    """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_requests_status_locking ON requests(status, locking, updated_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_requests_workload ON requests(workload_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_transforms_status ON transforms(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_collections_transform ON collections(transform_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_collections_scope_name ON collections(scope, name)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_contents_coll_status ON contents(coll_id, status)");

            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261019_001_lease_recovery_index",
                "Index locked requests by lock time for the recovery sweep",
                List.of("CREATE INDEX IF NOT EXISTS idx_requests_locking_locked_at ON requests(locking, locked_at_ms)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
            log.info("Applied schema migration {}", step.version());
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        return withConnection("list schema migrations", c -> {
            List<SchemaMigrationRow> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setInt(1, safeLimit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new SchemaMigrationRow(
                                rs.getString("version"),
                                rs.getString("description"),
                                rs.getString("checksum"),
                                rs.getLong("applied_at_ms"),
                                rs.getInt("success") == 1
                        ));
                    }
                }
            }
            return out;
        });
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
