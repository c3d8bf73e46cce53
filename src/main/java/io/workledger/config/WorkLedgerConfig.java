package io.workledger.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.workledger.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public final class WorkLedgerConfig {
    public static final String SETTINGS_FILE = "workledger-settings.json";
    public static final int DEFAULT_BULK_SIZE = 100;
    public static final long DEFAULT_LOCK_TIMEOUT_SECONDS = 3_600L;
    public static final int DEFAULT_REQUEST_LIFETIME_DAYS = 30;
    public static final int DEFAULT_CONTENT_EXPIRY_DAYS = 30;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 60_000L;
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;

    private final Path rootDir;
    private final int bulkSize;
    private final long lockTimeoutSeconds;
    private final int requestLifetimeDays;
    private final int contentExpiryDays;
    private final long sweepIntervalMs;
    private final int busyTimeoutMs;

    public WorkLedgerConfig(Path rootDir, Settings settings) {
        Settings s = settings == null ? Settings.defaults() : settings;
        this.rootDir = rootDir;
        this.bulkSize = positive(s.bulkSize(), DEFAULT_BULK_SIZE);
        this.lockTimeoutSeconds = positive(s.lockTimeoutSeconds(), DEFAULT_LOCK_TIMEOUT_SECONDS);
        this.requestLifetimeDays = positive(s.requestLifetimeDays(), DEFAULT_REQUEST_LIFETIME_DAYS);
        this.contentExpiryDays = positive(s.contentExpiryDays(), DEFAULT_CONTENT_EXPIRY_DAYS);
        this.sweepIntervalMs = positive(s.sweepIntervalMs(), DEFAULT_SWEEP_INTERVAL_MS);
        this.busyTimeoutMs = positive(s.busyTimeoutMs(), DEFAULT_BUSY_TIMEOUT_MS);
    }

    public static WorkLedgerConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        return new WorkLedgerConfig(base, loadSettings(base.resolve(SETTINGS_FILE)));
    }

    static Settings loadSettings(Path file) {
        if (!Files.isRegularFile(file)) {
            return Settings.defaults();
        }
        try {
            return Jsons.mapper().readValue(file.toFile(), Settings.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    private static int positive(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }

    private static long positive(Long value, long fallback) {
        return value == null || value <= 0L ? fallback : value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("workledger.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public int bulkSize() {
        return bulkSize;
    }

    public long lockTimeoutSeconds() {
        return lockTimeoutSeconds;
    }

    public int requestLifetimeDays() {
        return requestLifetimeDays;
    }

    public int contentExpiryDays() {
        return contentExpiryDays;
    }

    public long sweepIntervalMs() {
        return sweepIntervalMs;
    }

    public int busyTimeoutMs() {
        return busyTimeoutMs;
    }

    /**
     * Optional overrides read from {@value #SETTINGS_FILE} in the root directory. Missing or
     * non-positive values fall back to the defaults.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Settings(
            Integer bulkSize,
            Long lockTimeoutSeconds,
            Integer requestLifetimeDays,
            Integer contentExpiryDays,
            Long sweepIntervalMs,
            Integer busyTimeoutMs
    ) {
        public static Settings defaults() {
            return new Settings(null, null, null, null, null, null);
        }
    }
}
