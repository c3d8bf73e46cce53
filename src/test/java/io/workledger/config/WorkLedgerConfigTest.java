package io.workledger.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

final class WorkLedgerConfigTest {

    @Test
    void defaultsApplyWithoutSettingsFile() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-config-");
        try {
            WorkLedgerConfig config = WorkLedgerConfig.fromRoot(root.toString());
            Assertions.assertEquals(root.toAbsolutePath().normalize(), config.rootDir());
            Assertions.assertEquals(WorkLedgerConfig.DEFAULT_BULK_SIZE, config.bulkSize());
            Assertions.assertEquals(WorkLedgerConfig.DEFAULT_LOCK_TIMEOUT_SECONDS, config.lockTimeoutSeconds());
            Assertions.assertEquals(WorkLedgerConfig.DEFAULT_REQUEST_LIFETIME_DAYS, config.requestLifetimeDays());
            Assertions.assertEquals(WorkLedgerConfig.DEFAULT_CONTENT_EXPIRY_DAYS, config.contentExpiryDays());
            Assertions.assertEquals(root.toAbsolutePath().normalize().resolve("workledger.db"), config.dbFile());
            Assertions.assertTrue(config.auditFile().startsWith(config.auditRoot()));
        } finally {
            Files.deleteIfExists(root);
        }
    }

    @Test
    void settingsFileOverridesAndNonPositiveValuesFallBack() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-config-");
        Path settings = root.resolve(WorkLedgerConfig.SETTINGS_FILE);
        try {
            Files.writeString(settings, """
                    {
                      "bulkSize": 25,
                      "lockTimeoutSeconds": 90,
                      "requestLifetimeDays": 0,
                      "contentExpiryDays": -4,
                      "unrelatedKey": "ignored"
                    }
                    """);
            WorkLedgerConfig config = WorkLedgerConfig.fromRoot(root.toString());
            Assertions.assertEquals(25, config.bulkSize());
            Assertions.assertEquals(90L, config.lockTimeoutSeconds());
            Assertions.assertEquals(WorkLedgerConfig.DEFAULT_REQUEST_LIFETIME_DAYS, config.requestLifetimeDays());
            Assertions.assertEquals(WorkLedgerConfig.DEFAULT_CONTENT_EXPIRY_DAYS, config.contentExpiryDays());
            Assertions.assertEquals(WorkLedgerConfig.DEFAULT_SWEEP_INTERVAL_MS, config.sweepIntervalMs());
        } finally {
            Files.deleteIfExists(settings);
            Files.deleteIfExists(root);
        }
    }

    @Test
    void malformedSettingsFileIsRejected() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-config-");
        Path settings = root.resolve(WorkLedgerConfig.SETTINGS_FILE);
        try {
            Files.writeString(settings, "{ not json");
            Assertions.assertThrows(IllegalStateException.class, () -> WorkLedgerConfig.loadSettings(settings));
        } finally {
            Files.deleteIfExists(settings);
            Files.deleteIfExists(root);
        }
    }
}
