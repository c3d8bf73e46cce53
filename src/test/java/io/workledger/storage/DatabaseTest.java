package io.workledger.storage;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Set;

final class DatabaseTest {

    @Test
    void freshSchemaCarriesLeaseColumnsAndInitIsRepeatable() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-database-");
        try {
            Database db = RequestStoreTest.openDatabase(root);
            db.init();

            Set<String> columns = new HashSet<>();
            try (Connection c = db.openConnection();
                 Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("PRAGMA table_info(requests)")) {
                while (rs.next()) {
                    columns.add(rs.getString("name"));
                }
            }
            Assertions.assertTrue(columns.contains("lease_epoch"));
            Assertions.assertTrue(columns.contains("locked_at_ms"));

            Assertions.assertEquals(1, db.listSchemaMigrations(10).size());
            Assertions.assertEquals("20261019_001_lease_recovery_index", db.listSchemaMigrations(10).get(0).version());
        } finally {
            RequestStoreTest.deleteRecursively(root);
        }
    }
}
