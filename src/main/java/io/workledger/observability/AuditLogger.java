package io.workledger.observability;

import com.fasterxml.jackson.core.type.TypeReference;
import io.workledger.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines trail of state-changing operations (claims, reclaims, commits, bulk
 * inserts). One compact JSON object per line.
 */
public final class AuditLogger {
    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final Path auditFile;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            Files.newOutputStream(auditFile, StandardOpenOption.CREATE, StandardOpenOption.APPEND).close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("result", event.result());
        row.put("request_id", event.requestId());
        row.put("details", event.details());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit log", e);
        }
    }

    /**
     * Last {@code limit} rows, oldest first.
     */
    public synchronized List<Map<String, Object>> tail(int limit) {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log", e);
        }
        List<Map<String, Object>> out = new ArrayList<>();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        for (String line : lines.subList(from, lines.size())) {
            if (line.isBlank()) {
                continue;
            }
            try {
                out.add(Jsons.compactMapper().readValue(line, ROW_TYPE));
            } catch (IOException e) {
                throw new IllegalStateException("Corrupt audit row: " + line, e);
            }
        }
        return out;
    }

    public Path auditFile() {
        return auditFile;
    }

    public record AuditEvent(
            String action,
            String actor,
            String result,
            Long requestId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String result, Long requestId,
                                    Map<String, Object> details) {
            return new AuditEvent(action, actor, result, requestId, details == null ? Map.of() : details);
        }
    }
}
