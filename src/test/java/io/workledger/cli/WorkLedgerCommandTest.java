package io.workledger.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.workledger.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class WorkLedgerCommandTest {

    @Test
    void requestClaimCommitAndContentsFlow() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-cli-");
        try {
            Assertions.assertEquals(0, run(root, "init").code());

            Result added = run(root, "add-request", "--scope", "data17", "--name", "campaign",
                    "--type", "derivation", "--metadata", "{\"workload_id\": 12}");
            Assertions.assertEquals(0, added.code());
            long requestId = Jsons.mapper().readTree(added.out()).path("request_id").asLong();

            Result byWorkload = run(root, "get-request", "--workload-id", "12");
            Assertions.assertEquals(requestId, Jsons.mapper().readTree(byWorkload.out()).path("requestId").asLong());

            Result claim = run(root, "claim", "--status", "New,Ready", "--bulk-size", "5");
            JsonNode claimed = Jsons.mapper().readTree(claim.out());
            Assertions.assertEquals(1, claimed.size());
            long epoch = claimed.get(0).path("leaseEpoch").asLong();
            Assertions.assertEquals(1L, epoch);

            Path commitFile = root.resolve("commit.json");
            Files.writeString(commitFile, """
                    {
                      "requestId": %d,
                      "leaseEpoch": %d,
                      "requestParameters": {"status": "Transforming"},
                      "transformsToAdd": [{
                        "transformType": "Derivation",
                        "transformMetadata": {"workload_id": 12},
                        "collections": {
                          "inputCollections": [{"scope": "data17", "name": "in"}],
                          "outputCollections": [{"scope": "data17", "name": "out"}]
                        }
                      }]
                    }
                    """.formatted(requestId, epoch));
            Result commit = run(root, "commit-transforms", "--file", commitFile.toString());
            Assertions.assertEquals(0, commit.code(), commit.err());
            long outputColl = Jsons.mapper().readTree(commit.out())
                    .path("addedTransforms").get(0).path("outputCollections").get(0).asLong();

            Path contentsFile = root.resolve("contents.json");
            List<String> rows = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                rows.add("{\"collId\": " + outputColl + ", \"scope\": \"data17\", \"name\": \"file." + i + "\"}");
            }
            Files.writeString(contentsFile, "[" + String.join(",", rows) + "]");
            Result bulk = run(root, "add-contents", "--file", contentsFile.toString(), "--bulk-size", "2");
            Assertions.assertEquals(3, Jsons.mapper().readTree(bulk.out()).size());

            Result contentId = run(root, "content-id", "--coll-id", Long.toString(outputColl),
                    "--scope", "data17", "--name", "file.1", "--type", "File");
            Assertions.assertEquals(0, contentId.code());
            Assertions.assertTrue(Jsons.mapper().readTree(contentId.out()).path("content_id").asLong() > 0);

            Result stats = run(root, "content-stats", "--coll-id", Long.toString(outputColl));
            Assertions.assertEquals(3, Jsons.mapper().readTree(stats.out()).path("NEW").asInt());

            Result listed = run(root, "contents", "--scope", "data17", "--name", "file");
            Assertions.assertEquals(3, Jsons.mapper().readTree(listed.out()).size());

            Result migrations = run(root, "schema-migrations");
            Assertions.assertTrue(migrations.out().contains("20261019_001_lease_recovery_index"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failuresPrintTheErrorTriple() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-cli-error-");
        try {
            Result missing = run(root, "get-request", "999");
            Assertions.assertEquals(3, missing.code());
            JsonNode error = Jsons.mapper().readTree(missing.err());
            Assertions.assertEquals(404, error.path("statusCode").asInt());
            Assertions.assertEquals("NOT_FOUND", error.path("kind").asText());
            Assertions.assertTrue(error.path("message").asText().contains("999"));

            Result noFilter = run(root, "contents");
            Assertions.assertEquals(2, noFilter.code());
            Assertions.assertEquals("INVALID_ARGUMENT", Jsons.mapper().readTree(noFilter.err()).path("kind").asText());

            Result badStatus = run(root, "claim", "--status", "Sleeping");
            Assertions.assertEquals(2, badStatus.code());

            Result released = run(root, "release", "1", "--lease-epoch", "4");
            Assertions.assertEquals(3, released.code());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(Path root, String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine commandLine = WorkLedgerCommand.newCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        int code = commandLine.execute(full);
        return new Result(code, out.toString(), err.toString());
    }

    private record Result(int code, String out, String err) {
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
