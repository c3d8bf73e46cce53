package io.workledger.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.workledger.commit.CommitOutcome;
import io.workledger.commit.CommitRequest;
import io.workledger.config.WorkLedgerConfig;
import io.workledger.error.ErrorResponse;
import io.workledger.error.InvalidArgumentException;
import io.workledger.error.WorkLedgerException;
import io.workledger.lease.ClaimFilter;
import io.workledger.lease.LockRecoverySweeper;
import io.workledger.lease.ReclaimSummary;
import io.workledger.model.ContentStatus;
import io.workledger.model.ContentType;
import io.workledger.model.Enums;
import io.workledger.model.NewContent;
import io.workledger.model.NewRequest;
import io.workledger.model.RequestStatus;
import io.workledger.model.RequestType;
import io.workledger.runtime.WorkLedgerRuntime;
import io.workledger.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "workledger",
        mixinStandardHelpOptions = true,
        description = "WorkLedger request/transform/content ledger CLI",
        subcommands = {
                WorkLedgerCommand.InitCommand.class,
                WorkLedgerCommand.AddRequestCommand.class,
                WorkLedgerCommand.GetRequestCommand.class,
                WorkLedgerCommand.ClaimCommand.class,
                WorkLedgerCommand.ReleaseCommand.class,
                WorkLedgerCommand.ReclaimLocksCommand.class,
                WorkLedgerCommand.SweepCommand.class,
                WorkLedgerCommand.CommitTransformsCommand.class,
                WorkLedgerCommand.AddContentsCommand.class,
                WorkLedgerCommand.ContentIdCommand.class,
                WorkLedgerCommand.ContentsCommand.class,
                WorkLedgerCommand.ContentStatsCommand.class,
                WorkLedgerCommand.SchemaMigrationsCommand.class
        }
)
public final class WorkLedgerCommand implements Runnable {
    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<NewContent>> CONTENTS_TYPE = new TypeReference<>() {
    };

    @Spec
    CommandSpec spec;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--actor"}, description = "Worker identity recorded in the audit trail", defaultValue = "cli")
    String actor;

    /**
     * Command line with the failure triple printed as JSON on stderr and the error kind's exit code.
     */
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new WorkLedgerCommand());
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            ErrorResponse error = ErrorResponse.from(ex);
            cmd.getErr().println(Jsons.toCompactJson(error));
            cmd.getErr().flush();
            return error.exitCode();
        });
        return commandLine;
    }

    @Override
    public void run() {
        out().println("Use subcommands: init | add-request | get-request | claim | release | reclaim-locks | sweep | commit-transforms | add-contents | content-id | contents | content-stats | schema-migrations");
        out().flush();
    }

    WorkLedgerRuntime runtime() {
        WorkLedgerRuntime runtime = new WorkLedgerRuntime(WorkLedgerConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    void print(Object value) {
        out().println(Jsons.toJson(value));
        out().flush();
    }

    static Map<String, Object> parseObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Jsons.mapper().readValue(raw, OBJECT_TYPE);
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException("Not a JSON object: " + raw, e);
        }
    }

    static <T> T readFile(String file, TypeReference<T> type) throws IOException {
        try {
            return Jsons.mapper().readValue(Path.of(file).toFile(), type);
        } catch (JsonProcessingException e) {
            if (e.getCause() instanceof WorkLedgerException) {
                throw (WorkLedgerException) e.getCause();
            }
            throw new InvalidArgumentException("Malformed JSON in " + file + ": " + e.getOriginalMessage(), e);
        }
    }

    static <E extends Enum<E>> Set<E> parseSet(Class<E> type, List<String> raw) {
        Set<E> out = EnumSet.noneOf(type);
        if (raw == null) {
            return out;
        }
        for (String item : raw) {
            for (String part : item.split(",")) {
                if (!part.isBlank()) {
                    out.add(Enums.parse(type, part));
                }
            }
        }
        return out;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Override
        public Integer call() {
            WorkLedgerRuntime runtime = parent.runtime();
            parent.out().println("Initialized WorkLedger at: " + runtime.config().rootDir());
            parent.out().flush();
            return 0;
        }
    }

    @Command(name = "add-request", description = "Add a request")
    static final class AddRequestCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Option(names = {"--scope"}, required = true, description = "Scope of the request data")
        String scope;

        @Option(names = {"--name"}, required = true, description = "Name of the request data")
        String name;

        @Option(names = {"--requester"}, description = "Requester, such as a workload manager or a user")
        String requester;

        @Option(names = {"--type"}, description = "Request type, e.g. EventStreaming, StageIn")
        String type;

        @Option(names = {"--transform-tag"}, description = "Transform tag")
        String transformTag;

        @Option(names = {"--priority"}, description = "Priority, higher first")
        Integer priority;

        @Option(names = {"--lifetime"}, description = "Lifetime in days")
        Integer lifetime;

        @Option(names = {"--workload-id"}, description = "External workload id")
        Long workloadId;

        @Option(names = {"--metadata"}, description = "Request metadata as a JSON object")
        String metadata;

        @Override
        public Integer call() {
            NewRequest request = new NewRequest(scope, name, requester, Enums.parse(RequestType.class, type),
                    transformTag, null, null, priority, lifetime, workloadId, parseObject(metadata), null);
            long requestId = parent.runtime().addRequest(request);
            parent.print(Map.of("request_id", requestId));
            return 0;
        }
    }

    @Command(name = "get-request", description = "Show a request by id or workload id")
    static final class GetRequestCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Request id")
        Long requestId;

        @Option(names = {"--workload-id"}, description = "Look the request up by workload id")
        Long workloadId;

        @Override
        public Integer call() {
            if ((requestId == null) == (workloadId == null)) {
                throw new InvalidArgumentException("Give exactly one of a request id or --workload-id");
            }
            WorkLedgerRuntime runtime = parent.runtime();
            parent.print(requestId != null ? runtime.getRequest(requestId) : runtime.getRequestByWorkloadId(workloadId));
            return 0;
        }
    }

    @Command(name = "claim", description = "Claim requests by status (and optionally type and age)")
    static final class ClaimCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Option(names = {"--status"}, required = true, split = ",", description = "Eligible statuses")
        List<String> statuses;

        @Option(names = {"--type"}, description = "Request type")
        String type;

        @Option(names = {"--time-period"}, description = "Only requests not updated for this many seconds")
        Long timePeriodSeconds;

        @Option(names = {"--no-lock"}, defaultValue = "false", description = "Read only, take no lease")
        boolean noLock;

        @Option(names = {"--bulk-size"}, description = "Maximum requests to return")
        Integer bulkSize;

        @Override
        public Integer call() {
            ClaimFilter filter = new ClaimFilter(parseSet(RequestStatus.class, statuses),
                    Enums.parse(RequestType.class, type), timePeriodSeconds, !noLock, bulkSize);
            parent.print(parent.runtime().claim(filter, parent.actor));
            return 0;
        }
    }

    @Command(name = "release", description = "Give a request lease back")
    static final class ReleaseCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Parameters(index = "0", description = "Request id")
        long requestId;

        @Option(names = {"--lease-epoch"}, description = "Epoch returned by the claim")
        Long leaseEpoch;

        @Override
        public Integer call() {
            parent.runtime().release(requestId, leaseEpoch, parent.actor);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("request_id", requestId);
            out.put("released", true);
            parent.print(out);
            return 0;
        }
    }

    @Command(name = "reclaim-locks", description = "Reset locks older than the time period to Idle")
    static final class ReclaimLocksCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Option(names = {"--time-period"}, description = "Lock age in seconds; defaults to the configured lock timeout")
        Long timePeriodSeconds;

        @Override
        public Integer call() {
            parent.print(parent.runtime().reclaimExpiredLocks(timePeriodSeconds));
            return 0;
        }
    }

    @Command(name = "sweep", description = "Run the lock recovery sweep once or until interrupted")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run a single sweep and exit")
        boolean once;

        @Override
        public Integer call() throws InterruptedException {
            WorkLedgerRuntime runtime = parent.runtime();
            LockRecoverySweeper sweeper = runtime.newSweeper();
            if (once) {
                ReclaimSummary summary = sweeper.runOnce();
                parent.print(summary);
                return 0;
            }
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                sweeper.close();
                stopped.countDown();
            }, "workledger-shutdown-hook"));
            sweeper.start();
            stopped.await();
            return 0;
        }
    }

    @Command(name = "commit-transforms", description = "Commit transforms and a request update from a JSON file")
    static final class CommitTransformsCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Option(names = {"--file"}, required = true, description = "Commit request JSON file")
        String file;

        @Override
        public Integer call() throws IOException {
            CommitRequest request = readFile(file, new TypeReference<CommitRequest>() {
            });
            CommitOutcome outcome = parent.runtime().commitTransforms(request, parent.actor);
            parent.print(outcome);
            return 0;
        }
    }

    @Command(name = "add-contents", description = "Bulk insert contents from a JSON array file")
    static final class AddContentsCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Option(names = {"--file"}, required = true, description = "JSON array of contents")
        String file;

        @Option(names = {"--bulk-size"}, description = "Rows per batch")
        Integer bulkSize;

        @Option(names = {"--no-ids"}, defaultValue = "false", description = "Do not report generated ids")
        boolean noIds;

        @Override
        public Integer call() throws IOException {
            List<NewContent> contents = readFile(file, CONTENTS_TYPE);
            parent.print(parent.runtime().addContents(contents, bulkSize, !noIds, parent.actor));
            return 0;
        }
    }

    @Command(name = "content-id", description = "Look up a content id by its identity")
    static final class ContentIdCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Option(names = {"--coll-id"}, required = true, description = "Collection id")
        long collId;

        @Option(names = {"--scope"}, required = true, description = "Content scope")
        String scope;

        @Option(names = {"--name"}, required = true, description = "Content name")
        String name;

        @Option(names = {"--type"}, description = "Content type: File, Event, PseudoContent")
        String type;

        @Option(names = {"--min-id"}, description = "Range start")
        Long minId;

        @Option(names = {"--max-id"}, description = "Range end")
        Long maxId;

        @Override
        public Integer call() {
            long contentId = parent.runtime().getContentId(collId, scope, name,
                    Enums.parse(ContentType.class, type), minId, maxId);
            parent.print(Map.of("content_id", contentId));
            return 0;
        }
    }

    @Command(name = "contents", description = "List contents by scope and name pattern, collection or status")
    static final class ContentsCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Option(names = {"--scope"}, description = "Content scope")
        String scope;

        @Option(names = {"--name"}, description = "Substring of the content name")
        String name;

        @Option(names = {"--coll-id"}, description = "Collection id")
        Long collId;

        @Option(names = {"--status"}, split = ",", description = "Content statuses")
        List<String> statuses;

        @Override
        public Integer call() {
            parent.print(parent.runtime().getContents(scope, name, collId, parseSet(ContentStatus.class, statuses)));
            return 0;
        }
    }

    @Command(name = "content-stats", description = "Count contents by status")
    static final class ContentStatsCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Option(names = {"--coll-id"}, description = "Restrict to one collection")
        Long collId;

        @Override
        public Integer call() {
            parent.print(parent.runtime().countContentsByStatus(collId));
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "Show the applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        WorkLedgerCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            parent.print(parent.runtime().listSchemaMigrations(limit));
            return 0;
        }
    }
}
