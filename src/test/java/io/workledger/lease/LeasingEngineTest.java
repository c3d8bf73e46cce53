package io.workledger.lease;

import io.workledger.config.WorkLedgerConfig;
import io.workledger.error.InvalidArgumentException;
import io.workledger.error.StaleLeaseException;
import io.workledger.model.NewRequest;
import io.workledger.model.RequestLocking;
import io.workledger.model.RequestRecord;
import io.workledger.model.RequestStatus;
import io.workledger.model.RequestType;
import io.workledger.storage.Database;
import io.workledger.storage.RequestStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class LeasingEngineTest {

    @Test
    void lockingClaimReturnsPreLockSnapshotAndGrantsEpoch() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-claim-");
        try {
            Database db = openDatabase(root);
            RequestStore requests = new RequestStore(db);
            LeasingEngine engine = new LeasingEngine(db, requests);
            long low = requests.add(NewRequest.of("s", "low", RequestType.STAGE_IN));
            long high = requests.add(NewRequest.of("s", "high", RequestType.STAGE_IN).withPriority(10));

            List<RequestRecord> claimed = engine.claim(ClaimFilter.locking(RequestStatus.NEW));

            Assertions.assertEquals(List.of(high, low), claimed.stream().map(RequestRecord::requestId).toList());
            for (RequestRecord r : claimed) {
                Assertions.assertEquals(RequestLocking.IDLE, r.locking());
                Assertions.assertEquals(RequestStatus.NEW, r.status());
                Assertions.assertEquals(1L, r.leaseEpoch());
                RequestRecord stored = requests.get(r.requestId());
                Assertions.assertEquals(RequestLocking.LOCKING, stored.locking());
                Assertions.assertEquals(1L, stored.leaseEpoch());
                Assertions.assertNotNull(stored.lockedAtMs());
            }
            Assertions.assertTrue(engine.claim(ClaimFilter.locking(RequestStatus.NEW)).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void claimHonoursTypeAgeAndBulkFilters() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-claim-filter-");
        try {
            Database db = openDatabase(root);
            RequestStore requests = new RequestStore(db);
            LeasingEngine engine = new LeasingEngine(db, requests);
            for (int i = 0; i < 5; i++) {
                requests.add(NewRequest.of("s", "stage." + i, RequestType.STAGE_IN));
            }
            long derivation = requests.add(NewRequest.of("s", "derive", RequestType.DERIVATION));
            requests.add(NewRequest.of("s", "done", RequestType.DERIVATION).withStatus(RequestStatus.FINISHED));

            Assertions.assertThrows(InvalidArgumentException.class,
                    () -> engine.claim(new ClaimFilter(Set.of(), null, null, true, null)));

            List<RequestRecord> peek = engine.claim(ClaimFilter.locking(RequestStatus.NEW).withLock(false).withBulkSize(3));
            Assertions.assertEquals(3, peek.size());
            Assertions.assertTrue(peek.stream().allMatch(r -> r.leaseEpoch() == 0L));

            List<RequestRecord> typed = engine.claim(ClaimFilter.locking(RequestStatus.NEW).withType(RequestType.DERIVATION));
            Assertions.assertEquals(1, typed.size());
            Assertions.assertEquals(derivation, typed.get(0).requestId());

            long now = System.currentTimeMillis();
            Assertions.assertTrue(engine.claim(ClaimFilter.locking(RequestStatus.NEW).withTimePeriod(3_600L), now).isEmpty());
            List<RequestRecord> aged = engine.claim(
                    ClaimFilter.locking(RequestStatus.NEW).withTimePeriod(60L).withBulkSize(2), now + 120_000L);
            Assertions.assertEquals(2, aged.size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentClaimsNeverOverlap() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-claim-race-");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Database db = openDatabase(root);
            RequestStore requests = new RequestStore(db);
            for (int i = 0; i < 40; i++) {
                requests.add(NewRequest.of("s", "r." + i, RequestType.OTHER));
            }
            CountDownLatch start = new CountDownLatch(1);
            List<Future<List<RequestRecord>>> futures = new ArrayList<>();
            for (int w = 0; w < 4; w++) {
                LeasingEngine engine = new LeasingEngine(db, new RequestStore(db));
                Callable<List<RequestRecord>> worker = () -> {
                    start.await();
                    List<RequestRecord> mine = new ArrayList<>();
                    for (int round = 0; round < 5; round++) {
                        mine.addAll(engine.claim(ClaimFilter.locking(RequestStatus.NEW).withBulkSize(3)));
                    }
                    return mine;
                };
                futures.add(pool.submit(worker));
            }
            start.countDown();

            Set<Long> seen = new HashSet<>();
            int total = 0;
            for (Future<List<RequestRecord>> f : futures) {
                for (RequestRecord r : f.get(60, TimeUnit.SECONDS)) {
                    total++;
                    Assertions.assertTrue(seen.add(r.requestId()), "request claimed twice: " + r.requestId());
                }
            }
            Assertions.assertEquals(40, total);
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void reclaimResetsOnlyExpiredLocks() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-reclaim-");
        try {
            Database db = openDatabase(root);
            RequestStore requests = new RequestStore(db);
            LeasingEngine engine = new LeasingEngine(db, requests);
            long old = requests.add(NewRequest.of("s", "old", RequestType.OTHER));
            long now = System.currentTimeMillis();
            engine.claim(ClaimFilter.locking(RequestStatus.NEW), now - 7_200_000L);
            long fresh = requests.add(NewRequest.of("s", "fresh", RequestType.OTHER));
            engine.claim(ClaimFilter.locking(RequestStatus.NEW), now);

            ReclaimSummary summary = engine.reclaimExpiredLocks(3_600L, now);

            Assertions.assertEquals(1, summary.reclaimed());
            Assertions.assertEquals(List.of(old), summary.requestIds());
            RequestRecord reclaimed = requests.get(old);
            Assertions.assertEquals(RequestLocking.IDLE, reclaimed.locking());
            Assertions.assertNull(reclaimed.lockedAtMs());
            Assertions.assertEquals(1L, reclaimed.leaseEpoch());
            Assertions.assertEquals(RequestLocking.LOCKING, requests.get(fresh).locking());
            Assertions.assertEquals(0, engine.reclaimExpiredLocks(3_600L, now).reclaimed());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releaseIsFencedByLeaseEpoch() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-release-");
        try {
            Database db = openDatabase(root);
            RequestStore requests = new RequestStore(db);
            LeasingEngine engine = new LeasingEngine(db, requests);
            long requestId = requests.add(NewRequest.of("s", "n", RequestType.OTHER));
            long now = System.currentTimeMillis();

            long firstEpoch = engine.claim(ClaimFilter.locking(RequestStatus.NEW), now - 7_200_000L).get(0).leaseEpoch();
            engine.reclaimExpiredLocks(3_600L, now);
            long secondEpoch = engine.claim(ClaimFilter.locking(RequestStatus.NEW), now).get(0).leaseEpoch();
            Assertions.assertEquals(firstEpoch + 1, secondEpoch);

            StaleLeaseException stale = Assertions.assertThrows(StaleLeaseException.class,
                    () -> engine.release(requestId, firstEpoch));
            Assertions.assertEquals(firstEpoch, stale.expectedEpoch());
            Assertions.assertEquals(RequestLocking.LOCKING, requests.get(requestId).locking());

            engine.release(requestId, secondEpoch);
            Assertions.assertEquals(RequestLocking.IDLE, requests.get(requestId).locking());
            Assertions.assertThrows(StaleLeaseException.class, () -> engine.release(requestId, secondEpoch));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sweeperRunOnceReportsReclaims() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-sweeper-");
        try {
            Database db = openDatabase(root);
            RequestStore requests = new RequestStore(db);
            LeasingEngine engine = new LeasingEngine(db, requests);
            requests.add(NewRequest.of("s", "n", RequestType.OTHER));
            engine.claim(ClaimFilter.locking(RequestStatus.NEW), System.currentTimeMillis() - 10_000L);

            List<ReclaimSummary> reported = new ArrayList<>();
            try (LockRecoverySweeper sweeper = new LockRecoverySweeper(engine, 5L, 60_000L, reported::add)) {
                ReclaimSummary summary = sweeper.runOnce();
                Assertions.assertEquals(1, summary.reclaimed());
                Assertions.assertEquals(0, sweeper.runOnce().reclaimed());
                sweeper.start();
                Assertions.assertTrue(sweeper.isRunning());
            }
            Assertions.assertEquals(1, reported.size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Database openDatabase(Path root) {
        Database db = new Database(WorkLedgerConfig.fromRoot(root.toString()));
        db.init();
        return db;
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
