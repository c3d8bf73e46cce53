package io.workledger.lease;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs {@link LeasingEngine#reclaimExpiredLocks} on a fixed delay from a single daemon thread.
 */
public final class LockRecoverySweeper implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LockRecoverySweeper.class);

    private final LeasingEngine engine;
    private final long lockTimeoutSeconds;
    private final long intervalMs;
    private final Consumer<ReclaimSummary> onReclaim;
    private ScheduledExecutorService executor;

    public LockRecoverySweeper(LeasingEngine engine, long lockTimeoutSeconds, long intervalMs,
                               Consumer<ReclaimSummary> onReclaim) {
        this.engine = engine;
        this.lockTimeoutSeconds = lockTimeoutSeconds;
        this.intervalMs = intervalMs;
        this.onReclaim = onReclaim == null ? summary -> { } : onReclaim;
    }

    public ReclaimSummary runOnce() {
        ReclaimSummary summary = engine.reclaimExpiredLocks(lockTimeoutSeconds);
        if (summary.reclaimed() > 0) {
            onReclaim.accept(summary);
        }
        return summary;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "workledger-lock-sweeper");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::tick, 0L, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Lock recovery sweeper started: timeout={}s interval={}ms", lockTimeoutSeconds, intervalMs);
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    // An exception escaping a scheduled task cancels every later run.
    private void tick() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("Lock recovery sweep failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Lock recovery sweeper stopped");
    }
}
