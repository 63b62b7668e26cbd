package com.flagship.split_ledger.notification;

import com.flagship.split_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Debounced, coalescing change counter per (user, group).
 *
 * How it works:
 * 1. {@link #notify} accumulates the increment into the pending entry of each
 *    key and (re)arms that key's timer for the quiet window
 * 2. When a timer fires without a newer notify, the entry is removed and
 *    written as exactly one update through {@link ChangeTrackingWriter}
 * 3. A failed write puts the batch back, merged with anything that arrived
 *    meanwhile, until {@code maxFlushAttempts} is reached
 *
 * A fired timer only writes the entry it was armed for ({@code remove(key, entry)}),
 * so a timer that lost a race with a newer notify does nothing and no
 * increment is counted twice or dropped.
 *
 * Lifecycle is owned by the Spring context: {@link #init()} on start,
 * {@link #teardown()} (which drains) on shutdown.
 */
@Slf4j
public class ChangeNotificationTracker {

    private final ChangeTrackingWriter writer;
    private final Duration debounceWindow;
    private final int schedulerThreads;
    private final int maxFlushAttempts;
    private final Clock clock;
    private final LedgerMetrics metrics;

    private final ConcurrentMap<ChangeKey, PendingChange> pending = new ConcurrentHashMap<>();
    private volatile ScheduledExecutorService scheduler;
    private volatile boolean stopped;

    public ChangeNotificationTracker(ChangeTrackingWriter writer,
                                     Duration debounceWindow,
                                     int schedulerThreads,
                                     int maxFlushAttempts,
                                     Clock clock,
                                     LedgerMetrics metrics) {
        if (debounceWindow.isNegative()) {
            throw new IllegalArgumentException("Debounce window must not be negative");
        }
        this.writer = writer;
        this.debounceWindow = debounceWindow;
        this.schedulerThreads = Math.max(1, schedulerThreads);
        this.maxFlushAttempts = Math.max(1, maxFlushAttempts);
        this.clock = clock;
        this.metrics = metrics;
    }

    public synchronized void init() {
        if (scheduler != null) {
            return;
        }
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("change-tracker-");
        threadFactory.setDaemon(true);
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(schedulerThreads, threadFactory);
        // pending timers are flushed by teardown's drain, not by the shutting-down pool
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        scheduler = executor;
        stopped = false;
        log.info("Change notification tracker started: window={}ms, threads={}",
                debounceWindow.toMillis(), schedulerThreads);
    }

    /**
     * Records one change of {@code category} for every user in the group.
     * Returns immediately; the write happens after the quiet window.
     * After {@link #teardown()} the change is written on the calling thread
     * instead, so a ledger write that already committed still gets its bump.
     *
     * @throws IllegalStateException if the tracker was never started
     */
    public void notify(Collection<String> affectedUsers, String groupId, ChangeCategory category) {
        notify(affectedUsers, groupId, category, 1);
    }

    public void notify(Collection<String> affectedUsers, String groupId, ChangeCategory category, long increment) {
        if (increment < 0) {
            throw new IllegalArgumentException("Counter increment must not be negative: " + increment);
        }
        ScheduledExecutorService executor = requireStarted();
        Instant now = clock.instant();
        List<PendingChange> inline = new ArrayList<>();
        for (String userId : new LinkedHashSet<>(affectedUsers)) {
            ChangeKey key = ChangeKey.of(userId, groupId);
            if (executor == null) {
                PendingChange change = new PendingChange(key, 1);
                change.add(category, increment, now);
                inline.add(change);
                continue;
            }
            pending.compute(key, (k, entry) -> {
                PendingChange target = entry != null ? entry : new PendingChange(k, 1);
                target.add(category, increment, now);
                try {
                    target.replaceTimer(executor.schedule(
                            () -> fire(k, target), debounceWindow.toMillis(), TimeUnit.MILLISECONDS));
                } catch (RejectedExecutionException e) {
                    // teardown shut the pool down between the read above and here
                    target.cancelTimer();
                    inline.add(target);
                    return null;
                }
                return target;
            });
        }
        if (!inline.isEmpty()) {
            log.warn("Change tracker stopped, writing {} change batch(es) inline for group {}", inline.size(), groupId);
            for (PendingChange change : inline) {
                write(change.snapshot(), false);
            }
        }
        metrics.recordNotificationRequested(category.name());
    }

    /**
     * Drops the pending timer and the uncommitted increments of one key.
     * Counters already written are not touched.
     *
     * @return true if something was pending
     */
    public boolean cancel(ChangeKey key) {
        PendingChange removed = pending.remove(key);
        if (removed == null) {
            return false;
        }
        removed.cancelTimer();
        log.debug("Cancelled pending change notification for {}", key);
        return true;
    }

    /**
     * Writes every pending key now, on the calling thread.
     *
     * @return number of batches written successfully
     */
    public int drainAll() {
        List<ChangeKey> keys = new ArrayList<>(pending.keySet());
        int written = 0;
        for (ChangeKey key : keys) {
            PendingChange entry = pending.remove(key);
            if (entry == null) {
                continue;
            }
            entry.cancelTimer();
            if (write(entry.snapshot(), false)) {
                written++;
            }
        }
        if (written > 0) {
            log.info("Drained {} pending change notification(s)", written);
        }
        return written;
    }

    public synchronized void teardown() {
        ScheduledExecutorService executor = scheduler;
        if (executor == null) {
            return;
        }
        stopped = true;
        scheduler = null;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(debounceWindow.toMillis() + 5_000, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        drainAll();
        log.info("Change notification tracker stopped");
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isRunning() {
        return scheduler != null;
    }

    private void fire(ChangeKey key, PendingChange entry) {
        if (!pending.remove(key, entry)) {
            // superseded by a newer notify or already drained/cancelled
            return;
        }
        write(entry.snapshot(), true);
    }

    private boolean write(ChangeBatch batch, boolean requeueOnFailure) {
        try {
            ChangeTrackingRecord record = writer.write(batch);
            metrics.recordNotificationFlushed((int) Math.min(Integer.MAX_VALUE, batch.totalIncrements()));
            log.debug("Flushed change batch for {}: version={}, increments={}",
                    batch.getKey(), record.getChangeVersion(), batch.getCounts());
            return true;
        } catch (RuntimeException e) {
            metrics.recordNotificationFlushFailed();
            if (requeueOnFailure && batch.getAttempt() < maxFlushAttempts && scheduler != null) {
                log.warn("Change batch for {} failed (attempt {}/{}), re-queueing: {}",
                        batch.getKey(), batch.getAttempt(), maxFlushAttempts, e.getMessage());
                requeue(batch);
            } else {
                log.error("Dropping change batch for {} after {} attempt(s): increments={}",
                        batch.getKey(), batch.getAttempt(), batch.getCounts(), e);
            }
            return false;
        }
    }

    private void requeue(ChangeBatch failed) {
        ScheduledExecutorService executor = scheduler;
        if (executor == null) {
            return;
        }
        pending.compute(failed.getKey(), (k, entry) -> {
            PendingChange target = entry != null ? entry : new PendingChange(k, failed.getAttempt());
            target.absorb(failed);
            target.replaceTimer(executor.schedule(
                    () -> fire(k, target), debounceWindow.toMillis(), TimeUnit.MILLISECONDS));
            return target;
        });
    }

    /**
     * @return the running scheduler, or null once the tracker has been torn down
     */
    private ScheduledExecutorService requireStarted() {
        ScheduledExecutorService executor = scheduler;
        if (executor == null && !stopped) {
            throw new IllegalStateException("Change notification tracker was never started");
        }
        return executor;
    }
}
