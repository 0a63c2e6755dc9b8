package com.tempvoice.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Periodically invokes a maintenance action (reconciliation, expiry sweeps).
 * A failing run is logged and never stops the schedule.
 */
@Slf4j
public class SweepRunner implements AutoCloseable {

    private static final long MIN_INTERVAL_MS = 1000;

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final long intervalMs;
    private final Consumer<String> action;
    private ScheduledFuture<?> scheduledTask;

    /**
     * @param name       thread and log name
     * @param intervalMs interval between runs in milliseconds (minimum 1s)
     * @param action     action to invoke; receives the trigger reason
     */
    public SweepRunner(String name, long intervalMs, Consumer<String> action) {
        this.name = name;
        this.intervalMs = Math.max(MIN_INTERVAL_MS, intervalMs);
        this.action = action;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("{} already running", name);
            return;
        }
        scheduleNext();
        log.info("{} started (interval: {}ms)", name, intervalMs);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
        }
        log.info("{} stopped", name);
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    private void scheduleNext() {
        scheduledTask = scheduler.schedule(this::tick, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void tick() {
        if (!running.get())
            return;
        runOnce("scheduled");
        if (running.get()) {
            scheduleNext();
        }
    }

    void runOnce(String reason) {
        try {
            action.accept(reason);
        } catch (Exception e) {
            log.error("{} run failed: {}", name, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }
}
