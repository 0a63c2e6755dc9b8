package com.tempvoice.common.infra;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SweepRunnerTest {

    private SweepRunner runner;

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.close();
        }
    }

    @Test
    void startAndStop() {
        runner = new SweepRunner("sweep", 60_000, reason -> {
        });
        assertFalse(runner.isRunning());
        runner.start();
        assertTrue(runner.isRunning());
        runner.stop();
        assertFalse(runner.isRunning());
    }

    @Test
    void scheduledRun_passesReason() throws Exception {
        var latch = new CountDownLatch(1);
        runner = new SweepRunner("sweep", 1000, reason -> {
            if ("scheduled".equals(reason)) {
                latch.countDown();
            }
        });

        runner.start();

        assertTrue(latch.await(3, TimeUnit.SECONDS));
    }

    @Test
    void failingAction_keepsRunnerUsable() {
        var calls = new AtomicInteger();
        runner = new SweepRunner("sweep", 60_000, reason -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        runner.runOnce("a");
        runner.runOnce("b");

        assertEquals(2, calls.get());
    }

    @Test
    void minimumInterval_enforced() {
        runner = new SweepRunner("sweep", 100, reason -> {
        });
        assertEquals(1000, runner.getIntervalMs());
    }
}
