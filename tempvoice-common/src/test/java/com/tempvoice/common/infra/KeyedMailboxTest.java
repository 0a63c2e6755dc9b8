package com.tempvoice.common.infra;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeyedMailboxTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final KeyedMailbox mailbox = new KeyedMailbox(executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void sameKey_runsInSubmissionOrder() {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            int n = i;
            futures.add(mailbox.run("channel:1", () -> seen.add(n)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        for (int i = 0; i < 50; i++) {
            assertEquals(i, seen.get(i));
        }
    }

    @Test
    void pendingAsyncTask_holdsKeyUntilComplete() throws Exception {
        CompletableFuture<String> platformCall = new CompletableFuture<>();
        List<String> order = Collections.synchronizedList(new ArrayList<>());

        CompletableFuture<String> first = mailbox.submitAsync("k", () -> platformCall.thenApply(v -> {
            order.add("first");
            return v;
        }));
        CompletableFuture<Void> second = mailbox.run("k", () -> order.add("second"));

        Thread.sleep(50);
        assertTrue(order.isEmpty());
        platformCall.complete("ack");

        second.get(2, TimeUnit.SECONDS);
        assertEquals("ack", first.join());
        assertEquals(List.of("first", "second"), order);
    }

    @Test
    void differentKeys_runConcurrently() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> a = mailbox.run("a", () -> await(bothStarted, release));
        CompletableFuture<Void> b = mailbox.run("b", () -> await(bothStarted, release));

        assertTrue(bothStarted.await(2, TimeUnit.SECONDS));
        release.countDown();
        CompletableFuture.allOf(a, b).get(2, TimeUnit.SECONDS);
    }

    @Test
    void failedTask_doesNotBlockSuccessor() {
        var counter = new AtomicInteger();
        CompletableFuture<Void> failing = mailbox.run("k", () -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<Void> next = mailbox.run("k", counter::incrementAndGet);

        assertThrows(Exception.class, failing::join);
        next.join();
        assertEquals(1, counter.get());
    }

    @Test
    void keysAreReleasedWhenIdle() throws Exception {
        mailbox.run("k", () -> {
        }).get(2, TimeUnit.SECONDS);
        Thread.sleep(20);
        assertEquals(0, mailbox.activeKeys());
    }

    private static void await(CountDownLatch started, CountDownLatch release) {
        started.countDown();
        try {
            release.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
