package com.tempvoice.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Serializes asynchronous tasks by key: tasks for one key run strictly in
 * submission order, one at a time, while tasks for different keys run
 * concurrently on the shared executor. A task that returns a pending future
 * holds its key until that future completes, without holding a thread.
 */
@Slf4j
public class KeyedMailbox {

    private final Map<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();
    private final Executor executor;

    public KeyedMailbox(Executor executor) {
        this.executor = executor;
    }

    /**
     * Queue an asynchronous task behind every earlier task of the same key.
     * A failed predecessor does not block its successors.
     *
     * @param key  serialization key
     * @param task the task to execute
     * @param <T>  result type
     * @return future with the task result
     */
    public <T> CompletableFuture<T> submitAsync(String key, Supplier<CompletableFuture<T>> task) {
        AtomicReference<CompletableFuture<T>> holder = new AtomicReference<>();
        tails.compute(key, (k, prev) -> {
            CompletableFuture<?> base = prev != null ? prev : CompletableFuture.completedFuture(null);
            CompletableFuture<T> next = base
                    .handle((ignored, ex) -> null)
                    .thenComposeAsync(ignored -> invoke(key, task), executor);
            holder.set(next);
            return next;
        });
        CompletableFuture<T> next = holder.get();
        next.whenComplete((result, ex) -> tails.remove(key, next));
        return next;
    }

    /**
     * Queue a synchronous task behind every earlier task of the same key.
     */
    public <T> CompletableFuture<T> submit(String key, Supplier<T> task) {
        return submitAsync(key, () -> CompletableFuture.completedFuture(task.get()));
    }

    /**
     * Queue a task that produces no value.
     */
    public CompletableFuture<Void> run(String key, Runnable task) {
        return submit(key, () -> {
            task.run();
            return null;
        });
    }

    /**
     * Number of keys with queued or running work.
     */
    public int activeKeys() {
        return tails.size();
    }

    private <T> CompletableFuture<T> invoke(String key, Supplier<CompletableFuture<T>> task) {
        try {
            CompletableFuture<T> result = task.get();
            return result != null ? result : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            log.debug("Task for key {} failed: {}", key, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }
}
