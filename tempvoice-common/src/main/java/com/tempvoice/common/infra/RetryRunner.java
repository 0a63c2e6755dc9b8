package com.tempvoice.common.infra;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Retry executor with exponential backoff, jitter, retry-after support and
 * configurable shouldRetry / onRetry hooks, for calls that return a
 * {@link CompletableFuture}.
 */
public final class RetryRunner {

    // ── Configuration ──────────────────────────────────────────────────

    /**
     * Retry configuration.
     *
     * @param attempts   maximum number of attempts (>= 1)
     * @param minDelayMs minimum delay between retries in ms
     * @param maxDelayMs maximum delay between retries in ms
     * @param jitter     jitter ratio (0..1); 0 = no jitter
     */
    public record Config(int attempts, long minDelayMs, long maxDelayMs, double jitter) {

        public static final Config DEFAULT = new Config(3, 300, 30_000, 0.0);
    }

    /**
     * Information passed to onRetry callback.
     */
    public record RetryInfo(int attempt, int maxAttempts, long delayMs, Throwable err, String label) {
    }

    // ── Fields ──────────────────────────────────────────────────────────

    private final Config config;
    private final BiPredicate<Throwable, Integer> shouldRetry;
    private final Function<Throwable, Long> retryAfterMs;
    private final Consumer<RetryInfo> onRetry;

    // ── Constructors ────────────────────────────────────────────────────

    public RetryRunner(Config config,
            BiPredicate<Throwable, Integer> shouldRetry,
            Function<Throwable, Long> retryAfterMs,
            Consumer<RetryInfo> onRetry) {
        Config resolved = config != null ? config : Config.DEFAULT;
        this.config = resolved.attempts() >= 1 ? resolved
                : new Config(1, resolved.minDelayMs(), resolved.maxDelayMs(), resolved.jitter());
        this.shouldRetry = shouldRetry != null ? shouldRetry : (err, attempt) -> true;
        this.retryAfterMs = retryAfterMs;
        this.onRetry = onRetry;
    }

    public RetryRunner(Config config) {
        this(config, null, null, null);
    }

    // ── Execute ─────────────────────────────────────────────────────────

    /**
     * Execute an asynchronous operation with retry logic. Delays are scheduled
     * on {@code scheduler}, so no thread is held between attempts.
     *
     * @param fn        supplies a fresh attempt each time it is called
     * @param label     optional label for logging
     * @param scheduler scheduler used for backoff delays
     * @param <T>       return type
     * @return future of the first successful attempt, or of the last failure
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<CompletableFuture<T>> fn, String label,
            ScheduledExecutorService scheduler) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attemptAsync(fn, label, scheduler, 1, result);
        return result;
    }

    private <T> void attemptAsync(Supplier<CompletableFuture<T>> fn, String label,
            ScheduledExecutorService scheduler, int attempt, CompletableFuture<T> result) {
        CompletableFuture<T> call;
        try {
            call = fn.get();
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.whenComplete((value, ex) -> {
            if (ex == null) {
                result.complete(value);
                return;
            }
            Throwable err = unwrap(ex);
            if (attempt >= config.attempts() || !shouldRetry.test(err, attempt)) {
                result.completeExceptionally(err);
                return;
            }
            long delay = computeDelay(err, attempt);
            notifyRetry(attempt, delay, err, label);
            scheduler.schedule(() -> attemptAsync(fn, label, scheduler, attempt + 1, result),
                    delay, TimeUnit.MILLISECONDS);
        });
    }

    // ── Private ─────────────────────────────────────────────────────────

    long computeDelay(Throwable err, int attempt) {
        long minDelay = config.minDelayMs();
        long maxDelay = config.maxDelayMs() > 0 ? config.maxDelayMs() : Long.MAX_VALUE;
        long retryAfter = retryAfterMs != null ? retryAfterMs.apply(err) : -1;
        long baseDelay = retryAfter > 0
                ? Math.max(retryAfter, minDelay)
                : minDelay * (1L << (attempt - 1));
        long delay = applyJitter(Math.min(baseDelay, maxDelay), config.jitter());
        return Math.min(Math.max(delay, minDelay), maxDelay);
    }

    private void notifyRetry(int attempt, long delay, Throwable err, String label) {
        if (onRetry != null) {
            onRetry.accept(new RetryInfo(attempt, config.attempts(), delay, err, label));
        }
    }

    private static Exception unwrap(Throwable err) {
        Throwable current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current instanceof Exception ex ? ex : new RuntimeException(current);
    }

    private static long applyJitter(long delayMs, double jitter) {
        if (jitter <= 0) {
            return delayMs;
        }
        double offset = (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitter;
        return Math.max(0, Math.round(delayMs * (1 + offset)));
    }
}
