package com.tempvoice.voice.platform;

import com.tempvoice.common.infra.RetryRunner;
import com.tempvoice.voice.model.Overwrite;
import com.tempvoice.voice.model.PlatformException;
import com.tempvoice.voice.model.TargetRef;
import com.tempvoice.voice.model.VoiceErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Wraps the real platform sink with a per-guild rate budget, a fixed call
 * timeout and bounded retries for rate limits and outages.
 * <p>
 * Calls for one guild start at least {@code spacingMs} apart. A call that
 * times out is failed and never retried. Creation is retried only on an
 * explicit rate limit, since an outage may hide a channel that was created.
 * Transient failures that exhaust the retry bound surface as
 * {@link VoiceErrorCode#OPERATION_DEGRADED}.
 */
@Slf4j
public class ThrottledCommandSink implements PlatformCommandSink {

    private final PlatformCommandSink delegate;
    private final ScheduledExecutorService scheduler;
    private final long spacingMs;
    private final long timeoutMs;
    private final RetryRunner retry;
    private final RetryRunner createRetry;
    private final Map<Long, AtomicLong> nextSlot = new ConcurrentHashMap<>();

    public ThrottledCommandSink(PlatformCommandSink delegate, ScheduledExecutorService scheduler,
            long spacingMs, long timeoutMs, RetryRunner.Config retryConfig) {
        this.delegate = delegate;
        this.scheduler = scheduler;
        this.spacingMs = Math.max(0, spacingMs);
        this.timeoutMs = timeoutMs;
        this.retry = new RetryRunner(retryConfig,
                (err, attempt) -> PlatformException.from(err).isRetryable(),
                ThrottledCommandSink::retryAfter,
                ThrottledCommandSink::logRetry);
        this.createRetry = new RetryRunner(retryConfig,
                (err, attempt) -> PlatformException.from(err).getCode() == VoiceErrorCode.RATE_LIMITED,
                ThrottledCommandSink::retryAfter,
                ThrottledCommandSink::logRetry);
    }

    @Override
    public CompletableFuture<Long> createVoiceChannel(CreateChannelRequest request) {
        return call(request.guildId(), "createVoiceChannel", createRetry,
                () -> delegate.createVoiceChannel(request));
    }

    @Override
    public CompletableFuture<Void> deleteChannel(long guildId, long channelId) {
        return call(guildId, "deleteChannel", retry, () -> delegate.deleteChannel(guildId, channelId));
    }

    @Override
    public CompletableFuture<Void> editOverwrite(long guildId, long channelId, Overwrite overwrite) {
        return call(guildId, "editOverwrite", retry, () -> delegate.editOverwrite(guildId, channelId, overwrite));
    }

    @Override
    public CompletableFuture<Void> removeOverwrite(long guildId, long channelId, TargetRef target) {
        return call(guildId, "removeOverwrite", retry, () -> delegate.removeOverwrite(guildId, channelId, target));
    }

    @Override
    public CompletableFuture<Void> disconnectMember(long guildId, long memberId) {
        return call(guildId, "disconnectMember", retry, () -> delegate.disconnectMember(guildId, memberId));
    }

    @Override
    public CompletableFuture<Void> moveMember(long guildId, long memberId, long channelId) {
        return call(guildId, "moveMember", retry, () -> delegate.moveMember(guildId, memberId, channelId));
    }

    @Override
    public CompletableFuture<Void> setChannelLimit(long guildId, long channelId, int limit) {
        return call(guildId, "setChannelLimit", retry, () -> delegate.setChannelLimit(guildId, channelId, limit));
    }

    @Override
    public CompletableFuture<List<PlatformChannel>> listChannels(long guildId) {
        return call(guildId, "listChannels", retry, () -> delegate.listChannels(guildId));
    }

    // ── Internals ───────────────────────────────────────────────────────

    private <T> CompletableFuture<T> call(long guildId, String label, RetryRunner runner,
            Supplier<CompletableFuture<T>> fn) {
        CompletableFuture<T> result = new CompletableFuture<>();
        runner.executeAsync(() -> throttled(guildId, label, fn), label, scheduler)
                .whenComplete((value, err) -> {
                    if (err == null) {
                        result.complete(value);
                        return;
                    }
                    PlatformException failure = PlatformException.from(err);
                    if (failure.isRetryable()) {
                        log.warn("{} in guild {} degraded after retries: {}", label, guildId, failure.getMessage());
                        failure = new PlatformException(VoiceErrorCode.OPERATION_DEGRADED,
                                label + " failed after retries: " + failure.getMessage(), failure);
                    }
                    result.completeExceptionally(failure);
                });
        return result;
    }

    private <T> CompletableFuture<T> throttled(long guildId, String label, Supplier<CompletableFuture<T>> fn) {
        CompletableFuture<T> result = new CompletableFuture<>();
        long delay = reserveSlot(guildId);
        scheduler.schedule(() -> {
            CompletableFuture<T> call;
            try {
                call = fn.get();
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
            call.copy()
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .whenComplete((value, err) -> {
                        if (err == null) {
                            result.complete(value);
                        } else {
                            PlatformException failure = PlatformException.from(err);
                            result.completeExceptionally(failure.isTimeout()
                                    ? PlatformException.timeout(label, timeoutMs)
                                    : failure);
                        }
                    });
        }, delay, TimeUnit.MILLISECONDS);
        return result;
    }

    /**
     * Reserve the next start slot for the guild.
     *
     * @return delay in ms before the call may start
     */
    long reserveSlot(long guildId) {
        long now = System.currentTimeMillis();
        AtomicLong slot = nextSlot.computeIfAbsent(guildId, g -> new AtomicLong());
        long start = slot.updateAndGet(prev -> Math.max(prev, now) + spacingMs) - spacingMs;
        return Math.max(0, start - now);
    }

    private static Long retryAfter(Throwable err) {
        return PlatformException.from(err).getRetryAfterMs();
    }

    private static void logRetry(RetryRunner.RetryInfo info) {
        log.debug("Retrying {} (attempt {}/{}) in {}ms: {}", info.label(), info.attempt(), info.maxAttempts(),
                info.delayMs(), info.err().getMessage());
    }
}
