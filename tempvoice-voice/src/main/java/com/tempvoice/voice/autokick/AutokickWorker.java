package com.tempvoice.voice.autokick;

import com.tempvoice.voice.model.PlatformException;
import com.tempvoice.voice.model.VoiceChannelState;
import com.tempvoice.voice.platform.PlatformCommandSink;
import com.tempvoice.voice.registry.ChannelRegistry;
import com.tempvoice.voice.store.PermissionStore;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single background queue of join checks. A member on the channel owner's
 * autokick list is disconnected if still present; a failed eviction is retried
 * once, then logged and dropped. Every join is checked again, so a rejoin is
 * evicted again.
 * <p>
 * Runs apart from join handling, so the member is briefly visible in the
 * channel before removal.
 */
@Slf4j
public class AutokickWorker implements AutoCloseable {

    private final ChannelRegistry registry;
    private final PermissionStore store;
    private final PlatformCommandSink sink;
    private final long timeoutMs;
    private final long retryDelayMs;
    private final ExecutorService worker;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();

    public AutokickWorker(ChannelRegistry registry, PermissionStore store, PlatformCommandSink sink,
            long timeoutMs, long retryDelayMs) {
        this.registry = registry;
        this.store = store;
        this.sink = sink;
        this.timeoutMs = timeoutMs;
        this.retryDelayMs = retryDelayMs;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "autokick-worker");
            t.setDaemon(true);
            return t;
        });
    }

    /** Queue a check for a member who just joined the channel. */
    public void enqueue(long channelId, long memberId) {
        try {
            worker.execute(() -> process(channelId, memberId));
        } catch (RejectedExecutionException e) {
            log.debug("Autokick worker stopped, dropping check for member {} in channel {}", memberId, channelId);
        }
    }

    /** Checks completed so far, evicting or not. */
    public long processedCount() {
        return processed.get();
    }

    public long evictedCount() {
        return evicted.get();
    }

    void process(long channelId, long memberId) {
        try {
            check(channelId, memberId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Autokick check for member {} in channel {} interrupted", memberId, channelId);
        } catch (Exception e) {
            log.error("Autokick check for member {} in channel {} failed", memberId, channelId, e);
        } finally {
            processed.incrementAndGet();
        }
    }

    private void check(long channelId, long memberId) throws InterruptedException {
        VoiceChannelState state = registry.get(channelId).orElse(null);
        if (state == null) {
            log.debug("Autokick: channel {} no longer live", channelId);
            return;
        }
        Long ownerId = state.getOwnerId();
        if (ownerId == null || ownerId == memberId) {
            return;
        }
        if (!store.isAutokicked(state.getGuildId(), ownerId, memberId)) {
            return;
        }
        for (int attempt = 1; attempt <= 2; attempt++) {
            if (!state.hasMember(memberId)) {
                log.debug("Autokick: member {} already left channel {}", memberId, channelId);
                return;
            }
            try {
                sink.disconnectMember(state.getGuildId(), memberId).get(timeoutMs, TimeUnit.MILLISECONDS);
                evicted.incrementAndGet();
                log.info("Autokicked member {} from channel {} (owner {})", memberId, channelId, ownerId);
                return;
            } catch (ExecutionException | TimeoutException e) {
                PlatformException failure = PlatformException.from(e);
                if (attempt == 1) {
                    log.warn("Autokick of member {} failed, retrying once: {}", memberId, failure.getMessage());
                    Thread.sleep(retryDelayMs);
                } else {
                    log.warn("Autokick of member {} from channel {} dropped: {}", memberId, channelId,
                            failure.getMessage());
                }
            }
        }
    }

    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }
}
