package com.tempvoice.voice;

import com.tempvoice.common.config.TempVoiceConfig;
import com.tempvoice.common.infra.KeyedMailbox;
import com.tempvoice.common.infra.RetryRunner;
import com.tempvoice.voice.autokick.AutokickService;
import com.tempvoice.voice.autokick.AutokickWorker;
import com.tempvoice.voice.bypass.BypassService;
import com.tempvoice.voice.lifecycle.ChannelLifecycleManager;
import com.tempvoice.voice.lifecycle.VoiceEventRouter;
import com.tempvoice.voice.ownership.OwnershipTracker;
import com.tempvoice.voice.permission.EntitlementPolicy;
import com.tempvoice.voice.permission.PermissionEngine;
import com.tempvoice.voice.platform.GuildMemberCache;
import com.tempvoice.voice.platform.MemberNotifier;
import com.tempvoice.voice.platform.PlatformCommandSink;
import com.tempvoice.voice.platform.PlatformEvent;
import com.tempvoice.voice.platform.ThrottledCommandSink;
import com.tempvoice.voice.reconcile.ReconciliationService;
import com.tempvoice.voice.registry.CategoryAllocator;
import com.tempvoice.voice.registry.ChannelRegistry;
import com.tempvoice.voice.service.VoiceCommandService;
import com.tempvoice.voice.store.PermissionStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Wires the voice components around a platform sink and a store. Owns the
 * worker threads; close it to stop them.
 */
@Slf4j
public class VoiceSubsystem implements AutoCloseable {

    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final GuildMemberCache members;
    private final ChannelRegistry registry;
    private final PermissionEngine engine;
    private final AutokickWorker autokickWorker;
    private final AutokickService autokickService;
    private final OwnershipTracker ownership;
    private final ChannelLifecycleManager lifecycle;
    private final VoiceEventRouter router;
    private final BypassService bypass;
    private final ReconciliationService reconciliation;
    private final VoiceCommandService commands;

    public VoiceSubsystem(Supplier<TempVoiceConfig> config, PermissionStore store, PlatformCommandSink platform,
            MemberNotifier notifier, EntitlementPolicy entitlements, Clock clock) {
        TempVoiceConfig.VoiceConfig voice = config.get().getVoice();
        this.executor = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()),
                daemonThreads("voice-worker"));
        this.scheduler = Executors.newScheduledThreadPool(2, daemonThreads("voice-scheduler"));
        KeyedMailbox mailbox = new KeyedMailbox(executor);

        PlatformCommandSink sink = new ThrottledCommandSink(platform, scheduler, voice.getCommandSpacingMs(),
                voice.getCommandTimeoutMs(), new RetryRunner.Config(voice.getRetryAttempts(),
                        voice.getRetryMinDelayMs(), voice.getRetryMaxDelayMs(), voice.getRetryJitter()));

        this.members = new GuildMemberCache();
        this.registry = new ChannelRegistry(Duration.ofMillis(voice.getPendingEventTtlMs()));
        CategoryAllocator allocator = new CategoryAllocator(registry);
        this.engine = new PermissionEngine(config, store, members, sink, registry, mailbox, entitlements, clock);
        this.autokickWorker = new AutokickWorker(registry, store, sink, voice.getCommandTimeoutMs(),
                voice.getRetryMinDelayMs());
        this.autokickService = new AutokickService(store, registry, autokickWorker, entitlements, members, mailbox);
        this.ownership = new OwnershipTracker(config, registry, store, engine, members, autokickWorker, mailbox,
                clock);
        this.lifecycle = new ChannelLifecycleManager(config, registry, allocator, engine, sink, members, notifier,
                autokickWorker, ownership, mailbox, scheduler, clock);
        this.router = new VoiceEventRouter(lifecycle, engine, registry, members);
        this.bypass = new BypassService(store, registry, engine, clock);
        this.reconciliation = new ReconciliationService(config, registry, members, sink, lifecycle, engine,
                clock);
        this.commands = new VoiceCommandService(registry, engine, autokickService, ownership, lifecycle, store,
                router, autokickWorker, bypass, entitlements, mailbox);
        log.info("Voice subsystem started ({} guilds configured)", config.get().getGuilds().size());
    }

    public CompletableFuture<Void> handle(PlatformEvent event) {
        return router.handle(event);
    }

    public GuildMemberCache getMembers() {
        return members;
    }

    public ChannelRegistry getRegistry() {
        return registry;
    }

    public PermissionEngine getEngine() {
        return engine;
    }

    public AutokickWorker getAutokickWorker() {
        return autokickWorker;
    }

    public OwnershipTracker getOwnership() {
        return ownership;
    }

    public ChannelLifecycleManager getLifecycle() {
        return lifecycle;
    }

    public BypassService getBypass() {
        return bypass;
    }

    public ReconciliationService getReconciliation() {
        return reconciliation;
    }

    public VoiceCommandService getCommands() {
        return commands;
    }

    @Override
    public void close() {
        autokickWorker.close();
        scheduler.shutdownNow();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("Voice subsystem stopped");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
