package com.tempvoice.voice.lifecycle;

import com.tempvoice.common.config.TempVoiceConfig;
import com.tempvoice.common.infra.KeyedMailbox;
import com.tempvoice.voice.autokick.AutokickWorker;
import com.tempvoice.voice.model.ChannelPhase;
import com.tempvoice.voice.model.OverwriteSet;
import com.tempvoice.voice.model.PlatformException;
import com.tempvoice.voice.model.VoiceChannelState;
import com.tempvoice.voice.model.VoiceErrorCode;
import com.tempvoice.voice.model.VoiceResult;
import com.tempvoice.voice.ownership.OwnershipTracker;
import com.tempvoice.voice.permission.PermissionEngine;
import com.tempvoice.voice.platform.CreateChannelRequest;
import com.tempvoice.voice.platform.GuildDirectory;
import com.tempvoice.voice.platform.MemberNotifier;
import com.tempvoice.voice.platform.PlatformCommandSink;
import com.tempvoice.voice.platform.PlatformEvent;
import com.tempvoice.voice.registry.BufferedMove;
import com.tempvoice.voice.registry.CategoryAllocator;
import com.tempvoice.voice.registry.ChannelRegistry;
import com.tempvoice.voice.registry.MailboxKeys;
import com.tempvoice.voice.registry.PendingCreation;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Creates a channel when a member joins a trigger channel and deletes it once
 * it has been empty for the whole grace window.
 * <p>
 * Every event of a channel runs in that channel's serial context, so
 * registration, membership changes and eviction never interleave. Creation
 * runs in the owner's serial context: a second trigger join waits for the
 * first creation and then moves the member into the existing channel.
 */
@Slf4j
public class ChannelLifecycleManager {

    static final int MAX_LIMIT = 99;
    static final int MAX_NAME_LENGTH = 100;

    private final Supplier<TempVoiceConfig> config;
    private final ChannelRegistry registry;
    private final CategoryAllocator allocator;
    private final PermissionEngine engine;
    private final PlatformCommandSink sink;
    private final GuildDirectory directory;
    private final MemberNotifier notifier;
    private final AutokickWorker autokick;
    private final OwnershipTracker ownership;
    private final KeyedMailbox mailbox;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final AtomicLong created = new AtomicLong();
    private final AtomicLong deleted = new AtomicLong();

    public ChannelLifecycleManager(Supplier<TempVoiceConfig> config, ChannelRegistry registry,
            CategoryAllocator allocator, PermissionEngine engine, PlatformCommandSink sink,
            GuildDirectory directory, MemberNotifier notifier, AutokickWorker autokick,
            OwnershipTracker ownership, KeyedMailbox mailbox, ScheduledExecutorService scheduler, Clock clock) {
        this.config = config;
        this.registry = registry;
        this.allocator = allocator;
        this.engine = engine;
        this.sink = sink;
        this.directory = directory;
        this.notifier = notifier;
        this.autokick = autokick;
        this.ownership = ownership;
        this.mailbox = mailbox;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    // ── Creation ────────────────────────────────────────────────────────

    /**
     * Create a channel for a member who joined a trigger channel, or move them
     * to the channel they already own.
     *
     * @return future with the channel id
     */
    public CompletableFuture<VoiceResult<Long>> onMemberJoinTrigger(long guildId, long memberId, long triggerId) {
        return mailbox.submitAsync(MailboxKeys.owner(guildId, memberId),
                () -> createFor(guildId, memberId, triggerId));
    }

    private CompletableFuture<VoiceResult<Long>> createFor(long guildId, long memberId, long triggerId) {
        Optional<VoiceChannelState> owned = registry.channelOwnedBy(guildId, memberId).filter(VoiceChannelState::isLive);
        if (owned.isPresent()) {
            long channelId = owned.get().getId();
            log.debug("Member {} already owns channel {}, moving", memberId, channelId);
            return sink.moveMember(guildId, memberId, channelId).handle((ignored, err) -> {
                if (err != null) {
                    log.warn("Moving member {} to own channel {} failed: {}", memberId, channelId, err.getMessage());
                    return VoiceResult.fail(err);
                }
                return VoiceResult.ok(channelId);
            });
        }
        if (registry.pendingFor(guildId, memberId).isPresent()) {
            log.debug("Creation for member {} already pending, ignoring join", memberId);
            return done(VoiceResult.fail(VoiceErrorCode.ALREADY_EXISTS, "creation already pending"));
        }

        Optional<TempVoiceConfig.GuildConfig> guild = config.get().findGuild(guildId);
        Optional<TempVoiceConfig.TriggerConfig> trigger = guild.flatMap(g -> g.findTrigger(triggerId));
        if (trigger.isEmpty()) {
            return done(VoiceResult.fail(VoiceErrorCode.NOT_FOUND, "channel " + triggerId + " is not a trigger"));
        }
        List<TempVoiceConfig.CategoryConfig> categories =
                CategoryAllocator.resolve(guild.get(), trigger.get().getCategoryIds());
        Optional<Long> reserved = allocator.reserve(guildId, categories);
        if (reserved.isEmpty()) {
            log.info("No category capacity for member {} in guild {}", memberId, guildId);
            notifier.notify(guildId, memberId, VoiceErrorCode.CAPACITY_EXCEEDED, "all categories are full");
            return done(VoiceResult.fail(VoiceErrorCode.CAPACITY_EXCEEDED, "all categories are full"));
        }
        long categoryId = reserved.get();
        int limit = categories.stream()
                .filter(c -> c.getId() == categoryId)
                .findFirst()
                .map(c -> Math.max(0, Math.min(MAX_LIMIT, c.getDefaultLimit())))
                .orElse(0);

        OverwriteSet initial;
        try {
            initial = engine.computeInitialOverwrites(guildId, memberId, categoryId);
        } catch (RuntimeException e) {
            allocator.release(guildId, categoryId);
            log.error("Computing initial overwrites for member {} failed", memberId, e);
            notifier.notify(guildId, memberId, VoiceErrorCode.OPERATION_DEGRADED, "channel creation failed");
            return done(VoiceResult.fail(VoiceErrorCode.OPERATION_DEGRADED, e.getMessage()));
        }

        String name = channelName(trigger.get().getNameFormat(), directory.displayName(guildId, memberId));
        PendingCreation pending = new PendingCreation(UUID.randomUUID().toString(), guildId, memberId, categoryId,
                triggerId, limit, initial, clock.instant(), new CompletableFuture<>());
        registry.addPending(pending);
        log.debug("Creating channel '{}' for member {} in category {} ({})", name, memberId, categoryId,
                pending.requestId());

        sink.createVoiceChannel(new CreateChannelRequest(pending.requestId(), guildId, categoryId, name, limit,
                        initial))
                .whenComplete((channelId, err) -> {
                    if (err == null) {
                        acknowledge(guildId, pending.requestId(), channelId);
                    } else {
                        failCreation(pending.requestId(), err);
                    }
                });

        long timeoutMs = config.get().getVoice().getCommandTimeoutMs();
        return pending.ack()
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((channelId, err) -> err == null ? activate(pending, channelId) : rollback(pending, err))
                .thenCompose(result -> result);
    }

    /**
     * Acknowledge a creation. The first acknowledgement wins; one for a request
     * already given up on deletes the stray channel.
     */
    public void acknowledge(long guildId, String requestId, long channelId) {
        Optional<PendingCreation> pending = registry.getPending(requestId);
        if (pending.isPresent()) {
            pending.get().ack().complete(channelId);
            return;
        }
        if (registry.isAbandoned(requestId)) {
            log.warn("Late acknowledgement for abandoned request {}, deleting stray channel {}", requestId, channelId);
            sink.deleteChannel(guildId, channelId).whenComplete((ignored, err) -> {
                if (err != null) {
                    log.warn("Deleting stray channel {} failed: {}", channelId, err.getMessage());
                }
            });
            return;
        }
        log.debug("Ignoring acknowledgement for unknown or resolved request {}", requestId);
    }

    public void failCreation(String requestId, Throwable err) {
        registry.getPending(requestId).ifPresent(p -> p.ack().completeExceptionally(err));
    }

    private CompletableFuture<VoiceResult<Long>> activate(PendingCreation pending, long channelId) {
        return mailbox.submitAsync(MailboxKeys.channel(channelId), () -> {
            VoiceChannelState state = new VoiceChannelState(channelId, pending.guildId(), pending.ownerId(),
                    pending.categoryId(), pending.triggerId(), clock.instant(), pending.limit());
            state.setApplied(pending.initialOverwrites());
            allocator.commit(pending.guildId(), pending.categoryId(), () -> registry.register(state));
            registry.removePending(pending.requestId());
            ownership.recordCreated(state);
            created.incrementAndGet();
            log.info("Created channel {} for member {} in guild {}", channelId, pending.ownerId(), pending.guildId());

            CompletableFuture<?> chain = sink.moveMember(pending.guildId(), pending.ownerId(), channelId)
                    .handle((ignored, err) -> {
                        if (err != null) {
                            log.warn("Moving owner {} into channel {} failed: {}", pending.ownerId(), channelId,
                                    err.getMessage());
                        }
                        return null;
                    });
            for (BufferedMove move : registry.drainBuffered(channelId)) {
                chain = chain.thenCompose(ignored -> move.joined()
                        ? handleJoin(state, move.memberId())
                        : handleLeave(state, move.memberId()));
            }
            return chain.thenApply(ignored -> {
                if (state.isEmpty() && state.getPhase() == ChannelPhase.ACTIVE) {
                    beginDrain(state);
                }
                return VoiceResult.ok(channelId);
            });
        });
    }

    private CompletableFuture<VoiceResult<Long>> rollback(PendingCreation pending, Throwable err) {
        registry.removePending(pending.requestId());
        registry.markAbandoned(pending.requestId());
        allocator.release(pending.guildId(), pending.categoryId());
        PlatformException failure = PlatformException.from(err);
        log.warn("Channel creation for member {} in guild {} failed: {}", pending.ownerId(), pending.guildId(),
                failure.getMessage());
        notifier.notify(pending.guildId(), pending.ownerId(), failure.getCode(), "channel creation failed");
        return done(VoiceResult.fail(failure.getCode(), failure.getMessage()));
    }

    // ── Membership ──────────────────────────────────────────────────────

    /** Remove a member from a live channel; an empty channel starts draining. */
    public CompletableFuture<VoiceResult<Void>> onMemberLeave(long channelId, long memberId) {
        return mailbox.submitAsync(MailboxKeys.channel(channelId), () -> registry.get(channelId)
                .map(state -> handleLeave(state, memberId))
                .orElseGet(() -> notFound(channelId)));
    }

    /** Add a member to a live channel, cancelling a drain, and restore their permissions. */
    public CompletableFuture<VoiceResult<Void>> onMemberJoinExistingChannel(long channelId, long memberId) {
        return mailbox.submitAsync(MailboxKeys.channel(channelId), () -> registry.get(channelId)
                .map(state -> handleJoin(state, memberId))
                .orElseGet(() -> notFound(channelId)));
    }

    /**
     * Derive joins and leaves from a voice state change. Bots and the AFK
     * channel are ignored; moves between channels are a leave then a join.
     */
    public CompletableFuture<Void> onVoiceStateChanged(PlatformEvent.MemberVoiceStateChanged event) {
        if (event.bot()) {
            return CompletableFuture.completedFuture(null);
        }
        Optional<TempVoiceConfig.GuildConfig> guild = config.get().findGuild(event.guildId());
        if (guild.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        Long afk = guild.get().getAfkChannelId();
        Long from = Objects.equals(event.fromChannelId(), afk) ? null : event.fromChannelId();
        Long to = Objects.equals(event.toChannelId(), afk) ? null : event.toChannelId();
        if (Objects.equals(from, to)) {
            return CompletableFuture.completedFuture(null);
        }

        long guildId = event.guildId();
        long memberId = event.memberId();
        List<CompletableFuture<?>> steps = new ArrayList<>();
        if (from != null && guild.get().findTrigger(from).isEmpty()) {
            steps.add(route(guildId, from, new BufferedMove(memberId, false)));
        }
        if (to != null) {
            if (guild.get().findTrigger(to).isPresent()) {
                steps.add(onMemberJoinTrigger(guildId, memberId, to));
            } else {
                steps.add(route(guildId, to, new BufferedMove(memberId, true)));
            }
        }
        return CompletableFuture.allOf(steps.toArray(new CompletableFuture[0]));
    }

    /**
     * Apply a move to a registered channel, or buffer it while a creation in
     * the guild may still produce this channel id.
     */
    private CompletableFuture<VoiceResult<Void>> route(long guildId, long channelId, BufferedMove move) {
        return mailbox.submitAsync(MailboxKeys.channel(channelId), () -> {
            Optional<VoiceChannelState> state = registry.get(channelId);
            if (state.isPresent()) {
                return move.joined() ? handleJoin(state.get(), move.memberId())
                        : handleLeave(state.get(), move.memberId());
            }
            if (registry.hasPending(guildId)) {
                registry.buffer(channelId, move);
                return done(VoiceResult.ok());
            }
            log.debug("Ignoring move for unmanaged channel {}", channelId);
            return notFound(channelId);
        });
    }

    private CompletableFuture<VoiceResult<Void>> handleJoin(VoiceChannelState state, long memberId) {
        if (!state.isLive()) {
            return notFound(state.getId());
        }
        if (state.cancelDrain()) {
            log.debug("Member {} rejoined channel {}, drain cancelled", memberId, state.getId());
        }
        if (!state.addMember(memberId, clock.instant())) {
            log.debug("Member {} already in channel {}", memberId, state.getId());
            return done(VoiceResult.ok());
        }
        if (!state.isOwnedBy(memberId)) {
            autokick.enqueue(state.getId(), memberId);
        }
        return engine.reapply(state);
    }

    private CompletableFuture<VoiceResult<Void>> handleLeave(VoiceChannelState state, long memberId) {
        if (!state.removeMember(memberId)) {
            log.debug("Member {} was not in channel {}", memberId, state.getId());
            return done(VoiceResult.fail(VoiceErrorCode.NOT_FOUND, "member not in channel"));
        }
        if (state.isOwnedBy(memberId)) {
            ownership.handleOwnerLeft(state);
        }
        if (state.isEmpty()) {
            beginDrain(state);
            return done(VoiceResult.ok());
        }
        return engine.reapply(state);
    }

    // ── Drain and deletion ──────────────────────────────────────────────

    private void beginDrain(VoiceChannelState state) {
        long graceMs = config.get().getVoice().getGraceWindowMs();
        long channelId = state.getId();
        state.beginDrain(epoch -> scheduler.schedule(
                () -> mailbox.submitAsync(MailboxKeys.channel(channelId), () -> expireDrain(channelId, epoch)),
                graceMs, TimeUnit.MILLISECONDS));
        log.debug("Channel {} empty, deleting in {}ms unless rejoined", channelId, graceMs);
    }

    private CompletableFuture<VoiceResult<Void>> expireDrain(long channelId, long epoch) {
        VoiceChannelState state = registry.get(channelId).orElse(null);
        if (state == null || !state.isDrainCurrent(epoch)) {
            log.debug("Stale drain timer for channel {}", channelId);
            return done(VoiceResult.ok());
        }
        state.destroy();
        registry.evict(channelId);
        deleted.incrementAndGet();
        log.info("Deleting empty channel {} in guild {}", channelId, state.getGuildId());
        return sink.deleteChannel(state.getGuildId(), channelId).handle((ignored, err) -> {
            if (err != null) {
                log.warn("Deleting channel {} failed, left for reconciliation: {}", channelId, err.getMessage());
                return VoiceResult.fail(err);
            }
            return VoiceResult.ok();
        });
    }

    /** The platform deleted the channel; forget it. */
    public CompletableFuture<VoiceResult<Void>> onChannelDeleted(long channelId) {
        return mailbox.submitAsync(MailboxKeys.channel(channelId), () -> {
            Optional<VoiceChannelState> evicted = registry.evict(channelId);
            if (evicted.isEmpty()) {
                return notFound(channelId);
            }
            evicted.get().destroy();
            log.info("Channel {} deleted on the platform, evicted", channelId);
            return done(VoiceResult.ok());
        });
    }

    public long channelsCreated() {
        return created.get();
    }

    /** Channels deleted after staying empty for the grace window. */
    public long channelsDeleted() {
        return deleted.get();
    }

    // ── Limit and adoption ──────────────────────────────────────────────

    /**
     * Set the member limit: above 99 means unlimited (0), below 1 becomes 1.
     *
     * @return future with the limit applied
     */
    public CompletableFuture<VoiceResult<Integer>> setLimit(long channelId, int requested) {
        int limit = clampLimit(requested);
        return mailbox.submitAsync(MailboxKeys.channel(channelId), () -> {
            VoiceChannelState state = registry.get(channelId).filter(VoiceChannelState::isLive).orElse(null);
            if (state == null) {
                return done(VoiceResult.fail(VoiceErrorCode.NOT_FOUND, "channel " + channelId + " not live"));
            }
            return sink.setChannelLimit(state.getGuildId(), channelId, limit).handle((ignored, err) -> {
                if (err != null) {
                    return VoiceResult.fail(err);
                }
                state.setLimit(limit);
                return VoiceResult.ok(limit);
            });
        });
    }

    static int clampLimit(int requested) {
        if (requested > MAX_LIMIT) {
            return 0;
        }
        return Math.max(1, requested);
    }

    /**
     * Register an occupied platform channel nobody tracked as an ownerless
     * channel.
     */
    public CompletableFuture<VoiceResult<Void>> adopt(long guildId, long channelId, long categoryId,
            List<Long> members) {
        return mailbox.submitAsync(MailboxKeys.channel(channelId), () -> {
            if (registry.contains(channelId)) {
                return done(VoiceResult.ok());
            }
            VoiceChannelState state = new VoiceChannelState(channelId, guildId, null, categoryId, null,
                    clock.instant(), 0);
            for (Long member : members) {
                state.addMember(member, clock.instant());
            }
            registry.register(state);
            ownership.recordAdopted(state);
            log.info("Adopted untracked channel {} with {} members", channelId, members.size());
            return engine.reapply(state);
        });
    }

    static String channelName(String format, String displayName) {
        String pattern = format == null || format.isBlank() ? "{name}" : format;
        String name = pattern.replace("{name}", displayName).trim();
        if (name.isEmpty()) {
            name = displayName;
        }
        return name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH) : name;
    }

    private static CompletableFuture<VoiceResult<Void>> notFound(long channelId) {
        log.debug("Channel {} not registered", channelId);
        return done(VoiceResult.fail(VoiceErrorCode.NOT_FOUND, "channel " + channelId + " not live"));
    }

    private static <T> CompletableFuture<VoiceResult<T>> done(VoiceResult<T> result) {
        return CompletableFuture.completedFuture(result);
    }
}
