package com.tempvoice.voice.lifecycle;

import com.tempvoice.voice.model.PlatformException;
import com.tempvoice.voice.model.VoiceChannelState;
import com.tempvoice.voice.model.VoiceErrorCode;
import com.tempvoice.voice.permission.PermissionEngine;
import com.tempvoice.voice.platform.GuildMember;
import com.tempvoice.voice.platform.GuildMemberCache;
import com.tempvoice.voice.platform.PlatformEvent;
import com.tempvoice.voice.registry.ChannelRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for platform events: keeps the member cache current and hands
 * channel events to the lifecycle manager. Never throws; failures are logged.
 */
@Slf4j
public class VoiceEventRouter {

    private final ChannelLifecycleManager lifecycle;
    private final PermissionEngine engine;
    private final ChannelRegistry registry;
    private final GuildMemberCache members;
    private final AtomicLong voiceStateUpdates = new AtomicLong();
    private final AtomicLong joins = new AtomicLong();
    private final AtomicLong switches = new AtomicLong();
    private final AtomicLong leaves = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public VoiceEventRouter(ChannelLifecycleManager lifecycle, PermissionEngine engine, ChannelRegistry registry,
            GuildMemberCache members) {
        this.lifecycle = lifecycle;
        this.engine = engine;
        this.registry = registry;
        this.members = members;
    }

    /**
     * Handle one event.
     *
     * @return future completing once the event's work has been processed
     */
    public CompletableFuture<Void> handle(PlatformEvent event) {
        try {
            return dispatch(event).exceptionally(err -> {
                failures.incrementAndGet();
                log.error("Handling {} failed: {}", event.getClass().getSimpleName(), err.getMessage(), err);
                return null;
            });
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.error("Handling {} failed", event.getClass().getSimpleName(), e);
            return CompletableFuture.completedFuture(null);
        }
    }

    private CompletableFuture<Void> dispatch(PlatformEvent event) {
        if (event instanceof PlatformEvent.MemberVoiceStateChanged e) {
            members.updateVoiceChannel(e.guildId(), e.memberId(), e.toChannelId(), e.bot());
            count(e);
            return lifecycle.onVoiceStateChanged(e);
        }
        if (event instanceof PlatformEvent.ChannelCreateAck e) {
            lifecycle.acknowledge(e.guildId(), e.requestId(), e.channelId());
            return CompletableFuture.completedFuture(null);
        }
        if (event instanceof PlatformEvent.ChannelCreateFailed e) {
            lifecycle.failCreation(e.requestId(),
                    new PlatformException(VoiceErrorCode.OPERATION_DEGRADED, "creation failed: " + e.reason()));
            return CompletableFuture.completedFuture(null);
        }
        if (event instanceof PlatformEvent.ChannelDeleted e) {
            return lifecycle.onChannelDeleted(e.channelId()).thenApply(r -> null);
        }
        if (event instanceof PlatformEvent.MemberUpdated e) {
            return onMemberUpdated(e);
        }
        if (event instanceof PlatformEvent.MemberRemoved e) {
            members.remove(e.guildId(), e.memberId());
            // The member's rules go dormant; their channel falls back to defaults
            return engine.reapplyOwnerChannel(e.guildId(), e.memberId()).thenApply(r -> null);
        }
        if (event instanceof PlatformEvent.GuildRolesChanged e) {
            members.replaceRoles(e.guildId(), e.roleIds());
            return reapplyAll(registry.channelsInGuild(e.guildId()));
        }
        log.debug("Ignoring event {}", event);
        return CompletableFuture.completedFuture(null);
    }

    private void count(PlatformEvent.MemberVoiceStateChanged e) {
        voiceStateUpdates.incrementAndGet();
        if (Objects.equals(e.fromChannelId(), e.toChannelId())) {
            return;
        }
        if (e.fromChannelId() == null) {
            joins.incrementAndGet();
        } else if (e.toChannelId() == null) {
            leaves.incrementAndGet();
        } else {
            switches.incrementAndGet();
        }
    }

    /** Voice state updates seen, including mute and deafen changes. */
    public long voiceStateUpdates() {
        return voiceStateUpdates.get();
    }

    public long joins() {
        return joins.get();
    }

    public long switches() {
        return switches.get();
    }

    public long leaves() {
        return leaves.get();
    }

    /** Events whose handling failed. */
    public long failures() {
        return failures.get();
    }

    private CompletableFuture<Void> onMemberUpdated(PlatformEvent.MemberUpdated e) {
        Optional<GuildMember> previous = members.upsert(e.guildId(), e.memberId(), e.roleIds(), e.displayName(),
                e.bot());
        List<VoiceChannelState> affected = new ArrayList<>();
        if (previous.isEmpty()) {
            // Returning owner: dormant rules apply again
            registry.channelOwnedBy(e.guildId(), e.memberId()).ifPresent(affected::add);
        }
        Set<Long> roles = e.roleIds() != null ? Set.copyOf(e.roleIds()) : Set.of();
        boolean rolesChanged = previous.map(p -> !Objects.equals(p.roleIds(), roles)).orElse(true);
        if (rolesChanged) {
            registry.channelContaining(e.guildId(), e.memberId())
                    .filter(state -> !affected.contains(state))
                    .ifPresent(affected::add);
        }
        return reapplyAll(affected);
    }

    private CompletableFuture<Void> reapplyAll(List<VoiceChannelState> channels) {
        CompletableFuture<?>[] futures = channels.stream()
                .map(state -> engine.reapplyChannel(state.getId()))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(futures);
    }
}
