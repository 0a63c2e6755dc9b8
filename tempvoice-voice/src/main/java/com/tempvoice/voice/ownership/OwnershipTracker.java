package com.tempvoice.voice.ownership;

import com.tempvoice.common.config.TempVoiceConfig;
import com.tempvoice.common.infra.KeyedMailbox;
import com.tempvoice.voice.autokick.AutokickWorker;
import com.tempvoice.voice.model.OwnershipChange;
import com.tempvoice.voice.model.VoiceChannelState;
import com.tempvoice.voice.model.VoiceErrorCode;
import com.tempvoice.voice.model.VoiceResult;
import com.tempvoice.voice.permission.PermissionEngine;
import com.tempvoice.voice.platform.GuildDirectory;
import com.tempvoice.voice.platform.GuildMember;
import com.tempvoice.voice.registry.ChannelRegistry;
import com.tempvoice.voice.registry.MailboxKeys;
import com.tempvoice.voice.store.PermissionStore;
import com.tempvoice.voice.store.PermissionStoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Tracks who owns each live channel. Every change is appended to the
 * ownership log and followed by a full permission re-evaluation, since the
 * new owner's rules now govern the channel.
 */
@Slf4j
public class OwnershipTracker {

    private final Supplier<TempVoiceConfig> config;
    private final ChannelRegistry registry;
    private final PermissionStore store;
    private final PermissionEngine engine;
    private final GuildDirectory directory;
    private final AutokickWorker autokick;
    private final KeyedMailbox mailbox;
    private final Clock clock;

    public OwnershipTracker(Supplier<TempVoiceConfig> config, ChannelRegistry registry, PermissionStore store,
            PermissionEngine engine, GuildDirectory directory, AutokickWorker autokick, KeyedMailbox mailbox,
            Clock clock) {
        this.config = config;
        this.registry = registry;
        this.store = store;
        this.engine = engine;
        this.directory = directory;
        this.autokick = autokick;
        this.mailbox = mailbox;
        this.clock = clock;
    }

    /**
     * Hand the channel to another member. The new owner must be in the channel
     * and must not own another live channel.
     */
    public CompletableFuture<VoiceResult<Void>> transferOwnership(long channelId, long actorId, long newOwnerId) {
        return mailbox.submitAsync(MailboxKeys.channel(channelId), () -> {
            VoiceChannelState state = registry.get(channelId).orElse(null);
            if (state == null || !state.isLive()) {
                return done(VoiceResult.fail(VoiceErrorCode.NOT_FOUND, "channel " + channelId + " not live"));
            }
            if (!state.isOwnedBy(actorId)) {
                return done(VoiceResult.fail(VoiceErrorCode.NOT_AUTHORIZED, "only the owner can transfer"));
            }
            if (newOwnerId == actorId || !state.hasMember(newOwnerId)) {
                return done(VoiceResult.fail(VoiceErrorCode.INVALID_TARGET, "new owner must be in the channel"));
            }
            if (isBot(state.getGuildId(), newOwnerId)) {
                return done(VoiceResult.fail(VoiceErrorCode.INVALID_TARGET, "cannot transfer to a bot"));
            }
            if (registry.channelOwnedBy(state.getGuildId(), newOwnerId).isPresent()) {
                return done(VoiceResult.fail(VoiceErrorCode.ALREADY_EXISTS, "member already owns a channel"));
            }
            assign(state, newOwnerId, OwnershipChange.Reason.TRANSFERRED);
            return engine.reapply(state);
        });
    }

    /**
     * Apply the owner-left policy. Call from the channel's serial context after
     * the owner was removed from the member set. An empty channel keeps its
     * owner until it is deleted, so a quick return reclaims it.
     */
    public void handleOwnerLeft(VoiceChannelState state) {
        if (state.isEmpty()) {
            return;
        }
        TempVoiceConfig.OwnerLeavePolicy policy = config.get().getVoice().getOwnerLeavePolicy();
        if (policy == TempVoiceConfig.OwnerLeavePolicy.PROMOTE_LONGEST_PRESENT) {
            for (Long candidate : state.getMembers()) {
                if (!isBot(state.getGuildId(), candidate)
                        && registry.channelOwnedBy(state.getGuildId(), candidate).isEmpty()) {
                    assign(state, candidate, OwnershipChange.Reason.PROMOTED);
                    return;
                }
            }
        }
        assign(state, null, OwnershipChange.Reason.ABANDONED);
    }

    /** Re-evaluate ownership after the owner left, outside the channel context. */
    public CompletableFuture<VoiceResult<Void>> onOwnerLeft(long channelId) {
        return mailbox.submitAsync(MailboxKeys.channel(channelId), () -> {
            VoiceChannelState state = registry.get(channelId).orElse(null);
            if (state == null) {
                return done(VoiceResult.fail(VoiceErrorCode.NOT_FOUND, "channel " + channelId + " not live"));
            }
            Long owner = state.getOwnerId();
            if (owner == null || state.hasMember(owner)) {
                return done(VoiceResult.ok());
            }
            handleOwnerLeft(state);
            return engine.reapply(state);
        });
    }

    public Optional<Long> ownerOf(long channelId) {
        return registry.get(channelId).map(VoiceChannelState::getOwnerId);
    }

    public Optional<Long> channelOwnedBy(long guildId, long memberId) {
        return registry.channelOwnedBy(guildId, memberId).map(VoiceChannelState::getId);
    }

    public List<OwnershipChange> history(long guildId, long channelId) {
        return store.ownershipHistory(guildId, channelId);
    }

    public void recordCreated(VoiceChannelState state) {
        append(state, null, state.getOwnerId(), OwnershipChange.Reason.CREATED);
    }

    public void recordAdopted(VoiceChannelState state) {
        append(state, null, state.getOwnerId(), OwnershipChange.Reason.ADOPTED);
    }

    private void assign(VoiceChannelState state, Long newOwnerId, OwnershipChange.Reason reason) {
        Long previous = state.getOwnerId();
        registry.changeOwner(state, newOwnerId);
        append(state, previous, newOwnerId, reason);
        log.info("Channel {} owner {} -> {} ({})", state.getId(), previous, newOwnerId, reason);
        if (newOwnerId != null) {
            // The new owner's autokick list applies to everyone present
            for (Long member : state.getMembers()) {
                autokick.enqueue(state.getId(), member);
            }
        }
    }

    private void append(VoiceChannelState state, Long previous, Long next, OwnershipChange.Reason reason) {
        try {
            store.appendOwnershipChange(new OwnershipChange(state.getGuildId(), state.getId(), previous, next,
                    reason, clock.instant()));
        } catch (PermissionStoreException e) {
            log.warn("Ownership log entry for channel {} not written: {}", state.getId(), e.getMessage());
        }
    }

    private boolean isBot(long guildId, long memberId) {
        return directory.member(guildId, memberId).map(GuildMember::bot).orElse(false);
    }

    private static CompletableFuture<VoiceResult<Void>> done(VoiceResult<Void> result) {
        return CompletableFuture.completedFuture(result);
    }
}
