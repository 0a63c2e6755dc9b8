package com.tempvoice.voice.service;

import com.tempvoice.common.infra.KeyedMailbox;
import com.tempvoice.voice.autokick.AutokickService;
import com.tempvoice.voice.autokick.AutokickWorker;
import com.tempvoice.voice.bypass.BypassService;
import com.tempvoice.voice.lifecycle.ChannelLifecycleManager;
import com.tempvoice.voice.lifecycle.VoiceEventRouter;
import com.tempvoice.voice.model.AutokickEntry;
import com.tempvoice.voice.model.BypassFlag;
import com.tempvoice.voice.model.Effect;
import com.tempvoice.voice.model.PermissionKind;
import com.tempvoice.voice.model.TargetRef;
import com.tempvoice.voice.model.VoiceChannelState;
import com.tempvoice.voice.model.VoiceErrorCode;
import com.tempvoice.voice.model.VoiceResult;
import com.tempvoice.voice.ownership.OwnershipTracker;
import com.tempvoice.voice.permission.EntitlementPolicy;
import com.tempvoice.voice.permission.PermissionEngine;
import com.tempvoice.voice.registry.ChannelRegistry;
import com.tempvoice.voice.store.PermissionStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Operations offered to the command layer. Each resolves the acting member's
 * context and returns a {@link VoiceResult} for the caller to render.
 * <p>
 * Permission changes act on the channel the member is in, on behalf of its
 * owner; a member outside any managed channel edits their own rules, which
 * apply the next time they own a channel.
 */
@Slf4j
public class VoiceCommandService {

    private final ChannelRegistry registry;
    private final PermissionEngine engine;
    private final AutokickService autokicks;
    private final OwnershipTracker ownership;
    private final ChannelLifecycleManager lifecycle;
    private final PermissionStore store;
    private final VoiceEventRouter router;
    private final AutokickWorker autokickWorker;
    private final BypassService bypass;
    private final EntitlementPolicy entitlements;
    private final KeyedMailbox mailbox;

    public VoiceCommandService(ChannelRegistry registry, PermissionEngine engine, AutokickService autokicks,
            OwnershipTracker ownership, ChannelLifecycleManager lifecycle, PermissionStore store,
            VoiceEventRouter router, AutokickWorker autokickWorker, BypassService bypass,
            EntitlementPolicy entitlements, KeyedMailbox mailbox) {
        this.registry = registry;
        this.engine = engine;
        this.autokicks = autokicks;
        this.ownership = ownership;
        this.lifecycle = lifecycle;
        this.store = store;
        this.router = router;
        this.autokickWorker = autokickWorker;
        this.bypass = bypass;
        this.entitlements = entitlements;
        this.mailbox = mailbox;
    }

    public CompletableFuture<VoiceResult<Effect>> requestSetPermission(long guildId, long actorId, TargetRef target,
            PermissionKind kind, Effect effect) {
        VoiceResult<Long> owner = resolveOwner(guildId, actorId);
        if (!owner.isOk()) {
            return done(owner.castFailure());
        }
        return engine.setRule(guildId, actorId, owner.value(), target, kind, effect);
    }

    public CompletableFuture<VoiceResult<Effect>> requestTogglePermission(long guildId, long actorId,
            TargetRef target, PermissionKind kind) {
        VoiceResult<Long> owner = resolveOwner(guildId, actorId);
        if (!owner.isOk()) {
            return done(owner.castFailure());
        }
        return engine.toggleRule(guildId, actorId, owner.value(), target, kind);
    }

    public CompletableFuture<VoiceResult<Void>> requestTransferOwnership(long guildId, long actorId,
            long newOwnerId) {
        Optional<VoiceChannelState> owned = registry.channelOwnedBy(guildId, actorId);
        if (owned.isEmpty()) {
            return done(VoiceResult.fail(VoiceErrorCode.NOT_FOUND, "you do not own a channel"));
        }
        return ownership.transferOwnership(owned.get().getId(), actorId, newOwnerId);
    }

    /**
     * Remove the actor's own persisted state.
     *
     * @return number of rules and autokick entries removed
     */
    public CompletableFuture<VoiceResult<Integer>> requestReset(long guildId, long actorId, ResetScope scope) {
        if (scope instanceof ResetScope.Target target) {
            return engine.clearRules(guildId, actorId, actorId, target.target());
        }
        if (scope instanceof ResetScope.AllRules) {
            return engine.clearRules(guildId, actorId, actorId, null);
        }
        if (scope instanceof ResetScope.Autokicks) {
            return autokicks.clear(guildId, actorId).thenApply(VoiceResult::ok);
        }
        return engine.clearRules(guildId, actorId, actorId, null)
                .thenCompose(rules -> autokicks.clear(guildId, actorId)
                        .thenApply(kicks -> rules.isOk() ? VoiceResult.ok(rules.value() + kicks) : rules));
    }

    public CompletableFuture<VoiceResult<Void>> requestAddAutokick(long guildId, long actorId, long targetId) {
        return autokicks.add(guildId, actorId, targetId);
    }

    public CompletableFuture<VoiceResult<Void>> requestRemoveAutokick(long guildId, long actorId, long targetId) {
        return autokicks.remove(guildId, actorId, targetId);
    }

    public VoiceResult<List<AutokickEntry>> listAutokicks(long guildId, long actorId) {
        try {
            return VoiceResult.ok(autokicks.list(guildId, actorId));
        } catch (RuntimeException e) {
            log.error("Listing autokicks of {} failed", actorId, e);
            return VoiceResult.fail(VoiceErrorCode.OPERATION_DEGRADED, "could not read autokick list");
        }
    }

    /** Owner or moderator of the channel the actor is in. */
    public CompletableFuture<VoiceResult<Integer>> requestSetLimit(long guildId, long actorId, int limit) {
        Optional<VoiceChannelState> channel = registry.channelContaining(guildId, actorId);
        if (channel.isEmpty()) {
            return done(VoiceResult.fail(VoiceErrorCode.NOT_FOUND, "you are not in a managed channel"));
        }
        VoiceChannelState state = channel.get();
        Long owner = state.getOwnerId();
        boolean allowed = owner != null && (owner == actorId || engine.isModerator(guildId, owner, actorId));
        if (!allowed) {
            return done(VoiceResult.fail(VoiceErrorCode.NOT_AUTHORIZED, "not the owner or a moderator"));
        }
        return lifecycle.setLimit(state.getId(), limit);
    }

    /** The channel the actor is in, or else the one they own. */
    public VoiceResult<ChannelInfo> channelInfo(long guildId, long actorId) {
        Optional<VoiceChannelState> channel = registry.channelContaining(guildId, actorId)
                .or(() -> registry.channelOwnedBy(guildId, actorId));
        if (channel.isEmpty()) {
            return VoiceResult.fail(VoiceErrorCode.NOT_FOUND, "no managed channel");
        }
        VoiceChannelState state = channel.get();
        Long owner = state.getOwnerId();
        List<Long> moderators = owner != null ? store.moderatorsOf(guildId, owner) : List.of();
        return VoiceResult.ok(new ChannelInfo(state.getId(), owner, state.getCategoryId(), state.getMembers(),
                state.getLimit(), state.getPhase(), moderators));
    }

    /** Limits and usage of a member's entitlements. */
    public AccessInfo accessInfo(long guildId, long memberId) {
        Long owned = registry.channelOwnedBy(guildId, memberId).map(VoiceChannelState::getId).orElse(null);
        return new AccessInfo(memberId, owned,
                entitlements.moderatorLimit(guildId, memberId),
                store.moderatorsOf(guildId, memberId).size(),
                entitlements.autokickLimit(guildId, memberId),
                store.autokicksOf(guildId, memberId).size(),
                bypass.status(guildId, memberId).map(BypassFlag::expiresAt).orElse(null));
    }

    public VoiceStats stats() {
        return new VoiceStats(
                router.voiceStateUpdates(),
                router.joins(),
                router.switches(),
                router.leaves(),
                router.failures(),
                lifecycle.channelsCreated(),
                lifecycle.channelsDeleted(),
                registry.all().size(),
                registry.pendingCount(),
                autokickWorker.processedCount(),
                autokickWorker.evictedCount(),
                mailbox.activeKeys());
    }

    private VoiceResult<Long> resolveOwner(long guildId, long actorId) {
        Optional<VoiceChannelState> channel = registry.channelContaining(guildId, actorId);
        if (channel.isEmpty()) {
            return VoiceResult.ok(actorId);
        }
        Long owner = channel.get().getOwnerId();
        if (owner == null) {
            return VoiceResult.fail(VoiceErrorCode.NOT_AUTHORIZED, "channel has no owner");
        }
        return VoiceResult.ok(owner);
    }

    private static <T> CompletableFuture<VoiceResult<T>> done(VoiceResult<T> result) {
        return CompletableFuture.completedFuture(result);
    }
}
