package com.tempvoice.voice.permission;

import com.tempvoice.common.config.TempVoiceConfig;
import com.tempvoice.common.infra.KeyedMailbox;
import com.tempvoice.voice.model.BypassFlag;
import com.tempvoice.voice.model.Effect;
import com.tempvoice.voice.model.Overwrite;
import com.tempvoice.voice.model.OverwriteSet;
import com.tempvoice.voice.model.PermissionBits;
import com.tempvoice.voice.model.PermissionKind;
import com.tempvoice.voice.model.PermissionRule;
import com.tempvoice.voice.model.TargetRef;
import com.tempvoice.voice.model.VoiceChannelState;
import com.tempvoice.voice.model.VoiceErrorCode;
import com.tempvoice.voice.model.VoiceResult;
import com.tempvoice.voice.platform.GuildDirectory;
import com.tempvoice.voice.platform.GuildMember;
import com.tempvoice.voice.platform.PlatformCommandSink;
import com.tempvoice.voice.registry.ChannelRegistry;
import com.tempvoice.voice.registry.MailboxKeys;
import com.tempvoice.voice.store.PermissionStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Computes the overwrites a channel should carry and applies the difference
 * to the platform.
 * <p>
 * Per target and bit, later layers win: default policy, bypass exemptions,
 * moderator grants, allow rules, deny rules. For every present member, denies
 * inherited through role rules are copied onto the member's own overwrite so
 * the platform cannot let a role allow win. Rules of an owner who is not in
 * the guild, and of ownerless channels, stay dormant.
 */
@Slf4j
public class PermissionEngine {

    private final Supplier<TempVoiceConfig> config;
    private final PermissionStore store;
    private final GuildDirectory directory;
    private final PlatformCommandSink sink;
    private final ChannelRegistry registry;
    private final KeyedMailbox mailbox;
    private final EntitlementPolicy entitlements;
    private final Clock clock;

    public PermissionEngine(Supplier<TempVoiceConfig> config, PermissionStore store, GuildDirectory directory,
            PlatformCommandSink sink, ChannelRegistry registry, KeyedMailbox mailbox,
            EntitlementPolicy entitlements, Clock clock) {
        this.config = config;
        this.store = store;
        this.directory = directory;
        this.sink = sink;
        this.registry = registry;
        this.mailbox = mailbox;
        this.entitlements = entitlements;
        this.clock = clock;
    }

    // ── Computation ─────────────────────────────────────────────────────

    public OverwriteSet computeEffectiveOverwrites(VoiceChannelState state) {
        return compute(state.getGuildId(), state.getOwnerId(), state.getCategoryId(), state.getMembers());
    }

    /**
     * Overwrites for a channel that does not exist yet, so restored denials
     * are in force from the first moment.
     */
    public OverwriteSet computeInitialOverwrites(long guildId, long ownerId, long categoryId) {
        return compute(guildId, ownerId, categoryId, List.of(ownerId));
    }

    OverwriteSet compute(long guildId, Long ownerId, long categoryId, List<Long> members) {
        TempVoiceConfig cfg = config.get();
        Optional<TempVoiceConfig.GuildConfig> guild = cfg.findGuild(guildId);
        OverwriteSet.Builder builder = OverwriteSet.builder();

        // Default policy
        TargetRef everyone = TargetRef.everyone(guildId);
        long everyoneDeny = guild.flatMap(g -> g.findCategory(categoryId))
                .map(c -> kindBits(c.getEveryoneDeny()))
                .orElse(0L);
        if (everyoneDeny != 0) {
            builder.deny(everyone, everyoneDeny);
        }
        long restricted = everyoneDeny;
        TempVoiceConfig.MuteRolesConfig mute = guild.map(TempVoiceConfig.GuildConfig::getMuteRoles).orElse(null);
        if (mute != null) {
            restricted |= denyRole(builder, mute.getStreamOff(), PermissionBits.STREAM);
            restricted |= denyRole(builder, mute.getSendMessagesOff(), PermissionBits.SEND_MESSAGES);
            restricted |= denyRole(builder, mute.getAttachFilesOff(), PermissionBits.ATTACHMENTS);
        }
        if (ownerId != null) {
            builder.allow(TargetRef.member(ownerId), PermissionBits.OWNER);
        }
        for (Long memberId : members) {
            // Reserve slots for present members ahead of absent rule targets
            builder.apply(TargetRef.member(memberId), 0, 0);
        }

        // Bypass exemptions
        if (restricted != 0 && !members.isEmpty()) {
            for (BypassFlag flag : store.activeBypasses(guildId, members, clock.instant())) {
                if (ownerId == null || flag.memberId() != ownerId) {
                    builder.allow(TargetRef.member(flag.memberId()), restricted);
                }
            }
        }

        if (ownerId != null && directory.isPresent(guildId, ownerId)) {
            applyRules(builder, guildId, ownerId, members);
        } else if (ownerId != null) {
            log.debug("Owner {} not in guild {}, rules dormant", ownerId, guildId);
        }

        int max = cfg.getVoice().getMaxOverwrites();
        if (builder.size() > max) {
            log.warn("Channel overwrites for owner {} in guild {} truncated: {} > {}", ownerId, guildId,
                    builder.size(), max);
        }
        return builder.build(max);
    }

    private void applyRules(OverwriteSet.Builder builder, long guildId, long ownerId, List<Long> members) {
        TargetRef owner = TargetRef.member(ownerId);
        List<PermissionRule> rules = new ArrayList<>();
        for (PermissionRule rule : store.rulesForOwner(guildId, ownerId)) {
            if (rule.target().equals(owner)) {
                continue;
            }
            if (!directory.resolves(guildId, rule.target())) {
                log.debug("Skipping rule for unresolvable target {} in guild {}", rule.target(), guildId);
                continue;
            }
            rules.add(rule);
        }

        for (PermissionRule rule : rules) {
            if (rule.kind() == PermissionKind.MODERATOR && rule.effect() == Effect.ALLOW) {
                builder.allow(rule.target(), PermissionBits.MANAGE_MESSAGES);
            }
        }
        for (PermissionRule rule : rules) {
            if (rule.kind() != PermissionKind.MODERATOR && rule.effect() == Effect.ALLOW) {
                builder.allow(rule.target(), rule.kind().bits());
            }
        }
        for (PermissionRule rule : rules) {
            if (rule.effect() == Effect.DENY) {
                builder.deny(rule.target(), rule.kind().bits());
            }
        }

        // Role denies folded onto present members; @everyone rules stay a baseline
        for (Long memberId : members) {
            if (memberId == ownerId) {
                continue;
            }
            Set<Long> roles = directory.member(guildId, memberId).map(GuildMember::roleIds).orElse(Set.of());
            long denied = 0;
            for (PermissionRule rule : rules) {
                if (rule.effect() == Effect.DENY && rule.target() instanceof TargetRef.Role role
                        && role.id() != guildId && roles.contains(role.id())) {
                    denied |= rule.kind().bits();
                }
            }
            if (denied != 0) {
                builder.deny(TargetRef.member(memberId), denied);
            }
        }
    }

    private static long denyRole(OverwriteSet.Builder builder, Long roleId, long bits) {
        if (roleId == null) {
            return 0;
        }
        builder.deny(TargetRef.role(roleId), bits);
        return bits;
    }

    private static long kindBits(List<String> kinds) {
        long bits = 0;
        if (kinds == null) {
            return bits;
        }
        for (String key : kinds) {
            Optional<PermissionKind> kind = PermissionKind.fromKey(key);
            if (kind.isPresent()) {
                bits |= kind.get().bits();
            } else {
                log.warn("Unknown permission kind in config: {}", key);
            }
        }
        return bits;
    }

    // ── Application ─────────────────────────────────────────────────────

    /**
     * Issue one command per changed or vanished target. The applied snapshot
     * advances per successful command, so a partial failure is retried by the
     * next application.
     */
    public CompletableFuture<VoiceResult<Void>> applyOverwrites(VoiceChannelState state, OverwriteSet desired) {
        OverwriteSet.Diff diff = desired.diff(state.getApplied());
        if (diff.isEmpty()) {
            return CompletableFuture.completedFuture(VoiceResult.ok());
        }
        long guildId = state.getGuildId();
        long channelId = state.getId();
        log.debug("Applying {} overwrite changes to channel {}", diff.commandCount(), channelId);

        List<CompletableFuture<Void>> calls = new ArrayList<>();
        for (Overwrite overwrite : diff.upserts()) {
            calls.add(sink.editOverwrite(guildId, channelId, overwrite)
                    .thenRun(() -> state.recordApplied(overwrite)));
        }
        for (TargetRef target : diff.removals()) {
            calls.add(sink.removeOverwrite(guildId, channelId, target)
                    .thenRun(() -> state.recordRemoved(target)));
        }
        return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]))
                .handle((ignored, err) -> {
                    if (err == null) {
                        return VoiceResult.ok();
                    }
                    log.warn("Applying overwrites to channel {} failed: {}", channelId, err.getMessage());
                    return VoiceResult.fail(err);
                });
    }

    /** Recompute and apply. Call from the channel's serial context. */
    public CompletableFuture<VoiceResult<Void>> reapply(VoiceChannelState state) {
        if (!state.isLive()) {
            return CompletableFuture.completedFuture(VoiceResult.ok());
        }
        OverwriteSet desired;
        try {
            desired = computeEffectiveOverwrites(state);
        } catch (RuntimeException e) {
            log.error("Computing overwrites for channel {} failed", state.getId(), e);
            return CompletableFuture.completedFuture(
                    VoiceResult.fail(VoiceErrorCode.OPERATION_DEGRADED, e.getMessage()));
        }
        return applyOverwrites(state, desired);
    }

    /** Recompute and apply from outside the channel's serial context. */
    public CompletableFuture<VoiceResult<Void>> reapplyChannel(long channelId) {
        return mailbox.submitAsync(MailboxKeys.channel(channelId), () -> registry.get(channelId)
                .map(this::reapply)
                .orElseGet(() -> CompletableFuture.completedFuture(
                        VoiceResult.fail(VoiceErrorCode.NOT_FOUND, "channel " + channelId + " not live"))));
    }

    /** Re-apply the owner's live channel; no channel is not an error. */
    public CompletableFuture<VoiceResult<Void>> reapplyOwnerChannel(long guildId, long ownerId) {
        return registry.channelOwnedBy(guildId, ownerId)
                .map(state -> reapplyChannel(state.getId()))
                .orElseGet(() -> CompletableFuture.completedFuture(VoiceResult.ok()));
    }

    // ── Rules ───────────────────────────────────────────────────────────

    /**
     * Persist a rule for the owner and re-apply the owner's live channel.
     *
     * @param actorId member issuing the change, the owner or one of their moderators
     * @return the stored effect; a cleared moderator grant reports DENY
     */
    public CompletableFuture<VoiceResult<Effect>> setRule(long guildId, long actorId, long ownerId,
            TargetRef target, PermissionKind kind, Effect effect) {
        return writeRule(guildId, actorId, ownerId, target, kind, existing -> effect);
    }

    /**
     * Flip the rule between ALLOW and DENY. An absent rule becomes DENY, or a
     * moderator grant for MODERATOR.
     */
    public CompletableFuture<VoiceResult<Effect>> toggleRule(long guildId, long actorId, long ownerId,
            TargetRef target, PermissionKind kind) {
        return writeRule(guildId, actorId, ownerId, target, kind, existing -> existing
                .filter(rule -> rule.effect() == Effect.ALLOW || kind != PermissionKind.MODERATOR)
                .map(rule -> rule.effect().opposite())
                .orElse(kind == PermissionKind.MODERATOR ? Effect.ALLOW : Effect.DENY));
    }

    /**
     * Delete the owner's rules for one target, or all when {@code target} is
     * null. Only the owner may reset.
     */
    public CompletableFuture<VoiceResult<Integer>> clearRules(long guildId, long actorId, long ownerId,
            TargetRef target) {
        if (actorId != ownerId) {
            return CompletableFuture.completedFuture(
                    VoiceResult.fail(VoiceErrorCode.NOT_AUTHORIZED, "only the owner can reset rules"));
        }
        return mailbox.submit(MailboxKeys.moderators(guildId, ownerId),
                        () -> store.clearRules(guildId, ownerId, target))
                .thenCompose(deleted -> reapplyOwnerChannel(guildId, ownerId)
                        .thenApply(applied -> applied.isOk()
                                ? VoiceResult.ok(deleted)
                                : VoiceResult.<Integer>fail(VoiceErrorCode.OPERATION_DEGRADED, applied.message())))
                .exceptionally(err -> storeFailure("clear rules", err));
    }

    public boolean isModerator(long guildId, long ownerId, long memberId) {
        return store.findRule(guildId, ownerId, TargetRef.member(memberId), PermissionKind.MODERATOR)
                .map(rule -> rule.effect() == Effect.ALLOW)
                .orElse(false);
    }

    private CompletableFuture<VoiceResult<Effect>> writeRule(long guildId, long actorId, long ownerId,
            TargetRef target, PermissionKind kind, Function<Optional<PermissionRule>, Effect> next) {
        VoiceResult<Void> check = authorize(guildId, actorId, ownerId, target, kind);
        if (!check.isOk()) {
            return CompletableFuture.completedFuture(check.castFailure());
        }
        String key = kind == PermissionKind.MODERATOR
                ? MailboxKeys.moderators(guildId, ownerId)
                : MailboxKeys.rule(guildId, ownerId, target, kind);
        return mailbox.submit(key, () -> {
                    Optional<PermissionRule> existing = store.findRule(guildId, ownerId, target, kind);
                    Effect effect = next.apply(existing);
                    if (kind == PermissionKind.MODERATOR) {
                        return writeModerator(guildId, ownerId, target, existing, effect);
                    }
                    store.upsertRule(guildId, ownerId, target, kind, effect);
                    return VoiceResult.ok(effect);
                })
                .thenCompose(result -> {
                    if (!result.isOk()) {
                        return CompletableFuture.completedFuture(result);
                    }
                    return reapplyOwnerChannel(guildId, ownerId).thenApply(applied -> applied.isOk()
                            ? result
                            : VoiceResult.<Effect>fail(VoiceErrorCode.OPERATION_DEGRADED,
                                    "rule saved, channel update failed: " + applied.message()));
                })
                .exceptionally(err -> storeFailure("write rule", err));
    }

    private VoiceResult<Effect> writeModerator(long guildId, long ownerId, TargetRef target,
            Optional<PermissionRule> existing, Effect effect) {
        if (effect == Effect.DENY) {
            store.deleteRule(guildId, ownerId, target, PermissionKind.MODERATOR);
            return VoiceResult.ok(Effect.DENY);
        }
        boolean alreadyModerator = existing.map(r -> r.effect() == Effect.ALLOW).orElse(false);
        int limit = entitlements.moderatorLimit(guildId, ownerId);
        if (!alreadyModerator && store.moderatorsOf(guildId, ownerId).size() >= limit) {
            return VoiceResult.fail(VoiceErrorCode.LIMIT_REACHED, "moderator limit of " + limit + " reached");
        }
        store.upsertRule(guildId, ownerId, target, PermissionKind.MODERATOR, Effect.ALLOW);
        return VoiceResult.ok(Effect.ALLOW);
    }

    /**
     * The owner may set any kind. A moderator may set non-moderator kinds for
     * targets that are neither the owner nor another moderator.
     */
    VoiceResult<Void> authorize(long guildId, long actorId, long ownerId, TargetRef target, PermissionKind kind) {
        if (target.equals(TargetRef.member(ownerId))) {
            return VoiceResult.fail(VoiceErrorCode.INVALID_TARGET, "cannot target the channel owner");
        }
        if (actorId != ownerId) {
            if (!isModerator(guildId, ownerId, actorId)) {
                return VoiceResult.fail(VoiceErrorCode.NOT_AUTHORIZED, "not the owner or a moderator");
            }
            if (kind == PermissionKind.MODERATOR) {
                return VoiceResult.fail(VoiceErrorCode.NOT_AUTHORIZED, "only the owner manages moderators");
            }
            if (target instanceof TargetRef.Member member && isModerator(guildId, ownerId, member.id())) {
                return VoiceResult.fail(VoiceErrorCode.NOT_AUTHORIZED, "cannot modify another moderator");
            }
            if (target.equals(TargetRef.member(actorId))) {
                return VoiceResult.fail(VoiceErrorCode.INVALID_TARGET, "cannot target yourself");
            }
        }
        if (kind == PermissionKind.MODERATOR && !(target instanceof TargetRef.Member)) {
            return VoiceResult.fail(VoiceErrorCode.INVALID_TARGET, "moderator grants need a member target");
        }
        if (!directory.resolves(guildId, target)) {
            return VoiceResult.fail(VoiceErrorCode.INVALID_TARGET, "unknown target " + target);
        }
        if (target instanceof TargetRef.Member member
                && directory.member(guildId, member.id()).map(GuildMember::bot).orElse(false)) {
            return VoiceResult.fail(VoiceErrorCode.INVALID_TARGET, "cannot target a bot");
        }
        return VoiceResult.ok();
    }

    private static <T> VoiceResult<T> storeFailure(String operation, Throwable err) {
        log.error("Failed to {}: {}", operation, err.getMessage(), err);
        return VoiceResult.fail(VoiceErrorCode.OPERATION_DEGRADED, operation + " failed");
    }
}
