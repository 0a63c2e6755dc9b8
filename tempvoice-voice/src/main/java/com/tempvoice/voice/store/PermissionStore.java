package com.tempvoice.voice.store;

import com.tempvoice.voice.model.AutokickEntry;
import com.tempvoice.voice.model.BypassFlag;
import com.tempvoice.voice.model.Effect;
import com.tempvoice.voice.model.OwnershipChange;
import com.tempvoice.voice.model.PermissionKind;
import com.tempvoice.voice.model.PermissionRule;
import com.tempvoice.voice.model.TargetRef;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Source of truth for everything that must outlive a channel: permission
 * rules, autokick lists, bypass flags and the ownership log. Every record is
 * scoped by guild id.
 */
public interface PermissionStore {

    // ── Permission rules ────────────────────────────────────────────────

    /** Insert or replace the rule for (guild, owner, target, kind). */
    PermissionRule upsertRule(long guildId, long ownerId, TargetRef target, PermissionKind kind, Effect effect);

    Optional<PermissionRule> findRule(long guildId, long ownerId, TargetRef target, PermissionKind kind);

    /** @return true if a rule was deleted */
    boolean deleteRule(long guildId, long ownerId, TargetRef target, PermissionKind kind);

    List<PermissionRule> rulesForOwner(long guildId, long ownerId);

    /**
     * Delete the owner's rules for one target, or all of them when
     * {@code target} is null.
     *
     * @return number of rules deleted
     */
    int clearRules(long guildId, long ownerId, TargetRef target);

    /** Members holding an allowed MODERATOR rule from the owner. */
    List<Long> moderatorsOf(long guildId, long ownerId);

    // ── Autokick ────────────────────────────────────────────────────────

    /** @return false if the entry already existed */
    boolean addAutokick(long guildId, long ownerId, long targetId);

    /** @return false if no entry existed */
    boolean removeAutokick(long guildId, long ownerId, long targetId);

    boolean isAutokicked(long guildId, long ownerId, long targetId);

    List<AutokickEntry> autokicksOf(long guildId, long ownerId);

    int clearAutokicks(long guildId, long ownerId);

    // ── Bypass ──────────────────────────────────────────────────────────

    BypassFlag upsertBypass(long guildId, long memberId, Instant expiresAt);

    Optional<BypassFlag> findBypass(long guildId, long memberId);

    boolean deleteBypass(long guildId, long memberId);

    /** Flags of the given members that are active at {@code now}. */
    List<BypassFlag> activeBypasses(long guildId, Collection<Long> memberIds, Instant now);

    /**
     * Delete every flag, in any guild, that expired at or before {@code now}.
     *
     * @return the deleted flags
     */
    List<BypassFlag> deleteExpiredBypasses(Instant now);

    // ── Ownership log ───────────────────────────────────────────────────

    void appendOwnershipChange(OwnershipChange change);

    List<OwnershipChange> ownershipHistory(long guildId, long channelId);
}
