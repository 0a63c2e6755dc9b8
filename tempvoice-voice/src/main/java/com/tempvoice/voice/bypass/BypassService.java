package com.tempvoice.voice.bypass;

import com.tempvoice.voice.model.BypassFlag;
import com.tempvoice.voice.permission.PermissionEngine;
import com.tempvoice.voice.registry.ChannelRegistry;
import com.tempvoice.voice.store.PermissionStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Grants and expires bypass flags. A change re-applies the live channel the
 * member is in, so the exemption takes effect without a rejoin.
 */
@Slf4j
public class BypassService {

    /** Granted for bumping the server. */
    public static final Duration BUMP_EXTENSION = Duration.ofHours(12);
    /** Granted for chat activity. */
    public static final Duration ACTIVITY_EXTENSION = Duration.ofHours(6);

    private final PermissionStore store;
    private final ChannelRegistry registry;
    private final PermissionEngine engine;
    private final Clock clock;

    public BypassService(PermissionStore store, ChannelRegistry registry, PermissionEngine engine, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.engine = engine;
        this.clock = clock;
    }

    /**
     * Extend the member's bypass by {@code duration}, counting from the current
     * expiry if it is still in the future.
     */
    public synchronized BypassFlag extend(long guildId, long memberId, Duration duration) {
        Instant now = clock.instant();
        Instant base = store.findBypass(guildId, memberId)
                .map(BypassFlag::expiresAt)
                .filter(expiry -> expiry.isAfter(now))
                .orElse(now);
        BypassFlag flag = store.upsertBypass(guildId, memberId, base.plus(duration));
        log.info("Bypass for member {} in guild {} extended to {}", memberId, guildId, flag.expiresAt());
        reapplyMemberChannel(guildId, memberId);
        return flag;
    }

    /** The member's active flag, if any. */
    public Optional<BypassFlag> status(long guildId, long memberId) {
        Instant now = clock.instant();
        return store.findBypass(guildId, memberId).filter(flag -> flag.isActive(now));
    }

    public Duration remaining(long guildId, long memberId) {
        return status(guildId, memberId)
                .map(flag -> Duration.between(clock.instant(), flag.expiresAt()))
                .orElse(Duration.ZERO);
    }

    /** @return true if a flag was removed */
    public synchronized boolean clear(long guildId, long memberId) {
        boolean removed = store.deleteBypass(guildId, memberId);
        if (removed) {
            log.info("Bypass for member {} in guild {} cleared", memberId, guildId);
            reapplyMemberChannel(guildId, memberId);
        }
        return removed;
    }

    /**
     * Delete expired flags and re-apply the channels their members are in.
     *
     * @return number of flags removed
     */
    public int sweep() {
        List<BypassFlag> expired = store.deleteExpiredBypasses(clock.instant());
        for (BypassFlag flag : expired) {
            reapplyMemberChannel(flag.guildId(), flag.memberId());
        }
        if (!expired.isEmpty()) {
            log.info("Expired {} bypass flags", expired.size());
        }
        return expired.size();
    }

    private void reapplyMemberChannel(long guildId, long memberId) {
        registry.channelContaining(guildId, memberId)
                .ifPresent(state -> engine.reapplyChannel(state.getId()));
    }
}
