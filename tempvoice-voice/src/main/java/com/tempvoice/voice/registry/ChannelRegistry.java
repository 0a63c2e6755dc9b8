package com.tempvoice.voice.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tempvoice.voice.model.VoiceChannelState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory mirror of live channels, indexed by channel id and by owner.
 * Never the source of truth across restarts.
 * <p>
 * Inserts and evictions for a channel happen inside that channel's serial
 * context, so a join racing a deletion sees either the live entry or none.
 */
@Slf4j
public class ChannelRegistry {

    private final Map<Long, VoiceChannelState> channels = new ConcurrentHashMap<>();
    private final Map<OwnerKey, Long> ownerIndex = new ConcurrentHashMap<>();
    private final Map<String, PendingCreation> pending = new ConcurrentHashMap<>();
    private final Cache<Long, List<BufferedMove>> buffered;
    private final Cache<String, Boolean> abandoned;

    record OwnerKey(long guildId, long ownerId) {
    }

    public ChannelRegistry(Duration pendingEventTtl) {
        this.buffered = Caffeine.newBuilder()
                .expireAfterWrite(pendingEventTtl)
                .maximumSize(10_000)
                .build();
        this.abandoned = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(10))
                .maximumSize(10_000)
                .build();
    }

    // ── Live channels ───────────────────────────────────────────────────

    public Optional<VoiceChannelState> get(long channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    public boolean contains(long channelId) {
        return channels.containsKey(channelId);
    }

    public void register(VoiceChannelState state) {
        channels.put(state.getId(), state);
        Long owner = state.getOwnerId();
        if (owner != null) {
            ownerIndex.put(new OwnerKey(state.getGuildId(), owner), state.getId());
        }
        log.debug("Registered channel {} (owner {})", state.getId(), owner);
    }

    /**
     * Remove the channel and its owner index entry.
     *
     * @return the evicted state, if it was registered
     */
    public Optional<VoiceChannelState> evict(long channelId) {
        VoiceChannelState state = channels.remove(channelId);
        if (state == null) {
            return Optional.empty();
        }
        Long owner = state.getOwnerId();
        if (owner != null) {
            ownerIndex.remove(new OwnerKey(state.getGuildId(), owner), channelId);
        }
        log.debug("Evicted channel {}", channelId);
        return Optional.of(state);
    }

    /** Reassign the channel to a new owner, or none, keeping the index in step. */
    public void changeOwner(VoiceChannelState state, Long newOwnerId) {
        Long previous = state.getOwnerId();
        if (previous != null) {
            ownerIndex.remove(new OwnerKey(state.getGuildId(), previous), state.getId());
        }
        state.setOwnerId(newOwnerId);
        if (newOwnerId != null && channels.containsKey(state.getId())) {
            ownerIndex.put(new OwnerKey(state.getGuildId(), newOwnerId), state.getId());
        }
    }

    public Optional<VoiceChannelState> channelOwnedBy(long guildId, long ownerId) {
        Long channelId = ownerIndex.get(new OwnerKey(guildId, ownerId));
        return channelId == null ? Optional.empty() : get(channelId);
    }

    /** The live channel the member is currently in, if any. */
    public Optional<VoiceChannelState> channelContaining(long guildId, long memberId) {
        return channels.values().stream()
                .filter(s -> s.getGuildId() == guildId && s.hasMember(memberId))
                .findFirst();
    }

    public List<VoiceChannelState> channelsInGuild(long guildId) {
        return channels.values().stream()
                .filter(s -> s.getGuildId() == guildId)
                .toList();
    }

    public Collection<VoiceChannelState> all() {
        return new ArrayList<>(channels.values());
    }

    public int liveInCategory(long guildId, long categoryId) {
        int n = 0;
        for (VoiceChannelState state : channels.values()) {
            if (state.getGuildId() == guildId && state.getCategoryId() == categoryId && state.isLive()) {
                n++;
            }
        }
        return n;
    }

    // ── Pending creations ───────────────────────────────────────────────

    public void addPending(PendingCreation creation) {
        pending.put(creation.requestId(), creation);
    }

    public Optional<PendingCreation> getPending(String requestId) {
        return Optional.ofNullable(pending.get(requestId));
    }

    /** @return the removed creation, empty if it was already resolved */
    public Optional<PendingCreation> removePending(String requestId) {
        return Optional.ofNullable(pending.remove(requestId));
    }

    public boolean hasPending(long guildId) {
        return pending.values().stream().anyMatch(p -> p.guildId() == guildId);
    }

    public int pendingCount() {
        return pending.size();
    }

    public Optional<PendingCreation> pendingFor(long guildId, long ownerId) {
        return pending.values().stream()
                .filter(p -> p.guildId() == guildId && p.ownerId() == ownerId)
                .findFirst();
    }

    /** Remember a request given up on, so a late acknowledgement can be cleaned up. */
    public void markAbandoned(String requestId) {
        abandoned.put(requestId, Boolean.TRUE);
    }

    public boolean isAbandoned(String requestId) {
        return abandoned.getIfPresent(requestId) != null;
    }

    // ── Buffered events ─────────────────────────────────────────────────

    public void buffer(long channelId, BufferedMove move) {
        buffered.asMap().compute(channelId, (id, moves) -> {
            List<BufferedMove> list = moves != null ? moves : new ArrayList<>();
            list.add(move);
            return list;
        });
        log.debug("Buffered {} for pending channel {}", move, channelId);
    }

    /** Remove and return the moves buffered for the channel, in arrival order. */
    public List<BufferedMove> drainBuffered(long channelId) {
        List<BufferedMove> moves = buffered.asMap().remove(channelId);
        return moves != null ? moves : List.of();
    }
}
