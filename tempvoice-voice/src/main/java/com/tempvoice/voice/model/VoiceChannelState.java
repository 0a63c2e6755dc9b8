package com.tempvoice.voice.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Live mirror of one managed voice channel. Mutated only from the channel's
 * serial context; reads from other threads see a consistent snapshot.
 */
public class VoiceChannelState {

    private final long id;
    private final long guildId;
    private final long categoryId;
    private final Long triggerId;
    private final Instant createdAt;

    private Long ownerId;
    private final Map<Long, Instant> members = new LinkedHashMap<>();
    private int limit;
    private OverwriteSet applied = OverwriteSet.EMPTY;
    private ChannelPhase phase;
    private long drainEpoch;
    private ScheduledFuture<?> drainTask;

    public VoiceChannelState(long id, long guildId, Long ownerId, long categoryId, Long triggerId,
            Instant createdAt, int limit) {
        this.id = id;
        this.guildId = guildId;
        this.ownerId = ownerId;
        this.categoryId = categoryId;
        this.triggerId = triggerId;
        this.createdAt = createdAt;
        this.limit = limit;
        this.phase = ChannelPhase.ACTIVE;
    }

    public long getId() {
        return id;
    }

    public long getGuildId() {
        return guildId;
    }

    public long getCategoryId() {
        return categoryId;
    }

    public Long getTriggerId() {
        return triggerId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Long getOwnerId() {
        return ownerId;
    }

    public synchronized void setOwnerId(Long ownerId) {
        this.ownerId = ownerId;
    }

    public synchronized boolean isOwnedBy(long memberId) {
        return ownerId != null && ownerId == memberId;
    }

    // ── Members ─────────────────────────────────────────────────────────

    /** @return false if the member was already present */
    public synchronized boolean addMember(long memberId, Instant joinedAt) {
        return members.putIfAbsent(memberId, joinedAt) == null;
    }

    /** @return false if the member was not present */
    public synchronized boolean removeMember(long memberId) {
        return members.remove(memberId) != null;
    }

    public synchronized boolean hasMember(long memberId) {
        return members.containsKey(memberId);
    }

    /** Members in join order. */
    public synchronized List<Long> getMembers() {
        return new ArrayList<>(members.keySet());
    }

    public synchronized Optional<Instant> joinedAt(long memberId) {
        return Optional.ofNullable(members.get(memberId));
    }

    public synchronized boolean isEmpty() {
        return members.isEmpty();
    }

    public synchronized int memberCount() {
        return members.size();
    }

    // ── Limit and overwrites ────────────────────────────────────────────

    public synchronized int getLimit() {
        return limit;
    }

    public synchronized void setLimit(int limit) {
        this.limit = limit;
    }

    public synchronized OverwriteSet getApplied() {
        return applied;
    }

    public synchronized void setApplied(OverwriteSet applied) {
        this.applied = applied;
    }

    public synchronized void recordApplied(Overwrite overwrite) {
        this.applied = applied.with(overwrite);
    }

    public synchronized void recordRemoved(TargetRef target) {
        this.applied = applied.without(target);
    }

    // ── Phase and drain ─────────────────────────────────────────────────

    public synchronized ChannelPhase getPhase() {
        return phase;
    }

    public synchronized void setPhase(ChannelPhase phase) {
        this.phase = phase;
    }

    public synchronized boolean isLive() {
        return phase == ChannelPhase.ACTIVE || phase == ChannelPhase.DRAINING;
    }

    /**
     * Enter DRAINING with a new epoch; a timer scheduled with an older epoch
     * must not delete the channel.
     */
    public synchronized long beginDrain(DrainScheduler scheduler) {
        phase = ChannelPhase.DRAINING;
        drainEpoch++;
        drainTask = scheduler.schedule(drainEpoch);
        return drainEpoch;
    }

    /** @return true if a drain was in progress */
    public synchronized boolean cancelDrain() {
        if (phase != ChannelPhase.DRAINING) {
            return false;
        }
        drainEpoch++;
        if (drainTask != null) {
            drainTask.cancel(false);
            drainTask = null;
        }
        phase = ChannelPhase.ACTIVE;
        return true;
    }

    public synchronized boolean isDrainCurrent(long epoch) {
        return phase == ChannelPhase.DRAINING && drainEpoch == epoch && members.isEmpty();
    }

    /** Mark destroyed and cancel any outstanding drain timer. */
    public synchronized void destroy() {
        phase = ChannelPhase.DESTROYED;
        drainEpoch++;
        if (drainTask != null) {
            drainTask.cancel(false);
            drainTask = null;
        }
    }

    @FunctionalInterface
    public interface DrainScheduler {
        ScheduledFuture<?> schedule(long epoch);
    }

    @Override
    public synchronized String toString() {
        return "VoiceChannelState{id=" + id + ", guild=" + guildId + ", owner=" + ownerId
                + ", phase=" + phase + ", members=" + members.keySet() + "}";
    }
}
