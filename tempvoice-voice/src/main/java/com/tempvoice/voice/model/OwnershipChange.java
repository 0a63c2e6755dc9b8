package com.tempvoice.voice.model;

import java.time.Instant;

/**
 * Entry of the append-only channel ownership log. A null owner id means the
 * channel had, or was left, without an owner.
 */
public record OwnershipChange(
        long guildId,
        long channelId,
        Long previousOwnerId,
        Long newOwnerId,
        Reason reason,
        Instant recordedAt) {

    public enum Reason {
        /** Channel created for its owner. */
        CREATED,
        /** Owner handed the channel to another member. */
        TRANSFERRED,
        /** Owner left and the longest-present member took over. */
        PROMOTED,
        /** Owner left and the channel stays ownerless. */
        ABANDONED,
        /** Unregistered platform channel adopted by reconciliation. */
        ADOPTED
    }
}
