package com.tempvoice.voice.model;

/**
 * Lifecycle of a managed voice channel.
 */
public enum ChannelPhase {
    /** Create command issued, platform acknowledgement outstanding. */
    PENDING,
    ACTIVE,
    /** Empty; deleted when the grace window expires without a rejoin. */
    DRAINING,
    DESTROYED
}
