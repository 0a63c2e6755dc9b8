package com.tempvoice.voice.model;

import java.time.Instant;

/** A member the owner wants removed from their channel on sight. */
public record AutokickEntry(long guildId, long ownerId, long targetId, Instant createdAt) {
}
