package com.tempvoice.voice.model;

import java.time.Instant;

/**
 * Time-bounded exemption from the default restrictive channel policy.
 */
public record BypassFlag(long guildId, long memberId, Instant expiresAt) {

    public boolean isActive(Instant now) {
        return expiresAt.isAfter(now);
    }
}
