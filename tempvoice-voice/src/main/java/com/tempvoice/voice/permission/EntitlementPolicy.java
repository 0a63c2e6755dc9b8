package com.tempvoice.voice.permission;

/**
 * Per-owner limits granted by the premium/economy layer.
 */
public interface EntitlementPolicy {

    int moderatorLimit(long guildId, long ownerId);

    int autokickLimit(long guildId, long ownerId);
}
