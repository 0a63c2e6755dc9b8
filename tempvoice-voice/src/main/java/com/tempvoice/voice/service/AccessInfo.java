package com.tempvoice.voice.service;

import java.time.Instant;

/**
 * What a member is entitled to and how much of it is in use.
 *
 * @param ownedChannelId  null when the member owns no live channel
 * @param bypassExpiresAt null when no bypass flag is active
 */
public record AccessInfo(
        long memberId,
        Long ownedChannelId,
        int moderatorLimit,
        int moderators,
        int autokickLimit,
        int autokicks,
        Instant bypassExpiresAt) {
}
