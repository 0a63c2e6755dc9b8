package com.tempvoice.voice.model;

import java.time.Instant;

/**
 * A persisted grant or denial by a channel owner. At most one rule exists per
 * (guild, owner, target, kind); a later write replaces the earlier one.
 */
public record PermissionRule(
        long guildId,
        long ownerId,
        TargetRef target,
        PermissionKind kind,
        Effect effect,
        Instant updatedAt) {
}
