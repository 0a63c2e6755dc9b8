package com.tempvoice.voice.registry;

import com.tempvoice.voice.model.PermissionKind;
import com.tempvoice.voice.model.TargetRef;

/**
 * Serialization keys for {@link com.tempvoice.common.infra.KeyedMailbox}.
 */
public final class MailboxKeys {

    private MailboxKeys() {
    }

    /** All events and registry mutations of one channel. */
    public static String channel(long channelId) {
        return "channel:" + channelId;
    }

    /** Channel creation for one member. */
    public static String owner(long guildId, long ownerId) {
        return "owner:" + guildId + ":" + ownerId;
    }

    /** Writes of one rule. */
    public static String rule(long guildId, long ownerId, TargetRef target, PermissionKind kind) {
        return "rule:" + guildId + ":" + ownerId + ":" + target.type() + ":" + target.id() + ":" + kind.name();
    }

    /** Moderator grants of one owner, which share a limit. */
    public static String moderators(long guildId, long ownerId) {
        return "moderators:" + guildId + ":" + ownerId;
    }

    /** Autokick list of one owner. */
    public static String autokick(long guildId, long ownerId) {
        return "autokick:" + guildId + ":" + ownerId;
    }
}
