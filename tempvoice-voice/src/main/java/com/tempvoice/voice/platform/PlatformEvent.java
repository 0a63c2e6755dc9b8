package com.tempvoice.voice.platform;

import java.util.Set;

/**
 * Events consumed from the chat platform.
 */
public sealed interface PlatformEvent {

    long guildId();

    /**
     * A member's voice connection moved. {@code fromChannelId} is null on
     * connect, {@code toChannelId} is null on disconnect.
     */
    record MemberVoiceStateChanged(long guildId, long memberId, Long fromChannelId, Long toChannelId,
            boolean bot) implements PlatformEvent {
    }

    /** Asynchronous acknowledgement of a create command. */
    record ChannelCreateAck(long guildId, String requestId, long channelId) implements PlatformEvent {
    }

    record ChannelCreateFailed(long guildId, String requestId, String reason) implements PlatformEvent {
    }

    record ChannelDeleted(long guildId, long channelId) implements PlatformEvent {
    }

    /** Member joined the guild or changed roles or name. */
    record MemberUpdated(long guildId, long memberId, Set<Long> roleIds, String displayName,
            boolean bot) implements PlatformEvent {
    }

    record MemberRemoved(long guildId, long memberId) implements PlatformEvent {
    }

    /** Full set of role ids currently defined in the guild. */
    record GuildRolesChanged(long guildId, Set<Long> roleIds) implements PlatformEvent {
    }
}
