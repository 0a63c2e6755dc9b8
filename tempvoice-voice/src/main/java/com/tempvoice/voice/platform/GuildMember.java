package com.tempvoice.voice.platform;

import java.util.Set;

/**
 * Cached view of a guild member. {@code voiceChannelId} is null when the
 * member is not connected to voice.
 */
public record GuildMember(long guildId, long memberId, Set<Long> roleIds, String displayName, boolean bot,
        Long voiceChannelId) {

    public GuildMember {
        roleIds = roleIds != null ? Set.copyOf(roleIds) : Set.of();
    }

    public GuildMember withVoiceChannel(Long channelId) {
        return new GuildMember(guildId, memberId, roleIds, displayName, bot, channelId);
    }
}
