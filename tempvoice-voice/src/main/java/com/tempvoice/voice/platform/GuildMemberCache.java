package com.tempvoice.voice.platform;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory guild membership fed by platform events.
 */
@Slf4j
public class GuildMemberCache implements GuildDirectory {

    private final Map<Long, Map<Long, GuildMember>> members = new ConcurrentHashMap<>();
    private final Map<Long, Set<Long>> roles = new ConcurrentHashMap<>();

    @Override
    public Optional<GuildMember> member(long guildId, long memberId) {
        Map<Long, GuildMember> guild = members.get(guildId);
        return guild == null ? Optional.empty() : Optional.ofNullable(guild.get(memberId));
    }

    @Override
    public boolean roleExists(long guildId, long roleId) {
        Set<Long> known = roles.get(guildId);
        return known != null && known.contains(roleId);
    }

    @Override
    public List<GuildMember> membersInChannel(long guildId, long channelId) {
        Map<Long, GuildMember> guild = members.get(guildId);
        if (guild == null) {
            return List.of();
        }
        return guild.values().stream()
                .filter(m -> m.voiceChannelId() != null && m.voiceChannelId() == channelId)
                .toList();
    }

    /**
     * Add or refresh a member, keeping the known voice channel.
     *
     * @return the previous entry, if any
     */
    public Optional<GuildMember> upsert(long guildId, long memberId, Set<Long> roleIds, String displayName,
            boolean bot) {
        Map<Long, GuildMember> guild = members.computeIfAbsent(guildId, g -> new ConcurrentHashMap<>());
        GuildMember previous = guild.get(memberId);
        Long voice = previous != null ? previous.voiceChannelId() : null;
        guild.put(memberId, new GuildMember(guildId, memberId, roleIds, displayName, bot, voice));
        if (roleIds != null && !roleIds.isEmpty()) {
            roles.computeIfAbsent(guildId, g -> ConcurrentHashMap.newKeySet()).addAll(roleIds);
        }
        return Optional.ofNullable(previous);
    }

    /** @return the removed entry, if any */
    public Optional<GuildMember> remove(long guildId, long memberId) {
        Map<Long, GuildMember> guild = members.get(guildId);
        return guild == null ? Optional.empty() : Optional.ofNullable(guild.remove(memberId));
    }

    /**
     * Record the member's current voice channel. Unknown members are added with
     * no roles so that voice activity alone makes them resolvable.
     */
    public void updateVoiceChannel(long guildId, long memberId, Long channelId, boolean bot) {
        Map<Long, GuildMember> guild = members.computeIfAbsent(guildId, g -> new ConcurrentHashMap<>());
        guild.compute(memberId, (id, existing) -> existing != null
                ? existing.withVoiceChannel(channelId)
                : new GuildMember(guildId, memberId, Set.of(), null, bot, channelId));
    }

    public void replaceRoles(long guildId, Set<Long> roleIds) {
        Set<Long> known = ConcurrentHashMap.newKeySet();
        known.addAll(roleIds);
        roles.put(guildId, known);
        log.debug("Guild {} has {} roles", guildId, known.size());
    }

    public int memberCount(long guildId) {
        Map<Long, GuildMember> guild = members.get(guildId);
        return guild == null ? 0 : guild.size();
    }
}
