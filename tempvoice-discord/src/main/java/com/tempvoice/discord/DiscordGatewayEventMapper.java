package com.tempvoice.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.tempvoice.voice.platform.PlatformEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Translates gateway dispatches into {@link PlatformEvent}s.
 * <p>
 * Discord reports only the new voice channel of a member, so the last known
 * channel per member is tracked here to supply the previous one. Role events
 * carry a single role; the full role set per guild is tracked the same way.
 */
@Slf4j
public class DiscordGatewayEventMapper {

    private final Map<String, Long> voiceChannels = new ConcurrentHashMap<>();
    private final Map<Long, Set<Long>> guildRoles = new ConcurrentHashMap<>();

    /**
     * Map one dispatch.
     *
     * @param type dispatch name ({@code t})
     * @param data dispatch payload ({@code d})
     * @return events in delivery order, empty for irrelevant dispatches
     */
    public List<PlatformEvent> map(String type, JsonNode data) {
        if (type == null || data == null || data.isNull()) {
            return List.of();
        }
        return switch (type) {
            case "GUILD_CREATE" -> guildCreate(data);
            case "GUILD_DELETE" -> guildDelete(data);
            case "VOICE_STATE_UPDATE" -> voiceState(snowflake(data, "guild_id"), data);
            case "CHANNEL_DELETE" -> channelDelete(data);
            case "GUILD_MEMBER_ADD", "GUILD_MEMBER_UPDATE" -> List.of(member(snowflake(data, "guild_id"), data));
            case "GUILD_MEMBER_REMOVE" -> memberRemove(data);
            case "GUILD_ROLE_CREATE", "GUILD_ROLE_UPDATE" -> roleUpsert(data);
            case "GUILD_ROLE_DELETE" -> roleDelete(data);
            default -> List.of();
        };
    }

    /** Last voice channel seen for a member, or null. */
    public Long voiceChannelOf(long guildId, long memberId) {
        return voiceChannels.get(key(guildId, memberId));
    }

    // ── Guild ───────────────────────────────────────────────────────────

    private List<PlatformEvent> guildCreate(JsonNode data) {
        long guildId = snowflake(data, "id");
        if (data.path("unavailable").asBoolean(false)) {
            return List.of();
        }
        List<PlatformEvent> events = new ArrayList<>();
        Set<Long> roles = ConcurrentHashMap.newKeySet();
        for (JsonNode role : data.path("roles")) {
            roles.add(snowflake(role, "id"));
        }
        guildRoles.put(guildId, roles);
        events.add(new PlatformEvent.GuildRolesChanged(guildId, Set.copyOf(roles)));
        for (JsonNode member : data.path("members")) {
            events.add(member(guildId, member));
        }

        Set<Long> connected = new HashSet<>();
        for (JsonNode state : data.path("voice_states")) {
            connected.add(snowflake(state, "user_id"));
            events.addAll(voiceState(guildId, state));
        }
        // Members that left voice while the session was down
        String prefix = guildId + ":";
        for (Map.Entry<String, Long> entry : Map.copyOf(voiceChannels).entrySet()) {
            if (entry.getKey().startsWith(prefix)) {
                long memberId = Long.parseLong(entry.getKey().substring(prefix.length()));
                if (!connected.contains(memberId)) {
                    voiceChannels.remove(entry.getKey());
                    events.add(new PlatformEvent.MemberVoiceStateChanged(guildId, memberId, entry.getValue(), null,
                            false));
                }
            }
        }
        log.info("Guild {} available: {} roles, {} members, {} in voice", guildId, roles.size(),
                data.path("members").size(), connected.size());
        return events;
    }

    private List<PlatformEvent> guildDelete(JsonNode data) {
        long guildId = snowflake(data, "id");
        if (!data.path("unavailable").asBoolean(false)) {
            guildRoles.remove(guildId);
            voiceChannels.keySet().removeIf(key -> key.startsWith(guildId + ":"));
        }
        return List.of();
    }

    // ── Voice and channels ──────────────────────────────────────────────

    private List<PlatformEvent> voiceState(long guildId, JsonNode data) {
        long memberId = snowflake(data, "user_id");
        if (guildId == 0 || memberId == 0) {
            return List.of();
        }
        Long channelId = optionalSnowflake(data, "channel_id");
        String key = key(guildId, memberId);
        Long previous = channelId != null ? voiceChannels.put(key, channelId) : voiceChannels.remove(key);
        if (Objects.equals(previous, channelId)) {
            // Mute, deafen and stream toggles
            return List.of();
        }
        boolean bot = data.path("member").path("user").path("bot").asBoolean(false);
        return List.of(new PlatformEvent.MemberVoiceStateChanged(guildId, memberId, previous, channelId, bot));
    }

    private List<PlatformEvent> channelDelete(JsonNode data) {
        long guildId = snowflake(data, "guild_id");
        int type = data.path("type").asInt(-1);
        if (guildId == 0 || (type != DiscordApi.CHANNEL_TYPE_VOICE && type != DiscordApi.CHANNEL_TYPE_STAGE)) {
            return List.of();
        }
        return List.of(new PlatformEvent.ChannelDeleted(guildId, snowflake(data, "id")));
    }

    // ── Members and roles ───────────────────────────────────────────────

    private PlatformEvent member(long guildId, JsonNode member) {
        JsonNode user = member.path("user");
        Set<Long> roles = new HashSet<>();
        for (JsonNode role : member.path("roles")) {
            roles.add(role.asLong());
        }
        return new PlatformEvent.MemberUpdated(guildId, snowflake(user, "id"), roles, displayName(member),
                user.path("bot").asBoolean(false));
    }

    private List<PlatformEvent> memberRemove(JsonNode data) {
        long guildId = snowflake(data, "guild_id");
        long memberId = snowflake(data.path("user"), "id");
        List<PlatformEvent> events = new ArrayList<>();
        Long channelId = voiceChannels.remove(key(guildId, memberId));
        if (channelId != null) {
            events.add(new PlatformEvent.MemberVoiceStateChanged(guildId, memberId, channelId, null, false));
        }
        events.add(new PlatformEvent.MemberRemoved(guildId, memberId));
        return events;
    }

    private List<PlatformEvent> roleUpsert(JsonNode data) {
        long guildId = snowflake(data, "guild_id");
        Set<Long> roles = guildRoles.computeIfAbsent(guildId, id -> ConcurrentHashMap.newKeySet());
        if (!roles.add(snowflake(data.path("role"), "id"))) {
            return List.of();
        }
        return List.of(new PlatformEvent.GuildRolesChanged(guildId, Set.copyOf(roles)));
    }

    private List<PlatformEvent> roleDelete(JsonNode data) {
        long guildId = snowflake(data, "guild_id");
        Set<Long> roles = guildRoles.get(guildId);
        if (roles == null || !roles.remove(snowflake(data, "role_id"))) {
            return List.of();
        }
        return List.of(new PlatformEvent.GuildRolesChanged(guildId, Set.copyOf(roles)));
    }

    /** Nickname, then global name, then username. */
    static String displayName(JsonNode member) {
        JsonNode user = member.path("user");
        for (String candidate : new String[] {
                member.path("nick").asText(null),
                user.path("global_name").asText(null),
                user.path("username").asText(null) }) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return user.path("id").asText("unknown");
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private static String key(long guildId, long memberId) {
        return guildId + ":" + memberId;
    }

    static long snowflake(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? 0 : value.asLong();
    }

    static Long optionalSnowflake(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asLong();
    }
}
