package com.tempvoice.discord;

import com.tempvoice.voice.model.TargetRef;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of member and role references typed into commands.
 */
public final class DiscordTargets {

    private DiscordTargets() {
    }

    private static final Pattern USER_MENTION = Pattern.compile("^<@!?(\\d+)>$");
    private static final Pattern ROLE_MENTION = Pattern.compile("^<@&(\\d+)>$");
    private static final Pattern SNOWFLAKE = Pattern.compile("^\\d+$");

    /**
     * Parse a raw reference into a target.
     * <p>
     * Accepts {@code <@id>}, {@code <@!id>}, {@code <@&id>}, {@code user:id},
     * {@code member:id}, {@code role:id}, {@code @everyone} and a bare id,
     * which is taken as a member.
     *
     * @param guildId guild the reference is resolved in, for {@code @everyone}
     * @return parsed target, or null if empty
     * @throws IllegalArgumentException if the reference is not understood
     */
    public static TargetRef parse(String raw, long guildId) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.equals("@everyone") || trimmed.equalsIgnoreCase("everyone")) {
            return TargetRef.everyone(guildId);
        }

        Matcher user = USER_MENTION.matcher(trimmed);
        if (user.matches()) {
            return TargetRef.member(Long.parseLong(user.group(1)));
        }
        Matcher role = ROLE_MENTION.matcher(trimmed);
        if (role.matches()) {
            return TargetRef.role(Long.parseLong(role.group(1)));
        }

        int colon = trimmed.indexOf(':');
        if (colon > 0) {
            String prefix = trimmed.substring(0, colon).toLowerCase();
            long id = parseId(trimmed.substring(colon + 1).trim(), raw);
            return switch (prefix) {
                case "user", "member" -> TargetRef.member(id);
                case "role" -> TargetRef.role(id);
                default -> throw new IllegalArgumentException("Unknown target prefix \"" + prefix + "\"");
            };
        }
        return TargetRef.member(parseId(trimmed, raw));
    }

    /** Render a target the way Discord displays it. */
    public static String mention(TargetRef target, long guildId) {
        if (target instanceof TargetRef.Member) {
            return "<@" + target.id() + ">";
        }
        return target.id() == guildId ? "@everyone" : "<@&" + target.id() + ">";
    }

    public static boolean isSnowflake(String value) {
        return value != null && SNOWFLAKE.matcher(value).matches();
    }

    private static long parseId(String value, String raw) {
        if (!isSnowflake(value)) {
            throw new IllegalArgumentException("Not a member or role reference: \"" + raw.trim() + "\"");
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Id out of range: \"" + value + "\"", e);
        }
    }
}
