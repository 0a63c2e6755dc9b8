package com.tempvoice.voice.platform;

import com.tempvoice.voice.model.TargetRef;

import java.util.List;
import java.util.Optional;

/**
 * Read access to guild membership, used to resolve rule targets and to check
 * whether a channel owner is still present.
 */
public interface GuildDirectory {

    Optional<GuildMember> member(long guildId, long memberId);

    default boolean isPresent(long guildId, long memberId) {
        return member(guildId, memberId).isPresent();
    }

    boolean roleExists(long guildId, long roleId);

    /** Members currently connected to the given voice channel. */
    List<GuildMember> membersInChannel(long guildId, long channelId);

    /**
     * Whether a rule target can be applied in the guild. {@code @everyone}
     * always resolves.
     */
    default boolean resolves(long guildId, TargetRef target) {
        if (target instanceof TargetRef.Member member) {
            return isPresent(guildId, member.id());
        }
        return target.id() == guildId || roleExists(guildId, target.id());
    }

    default String displayName(long guildId, long memberId) {
        return member(guildId, memberId)
                .map(GuildMember::displayName)
                .filter(name -> name != null && !name.isBlank())
                .orElse(Long.toString(memberId));
    }
}
