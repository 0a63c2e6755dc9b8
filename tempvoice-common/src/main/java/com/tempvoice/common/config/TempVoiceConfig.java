package com.tempvoice.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Root configuration type for TempVoice.
 */
@Data
public class TempVoiceConfig {

    /** Discord connection settings. */
    private DiscordConfig discord;

    /** Permission store settings. */
    private StoreConfig store;

    /** Timers, budgets and limits of the voice subsystem. */
    private VoiceConfig voice;

    /** Managed guilds (trigger channels, category pools, mute roles). */
    private List<GuildConfig> guilds;

    /**
     * Look up the configuration of a managed guild.
     */
    public Optional<GuildConfig> findGuild(long guildId) {
        if (guilds == null) {
            return Optional.empty();
        }
        return guilds.stream().filter(g -> g.getGuildId() == guildId).findFirst();
    }

    // --- Nested config types ---

    /** What happens to a channel when its owner leaves while others remain. */
    public enum OwnerLeavePolicy {
        PROMOTE_LONGEST_PRESENT, LEAVE_OWNERLESS
    }

    @Data
    public static class DiscordConfig {
        /** Bot token; falls back to DISCORD_BOT_TOKEN. */
        private String token;
        private String apiBaseUrl = "https://discord.com/api/v10";
        private String gatewayUrl = "wss://gateway.discord.gg/?v=10&encoding=json";
        /** Upper bound of the gateway reconnect backoff. */
        private long reconnectMaxDelayMs = 60_000;
        private long connectTimeoutMs = 10_000;
        private long readTimeoutMs = 30_000;
    }

    @Data
    public static class StoreConfig {
        /** SQLite database file; ":memory:" keeps everything in process. */
        private String path = "~/.tempvoice/tempvoice.db";
    }

    @Data
    public static class VoiceConfig {
        /** Delay between a channel becoming empty and its deletion. */
        private long graceWindowMs = 5_000;
        /** Fixed timeout for every platform command. */
        private long commandTimeoutMs = 10_000;
        /** Minimum spacing between two platform commands of one guild. */
        private long commandSpacingMs = 250;
        private int retryAttempts = 3;
        private long retryMinDelayMs = 500;
        private long retryMaxDelayMs = 30_000;
        private double retryJitter = 0.1;
        private OwnerLeavePolicy ownerLeavePolicy = OwnerLeavePolicy.PROMOTE_LONGEST_PRESENT;
        private long reconcileIntervalMs = 300_000;
        private long bypassSweepIntervalMs = 60_000;
        /** Cap on overwrites per channel (the platform allows 100). */
        private int maxOverwrites = 95;
        private int defaultModeratorLimit = 3;
        private int defaultAutokickLimit = 10;
        /** How long events for a not-yet-acknowledged channel are kept. */
        private long pendingEventTtlMs = 30_000;
    }

    @Data
    public static class GuildConfig {
        private long guildId;
        /** AFK channel; voice events into it are ignored. */
        private Long afkChannelId;
        private List<TriggerConfig> triggers = new ArrayList<>();
        private List<CategoryConfig> categories = new ArrayList<>();
        private MuteRolesConfig muteRoles = new MuteRolesConfig();

        public Optional<TriggerConfig> findTrigger(long channelId) {
            return triggers.stream().filter(t -> t.getChannelId() == channelId).findFirst();
        }

        public Optional<CategoryConfig> findCategory(long categoryId) {
            return categories.stream().filter(c -> c.getId() == categoryId).findFirst();
        }
    }

    @Data
    public static class TriggerConfig {
        /** The lobby channel whose join creates a new channel. */
        private long channelId;
        /** Category pool, in tie-break order. */
        private List<Long> categoryIds = new ArrayList<>();
        /** Channel name; {name} is replaced with the owner's display name. */
        private String nameFormat = "{name}";
    }

    @Data
    public static class CategoryConfig {
        private long id;
        /** Maximum managed child channels. */
        private int capacity = 50;
        /** Default user limit of channels created here; 0 = unlimited. */
        private int defaultLimit = 0;
        /** Permission kinds denied to @everyone by default (e.g. "STREAM"). */
        private List<String> everyoneDeny = new ArrayList<>();
    }

    @Data
    public static class MuteRolesConfig {
        private Long streamOff;
        private Long sendMessagesOff;
        private Long attachFilesOff;
    }
}
