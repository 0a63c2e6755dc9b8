package com.tempvoice.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches TempVoice configuration from a JSON file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, TempVoiceConfig> cache;
    private final Path configPath;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public TempVoiceConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    public Path getConfigPath() {
        return configPath;
    }

    private TempVoiceConfig doLoadConfig() {
        try {
            if (!Files.exists(configPath)) {
                log.warn("Config file not found: {}, using defaults", configPath);
                return applyDefaults(new TempVoiceConfig());
            }
            String raw = substituteEnvVars(Files.readString(configPath));
            TempVoiceConfig config = objectMapper.readValue(raw, TempVoiceConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new TempVoiceConfig());
        }
    }

    /**
     * Fill in missing sections so callers never see a null section.
     */
    static TempVoiceConfig applyDefaults(TempVoiceConfig config) {
        if (config.getDiscord() == null) {
            config.setDiscord(new TempVoiceConfig.DiscordConfig());
        }
        if (config.getDiscord().getToken() == null || config.getDiscord().getToken().isBlank()) {
            String envToken = System.getenv("DISCORD_BOT_TOKEN");
            if (envToken != null && !envToken.isBlank()) {
                config.getDiscord().setToken(envToken);
            }
        }
        if (config.getStore() == null) {
            config.setStore(new TempVoiceConfig.StoreConfig());
        }
        if (config.getVoice() == null) {
            config.setVoice(new TempVoiceConfig.VoiceConfig());
        }
        if (config.getGuilds() == null) {
            config.setGuilds(new ArrayList<>());
        }
        for (TempVoiceConfig.GuildConfig guild : config.getGuilds()) {
            if (guild.getTriggers() == null) {
                guild.setTriggers(new ArrayList<>());
            }
            if (guild.getCategories() == null) {
                guild.setCategories(new ArrayList<>());
            }
            if (guild.getMuteRoles() == null) {
                guild.setMuteRoles(new TempVoiceConfig.MuteRolesConfig());
            }
        }
        return config;
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        return substituteEnvVars(raw, System.getenv());
    }

    String substituteEnvVars(String raw, Map<String, String> env) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
