package com.tempvoice.app.config;

import com.tempvoice.common.config.ConfigService;
import com.tempvoice.common.config.TempVoiceConfig;
import com.tempvoice.discord.DiscordGatewayClient;
import com.tempvoice.discord.DiscordGatewayEventMapper;
import com.tempvoice.discord.DiscordRestCommandSink;
import com.tempvoice.voice.VoiceSubsystem;
import com.tempvoice.voice.permission.ConfigEntitlementPolicy;
import com.tempvoice.voice.permission.EntitlementPolicy;
import com.tempvoice.voice.platform.LoggingMemberNotifier;
import com.tempvoice.voice.platform.MemberNotifier;
import com.tempvoice.voice.platform.PlatformCommandSink;
import com.tempvoice.voice.platform.PlatformEvent;
import com.tempvoice.voice.store.SqlitePermissionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Spring configuration for the voice subsystem and its Discord adapter.
 */
@Slf4j
@Configuration
public class VoiceBeanConfig {

    @Value("${tempvoice.config.path:~/.tempvoice/tempvoice.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        String resolvedPath = configPath;
        if (resolvedPath.startsWith("~")) {
            resolvedPath = System.getProperty("user.home") + resolvedPath.substring(1);
        }
        return new ConfigService(Path.of(resolvedPath));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public SqlitePermissionStore permissionStore(ConfigService configService, Clock clock) throws SQLException {
        return new SqlitePermissionStore(configService.loadConfig().getStore().getPath(), clock);
    }

    @Bean
    public PlatformCommandSink platformCommandSink(ConfigService configService) {
        return new DiscordRestCommandSink(configService.loadConfig().getDiscord());
    }

    @Bean
    public MemberNotifier memberNotifier() {
        return new LoggingMemberNotifier();
    }

    @Bean
    public EntitlementPolicy entitlementPolicy(ConfigService configService) {
        return new ConfigEntitlementPolicy(configService::loadConfig);
    }

    @Bean(destroyMethod = "close")
    public VoiceSubsystem voiceSubsystem(ConfigService configService, SqlitePermissionStore store,
            PlatformCommandSink sink, MemberNotifier notifier, EntitlementPolicy entitlements, Clock clock) {
        return new VoiceSubsystem(configService::loadConfig, store, sink, notifier, entitlements, clock);
    }

    @Bean
    public DiscordGatewayEventMapper discordGatewayEventMapper() {
        return new DiscordGatewayEventMapper();
    }

    /** Started by {@link VoiceBootstrap} once the context is ready. */
    @Bean(destroyMethod = "close")
    public DiscordGatewayClient discordGatewayClient(ConfigService configService, DiscordGatewayEventMapper mapper,
            VoiceSubsystem voice) {
        TempVoiceConfig.DiscordConfig discord = configService.loadConfig().getDiscord();
        return new DiscordGatewayClient(discord, mapper, event -> dispatch(voice, event));
    }

    static void dispatch(VoiceSubsystem voice, PlatformEvent event) {
        voice.handle(event).whenComplete((ignored, err) -> {
            if (err != null) {
                log.error("Handling {} failed", event, err);
            }
        });
    }
}
