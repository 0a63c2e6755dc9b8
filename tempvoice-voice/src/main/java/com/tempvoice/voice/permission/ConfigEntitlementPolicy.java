package com.tempvoice.voice.permission;

import com.tempvoice.common.config.TempVoiceConfig;

import java.util.function.Supplier;

/**
 * Same limits for every owner, read from configuration.
 */
public class ConfigEntitlementPolicy implements EntitlementPolicy {

    private final Supplier<TempVoiceConfig> config;

    public ConfigEntitlementPolicy(Supplier<TempVoiceConfig> config) {
        this.config = config;
    }

    @Override
    public int moderatorLimit(long guildId, long ownerId) {
        return config.get().getVoice().getDefaultModeratorLimit();
    }

    @Override
    public int autokickLimit(long guildId, long ownerId) {
        return config.get().getVoice().getDefaultAutokickLimit();
    }
}
