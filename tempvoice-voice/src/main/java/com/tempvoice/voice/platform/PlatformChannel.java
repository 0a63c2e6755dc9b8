package com.tempvoice.voice.platform;

/** A channel as listed by the platform. */
public record PlatformChannel(long id, long guildId, Long parentId, String name, boolean voice) {
}
