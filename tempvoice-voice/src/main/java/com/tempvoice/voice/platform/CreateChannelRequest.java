package com.tempvoice.voice.platform;

import com.tempvoice.voice.model.OverwriteSet;

/**
 * Parameters of a voice channel creation. {@code requestId} correlates an
 * asynchronous acknowledgement with the request.
 */
public record CreateChannelRequest(
        String requestId,
        long guildId,
        long categoryId,
        String name,
        int limit,
        OverwriteSet overwrites) {
}
