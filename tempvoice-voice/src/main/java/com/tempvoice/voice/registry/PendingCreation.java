package com.tempvoice.voice.registry;

import com.tempvoice.voice.model.OverwriteSet;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A channel creation awaiting platform acknowledgement. {@code ack} is
 * completed by whichever acknowledgement arrives first.
 */
public record PendingCreation(
        String requestId,
        long guildId,
        long ownerId,
        long categoryId,
        long triggerId,
        int limit,
        OverwriteSet initialOverwrites,
        Instant requestedAt,
        CompletableFuture<Long> ack) {
}
