package com.tempvoice.voice.registry;

/**
 * Membership change observed for a channel id the registry does not know yet.
 */
public record BufferedMove(long memberId, boolean joined) {
}
