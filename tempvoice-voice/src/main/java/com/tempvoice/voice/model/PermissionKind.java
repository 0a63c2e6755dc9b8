package com.tempvoice.voice.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Permission kinds a channel owner can grant or deny, with the platform
 * permission bits each one controls.
 */
public enum PermissionKind {

    SPEAK(PermissionBits.SPEAK),
    VIEW(PermissionBits.VIEW_CHANNEL),
    CONNECT(PermissionBits.CONNECT),
    TEXT(PermissionBits.SEND_MESSAGES),
    STREAM(PermissionBits.STREAM),
    MODERATOR(PermissionBits.MANAGE_MESSAGES);

    private final long bits;

    PermissionKind(long bits) {
        this.bits = bits;
    }

    public long bits() {
        return bits;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PermissionKind> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(k -> k.name().equals(normalized)).findFirst();
    }

    public static long bitsOf(Collection<PermissionKind> kinds) {
        long bits = 0;
        for (PermissionKind kind : kinds) {
            bits |= kind.bits;
        }
        return bits;
    }
}
