package com.tempvoice.voice.model;

/**
 * Platform permission bit flags used by channel overwrites.
 */
public final class PermissionBits {

    private PermissionBits() {
    }

    public static final long PRIORITY_SPEAKER = 1L << 8;
    public static final long STREAM = 1L << 9;
    public static final long VIEW_CHANNEL = 1L << 10;
    public static final long SEND_MESSAGES = 1L << 11;
    public static final long MANAGE_MESSAGES = 1L << 13;
    public static final long EMBED_LINKS = 1L << 14;
    public static final long ATTACH_FILES = 1L << 15;
    public static final long USE_EXTERNAL_EMOJIS = 1L << 18;
    public static final long CONNECT = 1L << 20;
    public static final long SPEAK = 1L << 21;

    /** Denied by the attach-files-off mute role. */
    public static final long ATTACHMENTS = ATTACH_FILES | EMBED_LINKS | USE_EXTERNAL_EMOJIS;

    /** Allowed to the channel owner. */
    public static final long OWNER = PRIORITY_SPEAKER | MANAGE_MESSAGES | VIEW_CHANNEL
            | CONNECT | SPEAK | STREAM | SEND_MESSAGES;
}
