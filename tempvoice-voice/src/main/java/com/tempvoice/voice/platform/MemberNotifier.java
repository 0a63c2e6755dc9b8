package com.tempvoice.voice.platform;

import com.tempvoice.voice.model.VoiceErrorCode;

/**
 * Tells a member why an automatic action on their behalf failed. Rendering is
 * up to the implementation.
 */
public interface MemberNotifier {

    void notify(long guildId, long memberId, VoiceErrorCode code, String detail);
}
