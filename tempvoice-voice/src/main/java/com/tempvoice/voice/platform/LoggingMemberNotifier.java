package com.tempvoice.voice.platform;

import com.tempvoice.voice.model.VoiceErrorCode;
import lombok.extern.slf4j.Slf4j;

/**
 * Notifier used when no messaging channel is wired in.
 */
@Slf4j
public class LoggingMemberNotifier implements MemberNotifier {

    @Override
    public void notify(long guildId, long memberId, VoiceErrorCode code, String detail) {
        log.info("Notify member {} in guild {}: {} ({})", memberId, guildId, code, detail);
    }
}
