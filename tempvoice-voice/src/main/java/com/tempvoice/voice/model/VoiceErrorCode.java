package com.tempvoice.voice.model;

/**
 * Failure reasons reported to callers. Transient codes are retried internally
 * before they surface.
 */
public enum VoiceErrorCode {
    NOT_AUTHORIZED(false),
    INVALID_TARGET(false),
    CAPACITY_EXCEEDED(false),
    LIMIT_REACHED(false),
    ALREADY_EXISTS(false),
    RATE_LIMITED(true),
    PLATFORM_UNAVAILABLE(true),
    NOT_FOUND(false),
    OPERATION_DEGRADED(false);

    private final boolean transientFailure;

    VoiceErrorCode(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
