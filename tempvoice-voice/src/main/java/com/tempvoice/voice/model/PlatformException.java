package com.tempvoice.voice.model;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Failure of a platform command, classified by {@link VoiceErrorCode}.
 */
public class PlatformException extends RuntimeException {

    private final VoiceErrorCode code;
    private final long retryAfterMs;
    private final boolean timeout;

    public PlatformException(VoiceErrorCode code, String message) {
        this(code, message, -1, false, null);
    }

    public PlatformException(VoiceErrorCode code, String message, long retryAfterMs) {
        this(code, message, retryAfterMs, false, null);
    }

    public PlatformException(VoiceErrorCode code, String message, Throwable cause) {
        this(code, message, -1, false, cause);
    }

    private PlatformException(VoiceErrorCode code, String message, long retryAfterMs, boolean timeout,
            Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryAfterMs = retryAfterMs;
        this.timeout = timeout;
    }

    public static PlatformException timeout(String operation, long timeoutMs) {
        return new PlatformException(VoiceErrorCode.PLATFORM_UNAVAILABLE,
                operation + " timed out after " + timeoutMs + "ms", -1, true, null);
    }

    /**
     * Classify any failure; unknown errors count as platform unavailability.
     */
    public static PlatformException from(Throwable err) {
        Throwable current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof PlatformException platform) {
            return platform;
        }
        if (current instanceof TimeoutException) {
            return new PlatformException(VoiceErrorCode.PLATFORM_UNAVAILABLE, "timed out", -1, true, current);
        }
        return new PlatformException(VoiceErrorCode.PLATFORM_UNAVAILABLE,
                String.valueOf(current.getMessage()), current);
    }

    public VoiceErrorCode getCode() {
        return code;
    }

    /** Server-provided retry hint in ms, or -1. */
    public long getRetryAfterMs() {
        return retryAfterMs;
    }

    public boolean isTimeout() {
        return timeout;
    }

    /** Worth another attempt: rate limits and outages, but never timeouts. */
    public boolean isRetryable() {
        return code.isTransient() && !timeout;
    }
}
