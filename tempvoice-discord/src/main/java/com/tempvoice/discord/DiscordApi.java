package com.tempvoice.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tempvoice.voice.model.PlatformException;
import com.tempvoice.voice.model.VoiceErrorCode;

import java.io.IOException;

/**
 * Discord REST constants and the mapping of API failures onto
 * {@link VoiceErrorCode}.
 */
public final class DiscordApi {

    private DiscordApi() {
    }

    public static final String USER_AGENT = "DiscordBot (https://github.com/tempvoice/tempvoice, 0.1)";

    /** Channel types. */
    public static final int CHANNEL_TYPE_VOICE = 2;
    public static final int CHANNEL_TYPE_STAGE = 13;

    /** Overwrite target types. */
    public static final int OVERWRITE_ROLE = 0;
    public static final int OVERWRITE_MEMBER = 1;

    /** JSON error codes with a specific meaning. */
    public static final int ERROR_UNKNOWN_MEMBER = 10007;
    public static final int ERROR_MAX_CHANNELS = 30013;
    public static final int ERROR_NOT_IN_VOICE = 40032;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parsed error payload. {@code code} is Discord's JSON error code, or 0.
     */
    public record ApiError(int status, int code, String message, long retryAfterMs) {
    }

    /**
     * Normalize a bot token: trim, strip a leading "Bot " prefix.
     */
    public static String normalizeToken(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim().replaceFirst("(?i)^Bot\\s+", "");
    }

    public static String authorization(String token) {
        return "Bot " + normalizeToken(token);
    }

    /**
     * Parse an error response body. Non-JSON bodies become the message.
     *
     * @param retryAfterHeader value of the Retry-After header in seconds, may be null
     */
    public static ApiError parseError(int status, String body, String retryAfterHeader) {
        int code = 0;
        String message = null;
        long retryAfterMs = parseSeconds(retryAfterHeader);
        String trimmed = body != null ? body.trim() : "";
        if (trimmed.startsWith("{")) {
            try {
                JsonNode json = MAPPER.readTree(trimmed);
                code = json.path("code").asInt(0);
                message = json.path("message").asText(null);
                if (json.hasNonNull("retry_after")) {
                    retryAfterMs = Math.round(json.get("retry_after").asDouble() * 1000);
                }
            } catch (IOException e) {
                message = trimmed;
            }
        } else if (!trimmed.isEmpty()) {
            message = trimmed;
        }
        if (message == null || message.isEmpty()) {
            message = "HTTP " + status;
        }
        return new ApiError(status, code, message, retryAfterMs);
    }

    /**
     * Classify an API error.
     */
    public static PlatformException toPlatformException(String operation, ApiError error) {
        String message = operation + " failed: " + error.message() + " (HTTP " + error.status()
                + (error.code() != 0 ? ", code " + error.code() : "") + ")";
        if (error.status() == 429) {
            return new PlatformException(VoiceErrorCode.RATE_LIMITED, message, error.retryAfterMs());
        }
        if (error.status() >= 500) {
            return new PlatformException(VoiceErrorCode.PLATFORM_UNAVAILABLE, message);
        }
        if (error.code() == ERROR_MAX_CHANNELS) {
            return new PlatformException(VoiceErrorCode.CAPACITY_EXCEEDED, message);
        }
        return switch (error.status()) {
            case 401, 403 -> new PlatformException(VoiceErrorCode.NOT_AUTHORIZED, message);
            case 404 -> new PlatformException(VoiceErrorCode.NOT_FOUND, message);
            default -> new PlatformException(VoiceErrorCode.INVALID_TARGET, message);
        };
    }

    /**
     * Check if an error means the member was already out of voice.
     */
    public static boolean isMemberAbsent(ApiError error) {
        return error.code() == ERROR_NOT_IN_VOICE || error.code() == ERROR_UNKNOWN_MEMBER;
    }

    static long parseSeconds(String seconds) {
        if (seconds == null || seconds.isBlank()) {
            return -1;
        }
        try {
            return Math.round(Double.parseDouble(seconds.trim()) * 1000);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
