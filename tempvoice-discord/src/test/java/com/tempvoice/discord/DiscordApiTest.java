package com.tempvoice.discord;

import com.tempvoice.voice.model.PlatformException;
import com.tempvoice.voice.model.VoiceErrorCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiscordApiTest {

    // =========================================================================
    // parseError
    // =========================================================================

    @Test
    void parseError_jsonBody() {
        DiscordApi.ApiError error = DiscordApi.parseError(403, "{\"message\": \"Missing Permissions\", \"code\": 50013}",
                null);

        assertEquals(403, error.status());
        assertEquals(50013, error.code());
        assertEquals("Missing Permissions", error.message());
        assertEquals(-1, error.retryAfterMs());
    }

    @Test
    void parseError_retryAfterFromBodyWinsOverHeader() {
        DiscordApi.ApiError error = DiscordApi.parseError(429,
                "{\"message\": \"You are being rate limited.\", \"retry_after\": 1.25, \"global\": false}", "2");

        assertEquals(1250, error.retryAfterMs());
    }

    @Test
    void parseError_retryAfterHeaderOnly() {
        assertEquals(3000, DiscordApi.parseError(429, "", "3").retryAfterMs());
    }

    @Test
    void parseError_plainTextBody() {
        DiscordApi.ApiError error = DiscordApi.parseError(502, "Bad Gateway", null);

        assertEquals("Bad Gateway", error.message());
        assertEquals(0, error.code());
    }

    @Test
    void parseError_emptyBody() {
        assertEquals("HTTP 500", DiscordApi.parseError(500, null, null).message());
    }

    // =========================================================================
    // toPlatformException
    // =========================================================================

    @Test
    void toPlatformException_rateLimitKeepsHint() {
        PlatformException e = DiscordApi.toPlatformException("edit",
                new DiscordApi.ApiError(429, 0, "slow down", 1500));

        assertEquals(VoiceErrorCode.RATE_LIMITED, e.getCode());
        assertEquals(1500, e.getRetryAfterMs());
        assertTrue(e.isRetryable());
    }

    @Test
    void toPlatformException_statusMapping() {
        assertEquals(VoiceErrorCode.PLATFORM_UNAVAILABLE, code(503, 0));
        assertEquals(VoiceErrorCode.NOT_AUTHORIZED, code(403, 50013));
        assertEquals(VoiceErrorCode.NOT_AUTHORIZED, code(401, 0));
        assertEquals(VoiceErrorCode.NOT_FOUND, code(404, 10003));
        assertEquals(VoiceErrorCode.INVALID_TARGET, code(400, 50035));
        assertEquals(VoiceErrorCode.CAPACITY_EXCEEDED, code(400, DiscordApi.ERROR_MAX_CHANNELS));
    }

    @Test
    void toPlatformException_messageNamesOperation() {
        PlatformException e = DiscordApi.toPlatformException("delete channel 5",
                new DiscordApi.ApiError(404, 10003, "Unknown Channel", -1));

        assertEquals("delete channel 5 failed: Unknown Channel (HTTP 404, code 10003)", e.getMessage());
    }

    @Test
    void isMemberAbsent_notInVoiceAndUnknownMember() {
        assertTrue(DiscordApi.isMemberAbsent(new DiscordApi.ApiError(400, 40032, "x", -1)));
        assertTrue(DiscordApi.isMemberAbsent(new DiscordApi.ApiError(404, 10007, "x", -1)));
        assertFalse(DiscordApi.isMemberAbsent(new DiscordApi.ApiError(404, 10003, "x", -1)));
    }

    // =========================================================================
    // Token
    // =========================================================================

    @Test
    void normalizeToken_stripsPrefix() {
        assertEquals("abc.def", DiscordApi.normalizeToken("  Bot abc.def "));
        assertEquals("abc.def", DiscordApi.normalizeToken("bot abc.def"));
        assertEquals("Bot abc.def", DiscordApi.authorization("abc.def"));
        assertNull(DiscordApi.normalizeToken("  "));
        assertNull(DiscordApi.normalizeToken(null));
    }

    private static VoiceErrorCode code(int status, int code) {
        return DiscordApi.toPlatformException("op", new DiscordApi.ApiError(status, code, "m", -1)).getCode();
    }
}
