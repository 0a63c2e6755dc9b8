package com.tempvoice.voice.platform;

import com.tempvoice.common.infra.RetryRunner;
import com.tempvoice.voice.RecordingCommandSink;
import com.tempvoice.voice.model.Overwrite;
import com.tempvoice.voice.model.OverwriteSet;
import com.tempvoice.voice.model.PermissionBits;
import com.tempvoice.voice.model.PlatformException;
import com.tempvoice.voice.model.TargetRef;
import com.tempvoice.voice.model.VoiceErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ThrottledCommandSinkTest {

    private static final long GUILD = 1L;
    private static final RetryRunner.Config RETRY = new RetryRunner.Config(3, 10, 50, 0);

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);
    private final RecordingCommandSink platform = new RecordingCommandSink();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void slotsAreSpacedPerGuild() {
        ThrottledCommandSink sink = new ThrottledCommandSink(platform, scheduler, 100, 1_000, RETRY);

        long first = sink.reserveSlot(GUILD);
        long second = sink.reserveSlot(GUILD);
        long third = sink.reserveSlot(GUILD);
        long otherGuild = sink.reserveSlot(2L);

        assertEquals(0, first);
        assertTrue(second >= 90 && second <= 100, "second slot " + second);
        assertTrue(third >= 190 && third <= 200, "third slot " + third);
        assertEquals(0, otherGuild);
    }

    @Test
    void rateLimitIsRetried() throws Exception {
        ThrottledCommandSink sink = new ThrottledCommandSink(platform, scheduler, 0, 1_000, RETRY);
        platform.failNext("edit", new PlatformException(VoiceErrorCode.RATE_LIMITED, "slow down", 20));

        sink.editOverwrite(GUILD, 900, new Overwrite(TargetRef.member(5), 0, PermissionBits.CONNECT))
                .get(2, TimeUnit.SECONDS);

        assertEquals(2, platform.count("edit"));
    }

    @Test
    void outageExhaustingRetriesIsDegraded() {
        ThrottledCommandSink sink = new ThrottledCommandSink(platform, scheduler, 0, 1_000, RETRY);
        for (int i = 0; i < 3; i++) {
            platform.failNext("delete", new PlatformException(VoiceErrorCode.PLATFORM_UNAVAILABLE, "502"));
        }

        PlatformException failure = failureOf(sink.deleteChannel(GUILD, 900));

        assertEquals(VoiceErrorCode.OPERATION_DEGRADED, failure.getCode());
        assertEquals(3, platform.count("delete"));
    }

    @Test
    void permanentFailuresAreNotRetried() {
        ThrottledCommandSink sink = new ThrottledCommandSink(platform, scheduler, 0, 1_000, RETRY);
        platform.failNext("move", new PlatformException(VoiceErrorCode.NOT_AUTHORIZED, "missing access"));

        PlatformException failure = failureOf(sink.moveMember(GUILD, 5, 900));

        assertEquals(VoiceErrorCode.NOT_AUTHORIZED, failure.getCode());
        assertEquals(1, platform.count("move"));
    }

    @Test
    void timeoutsAreNotRetried() {
        ThrottledCommandSink sink = new ThrottledCommandSink(platform, scheduler, 0, 100, RETRY);
        platform.holdCreates(true);

        PlatformException failure = failureOf(sink.createVoiceChannel(request()));

        assertTrue(failure.isTimeout());
        assertEquals(1, platform.count("create"));
    }

    @Test
    void createIsNotRetriedOnOutage() {
        ThrottledCommandSink sink = new ThrottledCommandSink(platform, scheduler, 0, 1_000, RETRY);
        platform.failNext("create", new PlatformException(VoiceErrorCode.PLATFORM_UNAVAILABLE, "502"));

        failureOf(sink.createVoiceChannel(request()));

        assertEquals(1, platform.count("create"));
    }

    @Test
    void createIsRetriedOnRateLimit() throws Exception {
        ThrottledCommandSink sink = new ThrottledCommandSink(platform, scheduler, 0, 1_000, RETRY);
        platform.failNext("create", new PlatformException(VoiceErrorCode.RATE_LIMITED, "slow down", 10));

        Long channelId = sink.createVoiceChannel(request()).get(2, TimeUnit.SECONDS);

        assertNotNull(channelId);
        assertEquals(2, platform.count("create"));
    }

    private static CreateChannelRequest request() {
        return new CreateChannelRequest("req-1", GUILD, 20, "room", 0, OverwriteSet.EMPTY);
    }

    private static PlatformException failureOf(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        return assertInstanceOf(PlatformException.class, e.getCause());
    }
}
