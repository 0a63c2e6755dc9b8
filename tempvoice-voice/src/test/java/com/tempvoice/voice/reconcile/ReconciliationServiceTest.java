package com.tempvoice.voice.reconcile;

import com.tempvoice.voice.MutableClock;
import com.tempvoice.voice.VoiceTestFixture;
import com.tempvoice.voice.model.OwnershipChange;
import com.tempvoice.voice.model.PlatformException;
import com.tempvoice.voice.model.VoiceChannelState;
import com.tempvoice.voice.model.VoiceErrorCode;
import com.tempvoice.voice.platform.PlatformChannel;
import com.tempvoice.voice.platform.PlatformEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.tempvoice.voice.VoiceTestFixture.CATEGORY_A;
import static com.tempvoice.voice.VoiceTestFixture.CATEGORY_B;
import static com.tempvoice.voice.VoiceTestFixture.GUILD;
import static com.tempvoice.voice.VoiceTestFixture.TRIGGER;
import static com.tempvoice.voice.VoiceTestFixture.await;
import static com.tempvoice.voice.VoiceTestFixture.join;
import static org.junit.jupiter.api.Assertions.*;

class ReconciliationServiceTest {

    private static final long OWNER = 100L;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    private final VoiceTestFixture fx = new VoiceTestFixture(cfg -> {
    }, clock);

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private ReconcileReport reconcile() {
        return fx.voice.getReconciliation().reconcileAll();
    }

    @Test
    void inSyncStateIsLeftAlone() {
        fx.member(OWNER);
        long channelId = fx.createChannel(OWNER);
        fx.sink.clear();

        ReconcileReport report = reconcile();

        assertTrue(report.isClean(), report.toString());
        assertEquals(List.of("list"), fx.sink.commands().stream().map(c -> c.op()).toList());
        assertEquals(List.of(OWNER), fx.state(channelId).getMembers());
    }

    @Test
    void channelMissingOnPlatformIsEvicted() {
        fx.member(OWNER);
        long channelId = fx.createChannel(OWNER);
        join(fx.sink.deleteChannel(GUILD, channelId));
        clock.advance(Duration.ofSeconds(1));

        ReconcileReport report = reconcile();

        assertEquals(1, report.evicted());
        assertFalse(fx.voice.getRegistry().contains(channelId));
        assertTrue(fx.voice.getOwnership().channelOwnedBy(GUILD, OWNER).isEmpty());
    }

    @Test
    void channelCreatedDuringListingIsKept() {
        fx.member(OWNER);
        fx.sink.holdLists(true);
        CompletableFuture<ReconcileReport> run = CompletableFuture.supplyAsync(this::reconcile);
        await(() -> fx.sink.heldListCount() == 1, "held list");

        clock.advance(Duration.ofSeconds(1));
        long channelId = fx.createChannel(OWNER);
        fx.sink.releaseLists();
        ReconcileReport report = join(run);

        assertEquals(0, report.evicted());
        assertTrue(fx.voice.getRegistry().contains(channelId));
        assertEquals(channelId, fx.voice.getOwnership().channelOwnedBy(GUILD, OWNER).orElseThrow());
    }

    @Test
    void evictionWaitsWhileCreationIsPending() {
        fx.member(OWNER);
        fx.member(200);
        long channelId = fx.createChannel(OWNER);
        join(fx.sink.deleteChannel(GUILD, channelId));
        clock.advance(Duration.ofSeconds(1));
        fx.sink.holdCreates(true);
        fx.voice.handle(new PlatformEvent.MemberVoiceStateChanged(GUILD, 200, null, TRIGGER, false));
        await(() -> fx.sink.heldCreates().size() == 1, "held create");

        ReconcileReport report = reconcile();

        assertEquals(0, report.evicted());
        assertTrue(fx.voice.getRegistry().contains(channelId));
    }

    @Test
    void emptyUntrackedChannelIsDeleted() {
        fx.sink.addExternalChannel(new PlatformChannel(800, GUILD, CATEGORY_A, "stale", true));
        fx.sink.addExternalChannel(new PlatformChannel(801, GUILD, 555L, "unmanaged", true));
        fx.sink.addExternalChannel(new PlatformChannel(802, GUILD, CATEGORY_A, "text", false));

        ReconcileReport report = reconcile();

        assertEquals(1, report.deleted());
        assertFalse(fx.sink.platformHas(800));
        assertTrue(fx.sink.platformHas(801));
        assertTrue(fx.sink.platformHas(802));
    }

    @Test
    void occupiedUntrackedChannelIsAdoptedWithoutOwner() {
        fx.sink.addExternalChannel(new PlatformChannel(810, GUILD, CATEGORY_B, "leftover", true));
        fx.member(300);
        fx.voice.getMembers().updateVoiceChannel(GUILD, 300, 810L, false);

        ReconcileReport report = reconcile();

        assertEquals(1, report.adopted());
        VoiceChannelState state = fx.state(810);
        assertNull(state.getOwnerId());
        assertEquals(CATEGORY_B, state.getCategoryId());
        assertEquals(List.of(300L), state.getMembers());
        assertEquals(OwnershipChange.Reason.ADOPTED,
                fx.voice.getOwnership().history(GUILD, 810).get(0).reason());
        assertTrue(fx.sink.platformHas(810));
    }

    @Test
    void untrackedChannelsAreLeftWhileCreationIsPending() {
        fx.member(OWNER);
        fx.sink.holdCreates(true);
        fx.voice.handle(new PlatformEvent.MemberVoiceStateChanged(GUILD, OWNER, null,
                TRIGGER, false));
        await(() -> fx.sink.heldCreates().size() == 1, "held create");
        fx.sink.addExternalChannel(new PlatformChannel(820, GUILD, CATEGORY_A, "new", true));

        ReconcileReport report = reconcile();

        assertEquals(0, report.deleted());
        assertTrue(fx.sink.platformHas(820));
    }

    @Test
    void membershipIsSyncedWithConnectedMembers() {
        fx.member(OWNER);
        fx.member(200);
        fx.member(300);
        long channelId = fx.createChannel(OWNER);
        fx.move(200, null, channelId);
        fx.voice.getMembers().updateVoiceChannel(GUILD, 200, null, false);
        fx.voice.getMembers().updateVoiceChannel(GUILD, 300, channelId, false);

        ReconcileReport report = reconcile();

        assertEquals(1, report.joined());
        assertEquals(1, report.left());
        assertEquals(List.of(OWNER, 300L), fx.state(channelId).getMembers());
    }

    @Test
    void listingFailureCountsAsFailure() {
        fx.sink.failNext("list", new PlatformException(VoiceErrorCode.NOT_AUTHORIZED, "missing access"));

        ReconcileReport report = reconcile();

        assertEquals(1, report.failures());
    }
}
