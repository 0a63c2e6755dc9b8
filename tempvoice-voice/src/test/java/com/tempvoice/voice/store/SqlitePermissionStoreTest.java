package com.tempvoice.voice.store;

import com.tempvoice.voice.MutableClock;
import com.tempvoice.voice.model.AutokickEntry;
import com.tempvoice.voice.model.BypassFlag;
import com.tempvoice.voice.model.Effect;
import com.tempvoice.voice.model.OwnershipChange;
import com.tempvoice.voice.model.PermissionKind;
import com.tempvoice.voice.model.PermissionRule;
import com.tempvoice.voice.model.TargetRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlitePermissionStoreTest {

    private static final long GUILD = 1L;
    private static final long OTHER_GUILD = 2L;
    private static final long OWNER = 100L;
    private static final TargetRef TARGET = TargetRef.member(200L);

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private SqlitePermissionStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new SqlitePermissionStore(":memory:", clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Nested
    class Rules {

        @Test
        void upsertReplacesTheEffect() {
            store.upsertRule(GUILD, OWNER, TARGET, PermissionKind.CONNECT, Effect.DENY);
            clock.advance(Duration.ofMinutes(1));
            store.upsertRule(GUILD, OWNER, TARGET, PermissionKind.CONNECT, Effect.ALLOW);

            List<PermissionRule> rules = store.rulesForOwner(GUILD, OWNER);
            assertEquals(1, rules.size());
            assertEquals(Effect.ALLOW, rules.get(0).effect());
            assertEquals(clock.instant(), rules.get(0).updatedAt());
        }

        @Test
        void rulesAreKeyedByKind() {
            store.upsertRule(GUILD, OWNER, TARGET, PermissionKind.CONNECT, Effect.DENY);
            store.upsertRule(GUILD, OWNER, TARGET, PermissionKind.SPEAK, Effect.DENY);

            assertEquals(2, store.rulesForOwner(GUILD, OWNER).size());
            assertTrue(store.findRule(GUILD, OWNER, TARGET, PermissionKind.SPEAK).isPresent());
            assertTrue(store.findRule(GUILD, OWNER, TARGET, PermissionKind.VIEW).isEmpty());
        }

        @Test
        void memberAndRoleWithSameIdAreDistinctTargets() {
            store.upsertRule(GUILD, OWNER, TargetRef.member(5), PermissionKind.SPEAK, Effect.DENY);
            store.upsertRule(GUILD, OWNER, TargetRef.role(5), PermissionKind.SPEAK, Effect.ALLOW);

            assertEquals(Effect.DENY,
                    store.findRule(GUILD, OWNER, TargetRef.member(5), PermissionKind.SPEAK).orElseThrow().effect());
            assertEquals(Effect.ALLOW,
                    store.findRule(GUILD, OWNER, TargetRef.role(5), PermissionKind.SPEAK).orElseThrow().effect());
        }

        @Test
        void guildsAreIsolated() {
            store.upsertRule(GUILD, OWNER, TARGET, PermissionKind.CONNECT, Effect.DENY);

            assertTrue(store.rulesForOwner(OTHER_GUILD, OWNER).isEmpty());
            assertEquals(0, store.clearRules(OTHER_GUILD, OWNER, null));
            assertEquals(1, store.rulesForOwner(GUILD, OWNER).size());
        }

        @Test
        void clearForOneTargetLeavesOthers() {
            store.upsertRule(GUILD, OWNER, TARGET, PermissionKind.CONNECT, Effect.DENY);
            store.upsertRule(GUILD, OWNER, TARGET, PermissionKind.SPEAK, Effect.DENY);
            store.upsertRule(GUILD, OWNER, TargetRef.role(7), PermissionKind.VIEW, Effect.DENY);

            assertEquals(2, store.clearRules(GUILD, OWNER, TARGET));
            assertEquals(1, store.rulesForOwner(GUILD, OWNER).size());
            assertEquals(1, store.clearRules(GUILD, OWNER, null));
        }

        @Test
        void deleteReportsWhetherARowExisted() {
            store.upsertRule(GUILD, OWNER, TARGET, PermissionKind.CONNECT, Effect.DENY);

            assertTrue(store.deleteRule(GUILD, OWNER, TARGET, PermissionKind.CONNECT));
            assertFalse(store.deleteRule(GUILD, OWNER, TARGET, PermissionKind.CONNECT));
        }

        @Test
        void moderatorsAreMemberAllowRules() {
            store.upsertRule(GUILD, OWNER, TargetRef.member(201), PermissionKind.MODERATOR, Effect.ALLOW);
            clock.advance(Duration.ofSeconds(1));
            store.upsertRule(GUILD, OWNER, TargetRef.member(202), PermissionKind.MODERATOR, Effect.ALLOW);
            store.upsertRule(GUILD, OWNER, TargetRef.member(203), PermissionKind.SPEAK, Effect.ALLOW);

            assertEquals(List.of(201L, 202L), store.moderatorsOf(GUILD, OWNER));
        }
    }

    @Nested
    class Autokicks {

        @Test
        void addIsIdempotent() {
            assertTrue(store.addAutokick(GUILD, OWNER, 200));
            assertFalse(store.addAutokick(GUILD, OWNER, 200));

            List<AutokickEntry> entries = store.autokicksOf(GUILD, OWNER);
            assertEquals(1, entries.size());
            assertEquals(200, entries.get(0).targetId());
        }

        @Test
        void removeAndClear() {
            store.addAutokick(GUILD, OWNER, 200);
            store.addAutokick(GUILD, OWNER, 201);

            assertTrue(store.isAutokicked(GUILD, OWNER, 200));
            assertTrue(store.removeAutokick(GUILD, OWNER, 200));
            assertFalse(store.removeAutokick(GUILD, OWNER, 200));
            assertFalse(store.isAutokicked(GUILD, OWNER, 200));
            assertEquals(1, store.clearAutokicks(GUILD, OWNER));
            assertTrue(store.autokicksOf(GUILD, OWNER).isEmpty());
        }

        @Test
        void listsArePerOwner() {
            store.addAutokick(GUILD, OWNER, 200);

            assertFalse(store.isAutokicked(GUILD, 101L, 200));
            assertFalse(store.isAutokicked(OTHER_GUILD, OWNER, 200));
        }
    }

    @Nested
    class Bypass {

        @Test
        void activeBypassesExcludeExpiredAndAbsentMembers() {
            Instant now = clock.instant();
            store.upsertBypass(GUILD, 200, now.plus(Duration.ofHours(1)));
            store.upsertBypass(GUILD, 201, now.minusSeconds(1));
            store.upsertBypass(GUILD, 202, now.plus(Duration.ofHours(1)));

            List<BypassFlag> active = store.activeBypasses(GUILD, List.of(200L, 201L), now);

            assertEquals(1, active.size());
            assertEquals(200, active.get(0).memberId());
        }

        @Test
        void upsertMovesTheExpiry() {
            Instant later = clock.instant().plus(Duration.ofHours(6));
            store.upsertBypass(GUILD, 200, clock.instant().plus(Duration.ofHours(1)));
            store.upsertBypass(GUILD, 200, later);

            assertEquals(later, store.findBypass(GUILD, 200).orElseThrow().expiresAt());
        }

        @Test
        void sweepDeletesAndReturnsExpired() {
            Instant now = clock.instant();
            store.upsertBypass(GUILD, 200, now.minusSeconds(5));
            store.upsertBypass(GUILD, 201, now.plusSeconds(5));

            List<BypassFlag> expired = store.deleteExpiredBypasses(now);

            assertEquals(1, expired.size());
            assertEquals(200, expired.get(0).memberId());
            assertTrue(store.findBypass(GUILD, 200).isEmpty());
            assertTrue(store.findBypass(GUILD, 201).isPresent());
            assertTrue(store.deleteExpiredBypasses(now).isEmpty());
        }
    }

    @Test
    void ownershipLogKeepsOrderAndNullOwners() {
        Instant now = clock.instant();
        store.appendOwnershipChange(new OwnershipChange(GUILD, 900, null, OWNER,
                OwnershipChange.Reason.CREATED, now));
        store.appendOwnershipChange(new OwnershipChange(GUILD, 900, OWNER, null,
                OwnershipChange.Reason.ABANDONED, now.plusSeconds(1)));
        store.appendOwnershipChange(new OwnershipChange(GUILD, 901, null, 7L,
                OwnershipChange.Reason.CREATED, now));

        List<OwnershipChange> history = store.ownershipHistory(GUILD, 900);

        assertEquals(2, history.size());
        assertEquals(OwnershipChange.Reason.CREATED, history.get(0).reason());
        assertNull(history.get(0).previousOwnerId());
        assertEquals(OWNER, history.get(1).previousOwnerId());
        assertNull(history.get(1).newOwnerId());
    }

    @Test
    void rulesSurviveReopen(@TempDir Path dir) throws Exception {
        Path db = dir.resolve("nested").resolve("tempvoice.db");
        try (SqlitePermissionStore first = new SqlitePermissionStore(db.toString(), clock)) {
            first.upsertRule(GUILD, OWNER, TARGET, PermissionKind.CONNECT, Effect.DENY);
            first.addAutokick(GUILD, OWNER, 300);
        }
        assertTrue(Files.exists(db));

        try (SqlitePermissionStore second = new SqlitePermissionStore(db.toString(), clock)) {
            assertEquals(Effect.DENY,
                    second.findRule(GUILD, OWNER, TARGET, PermissionKind.CONNECT).orElseThrow().effect());
            assertTrue(second.isAutokicked(GUILD, OWNER, 300));
        }
    }
}
