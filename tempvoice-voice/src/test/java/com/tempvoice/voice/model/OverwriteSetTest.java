package com.tempvoice.voice.model;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OverwriteSetTest {

    private static final TargetRef ALICE = TargetRef.member(100);
    private static final TargetRef BOB = TargetRef.member(200);
    private static final TargetRef ROLE = TargetRef.role(300);

    @Nested
    class Builder {

        @Test
        void laterLayerWinsPerBit() {
            OverwriteSet set = OverwriteSet.builder()
                    .allow(ALICE, PermissionBits.SPEAK | PermissionBits.STREAM)
                    .deny(ALICE, PermissionBits.SPEAK)
                    .build();

            Overwrite alice = set.get(ALICE).orElseThrow();
            assertTrue(alice.denies(PermissionBits.SPEAK));
            assertTrue(alice.allows(PermissionBits.STREAM));
            assertFalse(alice.allows(PermissionBits.SPEAK));
        }

        @Test
        void allowAfterDenyClearsTheDeny() {
            OverwriteSet set = OverwriteSet.builder()
                    .deny(ROLE, PermissionBits.CONNECT)
                    .allow(ROLE, PermissionBits.CONNECT)
                    .build();

            assertEquals(PermissionBits.CONNECT, set.get(ROLE).orElseThrow().allow());
            assertEquals(0, set.get(ROLE).orElseThrow().deny());
        }

        @Test
        void neutralTargetsAreDropped() {
            OverwriteSet.Builder builder = OverwriteSet.builder()
                    .apply(ALICE, 0, 0)
                    .allow(BOB, PermissionBits.VIEW_CHANNEL);

            assertTrue(builder.contains(ALICE));
            assertEquals(1, builder.size());
            OverwriteSet set = builder.build();
            assertEquals(1, set.size());
            assertTrue(set.get(ALICE).isEmpty());
        }

        @Test
        void limitKeepsEarliestTargets() {
            OverwriteSet set = OverwriteSet.builder()
                    .allow(ALICE, PermissionBits.SPEAK)
                    .allow(BOB, PermissionBits.SPEAK)
                    .deny(ROLE, PermissionBits.SPEAK)
                    .build(2);

            assertEquals(2, set.size());
            assertTrue(set.get(ROLE).isEmpty());
        }
    }

    @Nested
    class Diff {

        @Test
        void identicalSetsNeedNoCommands() {
            OverwriteSet set = OverwriteSet.of(List.of(new Overwrite(ALICE, PermissionBits.OWNER, 0)));

            assertTrue(set.diff(OverwriteSet.of(List.of(new Overwrite(ALICE, PermissionBits.OWNER, 0)))).isEmpty());
        }

        @Test
        void changedAndNewTargetsAreUpserted() {
            OverwriteSet previous = OverwriteSet.of(List.of(
                    new Overwrite(ALICE, PermissionBits.SPEAK, 0),
                    new Overwrite(BOB, 0, PermissionBits.CONNECT)));
            OverwriteSet desired = OverwriteSet.of(List.of(
                    new Overwrite(ALICE, 0, PermissionBits.SPEAK),
                    new Overwrite(BOB, 0, PermissionBits.CONNECT),
                    new Overwrite(ROLE, 0, PermissionBits.STREAM)));

            OverwriteSet.Diff diff = desired.diff(previous);

            assertEquals(List.of(ALICE, ROLE), diff.upserts().stream().map(Overwrite::target).toList());
            assertTrue(diff.removals().isEmpty());
            assertEquals(2, diff.commandCount());
        }

        @Test
        void vanishedTargetsAreRemoved() {
            OverwriteSet previous = OverwriteSet.of(List.of(new Overwrite(BOB, 0, PermissionBits.CONNECT)));

            OverwriteSet.Diff diff = OverwriteSet.EMPTY.diff(previous);

            assertEquals(List.of(BOB), diff.removals());
            assertTrue(diff.upserts().isEmpty());
        }

        @Test
        void nullPreviousMeansEverythingIsNew() {
            OverwriteSet desired = OverwriteSet.EMPTY.with(new Overwrite(ALICE, PermissionBits.SPEAK, 0));

            assertEquals(1, desired.diff(null).upserts().size());
        }
    }

    @Test
    void overwriteNeverSetsABitInBothMasks() {
        Overwrite overwrite = new Overwrite(ALICE, PermissionBits.SPEAK | PermissionBits.CONNECT,
                PermissionBits.SPEAK);

        assertEquals(PermissionBits.CONNECT, overwrite.allow());
        assertEquals(PermissionBits.SPEAK, overwrite.deny());
    }

    @Test
    void withoutReturnsSameInstanceForUnknownTarget() {
        OverwriteSet set = OverwriteSet.EMPTY.with(new Overwrite(ALICE, PermissionBits.SPEAK, 0));

        assertSame(set, set.without(BOB));
        assertTrue(set.without(ALICE).isEmpty());
    }

    @Test
    void attachmentKindCoversFilesEmbedsAndEmoji() {
        assertEquals(PermissionBits.ATTACH_FILES | PermissionBits.EMBED_LINKS | PermissionBits.USE_EXTERNAL_EMOJIS,
                PermissionBits.ATTACHMENTS);
        assertEquals(PermissionKind.CONNECT, PermissionKind.fromKey("connect").orElseThrow());
        assertTrue(PermissionKind.fromKey("fly").isEmpty());
    }
}
