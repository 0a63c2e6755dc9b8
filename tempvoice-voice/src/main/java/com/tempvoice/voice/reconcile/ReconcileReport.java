package com.tempvoice.voice.reconcile;

/**
 * Repairs made by one reconciliation pass.
 *
 * @param evicted  registry entries whose channel no longer exists
 * @param deleted  empty untracked channels deleted
 * @param adopted  occupied untracked channels adopted as ownerless
 * @param joined   members found in a channel the registry missed
 * @param left     registry members no longer in the channel
 * @param failures guilds or channels that could not be reconciled
 */
public record ReconcileReport(int evicted, int deleted, int adopted, int joined, int left, int failures) {

    public static final ReconcileReport EMPTY = new ReconcileReport(0, 0, 0, 0, 0, 0);

    public ReconcileReport plus(ReconcileReport other) {
        return new ReconcileReport(evicted + other.evicted, deleted + other.deleted, adopted + other.adopted,
                joined + other.joined, left + other.left, failures + other.failures);
    }

    public boolean isClean() {
        return evicted == 0 && deleted == 0 && adopted == 0 && joined == 0 && left == 0 && failures == 0;
    }
}
