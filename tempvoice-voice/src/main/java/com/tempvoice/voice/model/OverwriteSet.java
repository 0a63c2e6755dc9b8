package com.tempvoice.voice.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable set of overwrites for one channel, at most one per target.
 * Iteration order is insertion order.
 */
public final class OverwriteSet {

    public static final OverwriteSet EMPTY = new OverwriteSet(Map.of());

    private final Map<TargetRef, Overwrite> overwrites;

    private OverwriteSet(Map<TargetRef, Overwrite> overwrites) {
        this.overwrites = Collections.unmodifiableMap(overwrites);
    }

    public static OverwriteSet of(Collection<Overwrite> overwrites) {
        Map<TargetRef, Overwrite> map = new LinkedHashMap<>();
        for (Overwrite overwrite : overwrites) {
            map.put(overwrite.target(), overwrite);
        }
        return new OverwriteSet(map);
    }

    public Optional<Overwrite> get(TargetRef target) {
        return Optional.ofNullable(overwrites.get(target));
    }

    public Collection<Overwrite> overwrites() {
        return overwrites.values();
    }

    public int size() {
        return overwrites.size();
    }

    public boolean isEmpty() {
        return overwrites.isEmpty();
    }

    public OverwriteSet with(Overwrite overwrite) {
        Map<TargetRef, Overwrite> map = new LinkedHashMap<>(overwrites);
        map.put(overwrite.target(), overwrite);
        return new OverwriteSet(map);
    }

    public OverwriteSet without(TargetRef target) {
        if (!overwrites.containsKey(target)) {
            return this;
        }
        Map<TargetRef, Overwrite> map = new LinkedHashMap<>(overwrites);
        map.remove(target);
        return new OverwriteSet(map);
    }

    /**
     * Commands needed to turn {@code previous} into this set: one upsert per
     * new or changed target and one removal per target that disappeared.
     */
    public Diff diff(OverwriteSet previous) {
        OverwriteSet base = previous != null ? previous : EMPTY;
        List<Overwrite> upserts = new ArrayList<>();
        for (Overwrite overwrite : overwrites.values()) {
            if (!overwrite.equals(base.overwrites.get(overwrite.target()))) {
                upserts.add(overwrite);
            }
        }
        List<TargetRef> removals = new ArrayList<>();
        for (TargetRef target : base.overwrites.keySet()) {
            if (!overwrites.containsKey(target)) {
                removals.add(target);
            }
        }
        return new Diff(List.copyOf(upserts), List.copyOf(removals));
    }

    public record Diff(List<Overwrite> upserts, List<TargetRef> removals) {

        public boolean isEmpty() {
            return upserts.isEmpty() && removals.isEmpty();
        }

        public int commandCount() {
            return upserts.size() + removals.size();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof OverwriteSet other && overwrites.equals(other.overwrites);
    }

    @Override
    public int hashCode() {
        return Objects.hash(overwrites);
    }

    @Override
    public String toString() {
        return "OverwriteSet" + overwrites.values();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates bits per target. A later call wins for every bit it touches,
     * so layers are added from lowest to highest precedence.
     */
    public static final class Builder {

        private final Map<TargetRef, long[]> masks = new LinkedHashMap<>();

        public Builder allow(TargetRef target, long bits) {
            return apply(target, bits, 0);
        }

        public Builder deny(TargetRef target, long bits) {
            return apply(target, 0, bits);
        }

        public Builder apply(TargetRef target, long allow, long deny) {
            long[] mask = masks.computeIfAbsent(target, t -> new long[2]);
            mask[0] = (mask[0] | allow) & ~deny;
            mask[1] = (mask[1] & ~allow) | deny;
            return this;
        }

        public boolean contains(TargetRef target) {
            return masks.containsKey(target);
        }

        /**
         * Build the set, keeping at most {@code limit} targets in insertion order.
         * Neutral targets are dropped.
         */
        public OverwriteSet build(int limit) {
            Map<TargetRef, Overwrite> map = new LinkedHashMap<>();
            for (Map.Entry<TargetRef, long[]> entry : masks.entrySet()) {
                if (map.size() >= limit) {
                    break;
                }
                Overwrite overwrite = new Overwrite(entry.getKey(), entry.getValue()[0], entry.getValue()[1]);
                if (!overwrite.isNeutral()) {
                    map.put(entry.getKey(), overwrite);
                }
            }
            return new OverwriteSet(map);
        }

        public OverwriteSet build() {
            return build(Integer.MAX_VALUE);
        }

        /** Number of non-neutral targets accumulated so far. */
        public int size() {
            int n = 0;
            for (long[] mask : masks.values()) {
                if (mask[0] != 0 || mask[1] != 0) {
                    n++;
                }
            }
            return n;
        }
    }
}
