package com.tempvoice.voice.model;

/**
 * Per-channel permission exception for one target. A bit is never set in
 * both masks.
 */
public record Overwrite(TargetRef target, long allow, long deny) {

    public Overwrite {
        if (target == null) {
            throw new IllegalArgumentException("target is required");
        }
        allow &= ~deny;
    }

    public boolean isNeutral() {
        return allow == 0 && deny == 0;
    }

    public boolean allows(long bits) {
        return (allow & bits) == bits;
    }

    public boolean denies(long bits) {
        return (deny & bits) == bits;
    }
}
