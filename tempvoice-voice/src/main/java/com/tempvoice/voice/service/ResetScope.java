package com.tempvoice.voice.service;

import com.tempvoice.voice.model.TargetRef;

/**
 * What a reset removes from the owner's persisted state.
 */
public sealed interface ResetScope {

    /** Every permission rule, moderator grants included. */
    record AllRules() implements ResetScope {
    }

    /** Rules for one member or role. */
    record Target(TargetRef target) implements ResetScope {
    }

    record Autokicks() implements ResetScope {
    }

    /** Rules and autokick list. */
    record Everything() implements ResetScope {
    }
}
