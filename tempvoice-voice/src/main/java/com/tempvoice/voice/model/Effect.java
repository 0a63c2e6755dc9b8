package com.tempvoice.voice.model;

public enum Effect {
    ALLOW,
    DENY;

    public Effect opposite() {
        return this == ALLOW ? DENY : ALLOW;
    }
}
