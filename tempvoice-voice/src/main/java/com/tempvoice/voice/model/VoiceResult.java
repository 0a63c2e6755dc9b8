package com.tempvoice.voice.model;

import java.util.function.Function;

/**
 * Outcome of a voice operation: a value on success, an error code and message
 * otherwise.
 */
public record VoiceResult<T>(T value, VoiceErrorCode error, String message) {

    public static <T> VoiceResult<T> ok(T value) {
        return new VoiceResult<>(value, null, null);
    }

    public static VoiceResult<Void> ok() {
        return new VoiceResult<>(null, null, null);
    }

    public static <T> VoiceResult<T> fail(VoiceErrorCode error, String message) {
        return new VoiceResult<>(null, error, message);
    }

    public static <T> VoiceResult<T> fail(Throwable err) {
        PlatformException platform = PlatformException.from(err);
        return fail(platform.getCode(), platform.getMessage());
    }

    public boolean isOk() {
        return error == null;
    }

    public <R> VoiceResult<R> map(Function<T, R> fn) {
        return isOk() ? ok(fn.apply(value)) : fail(error, message);
    }

    /** Same failure, different value type. */
    public <R> VoiceResult<R> castFailure() {
        if (isOk()) {
            throw new IllegalStateException("Result is not a failure");
        }
        return fail(error, message);
    }
}
