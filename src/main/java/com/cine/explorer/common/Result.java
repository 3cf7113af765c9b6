package com.cine.explorer.common;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    /**
     * Convenience alias: true when successful.
     */
    public boolean isOk() {
        return success;
    }

    /**
     * Maps the payload when OK; propagates failure otherwise.
     */
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (!success) return Result.fail(errorCode, error);
        return Result.ok(mapper.apply(data));
    }
}
