package com.nifty.bulk.client.common;

import com.nifty.bulk.client.common.exception.BaseClientException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a façade call: either a payload or an error code plus message.
 * Error codes match {@link BaseClientException#getErrorCode()} so the HTTP layer can map them.
 */
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
     * Typed client failures keep their own code; anything else becomes ERR-SYS-001.
     */
    public static <T> Result<T> fail(Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof BaseClientException) {
            BaseClientException bce = (BaseClientException) cause;
            return new Result<>(false, null, bce.getMessage(), bce.getErrorCode());
        }
        String msg = (cause == null)
                ? "Unknown error"
                : (cause.getMessage() == null ? cause.toString() : cause.getMessage());
        return new Result<>(false, null, msg, "ERR-SYS-001");
    }

    // CompletableFuture wraps failures in CompletionException
    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while (cur instanceof java.util.concurrent.CompletionException && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    // ---------- convenience helpers ----------

    public boolean isOk() {
        return success;
    }

    public T get() {
        return data;
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
