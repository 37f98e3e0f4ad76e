package com.rpcbackoff.model;

import com.rpcbackoff.exception.Backoff;
import lombok.Getter;

/**
 * handler 一次调用的结果
 * 分发状态机按值分支, 而不是依赖异常跳转
 */
@Getter
public final class InvocationResult {

    public enum Kind { SUCCEEDED, BACKOFF, EXPECTED_FAILURE, UNEXPECTED_FAILURE }

    private final Kind kind;
    private final Object value;
    private final Throwable error;
    private final long elapsedNanos;

    private InvocationResult(Kind kind, Object value, Throwable error, long elapsedNanos) {
        this.kind = kind; this.value = value; this.error = error; this.elapsedNanos = elapsedNanos;
    }

    public static InvocationResult success(Object value, long nanos) { return new InvocationResult(Kind.SUCCEEDED, value, null, nanos); }
    public static InvocationResult backoff(Backoff b, long nanos) { return new InvocationResult(Kind.BACKOFF, null, b, nanos); }
    public static InvocationResult expected(Throwable t, long nanos) { return new InvocationResult(Kind.EXPECTED_FAILURE, null, t, nanos); }
    public static InvocationResult unexpected(Throwable t, long nanos) { return new InvocationResult(Kind.UNEXPECTED_FAILURE, null, t, nanos); }

    public Backoff getBackoff() {
        return kind == Kind.BACKOFF ? (Backoff) error : null;
    }
}
