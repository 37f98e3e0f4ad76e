package com.rpcbackoff.core.notify;

import com.rpcbackoff.exception.Backoff;
import com.rpcbackoff.model.ctx.DispatchContext;
import com.rpcbackoff.model.ctx.NotifyContext;
import com.rpcbackoff.model.enums.NotifyEventType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public final class NotifyContexts {

    private static final int MAX_ERROR_LEN = 4000;

    private NotifyContexts() {}

    /* ========== 对外入口（使用系统UTC时钟） ========== */

    public static NotifyContext ctxForExpired(DispatchContext d, Backoff.Expired e) {
        return ctxForExpired(d, e, Clock.systemUTC());
    }

    public static NotifyContext ctxForRedeliveryFailed(DispatchContext d, Duration delay, Throwable e) {
        return ctxForRedeliveryFailed(d, delay, e, Clock.systemUTC());
    }

    public static NotifyContext ctxForUnexpected(DispatchContext d, Throwable e) {
        return ctxForUnexpected(d, e, Clock.systemUTC());
    }

    public static NotifyContext ctxForEngineError(String service, String messageId, Throwable e) {
        return ctxForEngineError(service, messageId, e, Clock.systemUTC());
    }

    /* ========== 带 Clock 的重载（方便测试） ========== */

    public static NotifyContext ctxForExpired(DispatchContext d, Backoff.Expired e, Clock clock) {
        Map<String, Object> attrs = baseAttrs(d);
        attrs.put("history", e.getHistory().size());
        return base(NotifyEventType.BACKOFF_EXPIRED, d, "MAX_ATTEMPTS", e, clock, attrs);
    }

    public static NotifyContext ctxForRedeliveryFailed(DispatchContext d, Duration delay, Throwable e, Clock clock) {
        Map<String, Object> attrs = baseAttrs(d);
        if (delay != null) {
            attrs.put("delayMs", delay.toMillis());
        }
        return base(NotifyEventType.REDELIVERY_FAILED, d, "PUBLISH_FAILED", e, clock, attrs);
    }

    public static NotifyContext ctxForUnexpected(DispatchContext d, Throwable e, Clock clock) {
        Map<String, Object> attrs = baseAttrs(d);
        attrs.put("excType", e.getClass().getName());
        return base(NotifyEventType.UNEXPECTED_FAILURE, d, "UNEXPECTED", e, clock, attrs);
    }

    public static NotifyContext ctxForEngineError(String service, String messageId, Throwable e, Clock clock) {
        return NotifyContext.builder()
                .type(NotifyEventType.ENGINE_ERROR)
                .service(service)
                .messageId(messageId)
                .reasonCode("CONSUMER_ERROR")
                .lastError(truncate(toError(e)))
                .when(Instant.now(clock))
                .attributes(new HashMap<>())
                .build();
    }

    /* ========== 私有工具 ========== */

    private static NotifyContext base(NotifyEventType type, DispatchContext d, String reason,
                                      Throwable e, Clock clock, Map<String, Object> attrs) {
        return NotifyContext.builder()
                .type(type)
                .service(d.getService())
                .method(d.getMethod())
                .messageId(d.getMessageId())
                .attempt(d.getAttempt())
                .maxAttempts(d.getMaxAttempts())
                .reasonCode(reason)
                .lastError(truncate(toError(e)))
                .when(Instant.now(clock))
                .attributes(attrs)
                .build();
    }

    private static Map<String, Object> baseAttrs(DispatchContext d) {
        Map<String, Object> m = new HashMap<>();
        if (d.getCorrelationId() != null) m.put("correlationId", d.getCorrelationId());
        return m;
    }

    private static String toError(Throwable e) {
        if (e == null) return null;
        String msg = e.getClass().getName() + ": " + (e.getMessage() == null ? "" : e.getMessage());
        StringBuilder sb = new StringBuilder(msg);
        StackTraceElement[] stack = e.getStackTrace();
        // 只取前10行，避免过长
        int n = Math.min(stack.length, 10);
        for (int i = 0; i < n; i++) sb.append("\n  at ").append(stack[i]);
        return sb.toString();
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }
}
