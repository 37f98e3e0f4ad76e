package com.rpcbackoff.core.notify.ratelimit;

import com.rpcbackoff.core.spi.notify.NotifierFilter;
import com.rpcbackoff.model.ctx.NotifyContext;
import com.rpcbackoff.model.enums.Severity;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存窗口限流, 按 事件类型+entrypoint+级别 计数
 */
public class RateLimitFilter implements NotifierFilter {

    private final long windowMs;

    private final int threshold;

    private volatile long windowStart = System.currentTimeMillis();

    private final ConcurrentHashMap<String, AtomicInteger> counter = new ConcurrentHashMap<>();

    public RateLimitFilter(Duration window, int threshold) {
        this.windowMs = window.toMillis();
        this.threshold = threshold;
    }

    @Override
    public boolean allow(NotifyContext ctx, Severity sev) {
        long now = System.currentTimeMillis();
        // 重置窗口
        if (now - windowStart > windowMs) {
            windowStart = now;
            counter.clear();
        }
        String key = String.format("%s_%s_%s", ctx.getType(), ctx.entrypointKey(), sev.name());
        int c = counter.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        return c <= threshold;
    }
}
