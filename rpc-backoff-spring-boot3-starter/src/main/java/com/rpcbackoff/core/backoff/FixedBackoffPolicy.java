package com.rpcbackoff.core.backoff;

import com.rpcbackoff.core.spi.BackoffPolicy;

import java.time.Duration;

/**
 * 固定间隔策略
 */
public class FixedBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public Duration delay(int attempt, BackoffSettings settings) {
        return settings.getInitialDelay();
    }
}
