package com.rpcbackoff.core.backoff;

import com.rpcbackoff.core.spi.BackoffPolicy;

import java.time.Duration;

public class ExponentialBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public Duration delay(int attempt, BackoffSettings settings) {
        long base = settings.getInitialDelay().toMillis();
        double multiplier = settings.getMultiplier() < 1.0 ? 1.0 : settings.getMultiplier();

        // attempt从0开始计数：0 -> base, 1 -> base * m, 2 -> base * m^2 ...
        double pow = Math.pow(multiplier, Math.max(0, attempt));
        long ideal = (long) Math.min((double) Long.MAX_VALUE, base * pow);
        return Duration.ofMillis(ideal);
    }
}
