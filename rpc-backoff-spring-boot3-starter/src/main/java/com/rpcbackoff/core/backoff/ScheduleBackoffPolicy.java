package com.rpcbackoff.core.backoff;

import com.rpcbackoff.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.List;

/**
 * 阶梯表策略, 超出表长的投递沿用最后一项
 */
public class ScheduleBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "schedule";
    }

    @Override
    public Duration delay(int attempt, BackoffSettings settings) {
        List<Duration> schedule = settings.getSchedule();
        if (schedule == null || schedule.isEmpty()) {
            return settings.getInitialDelay();
        }
        return schedule.get(Math.min(Math.max(0, attempt), schedule.size() - 1));
    }
}
