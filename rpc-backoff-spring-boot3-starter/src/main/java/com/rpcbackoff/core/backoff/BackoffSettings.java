package com.rpcbackoff.core.backoff;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * 单个 entrypoint 已解析的退避配置
 * 注册时计算一次, 之后只读
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class BackoffSettings {

    /** schedule | fixed | exponential | spi:{name} */
    private final String strategy;

    private final List<Duration> schedule;

    private final Duration initialDelay;

    private final Duration maxDelay;

    private final double multiplier;

    private final double jitterRatio;

    /** <=0 不限 */
    private final int maxAttempts;

    public boolean isLimited() {
        return maxAttempts > 0;
    }
}
