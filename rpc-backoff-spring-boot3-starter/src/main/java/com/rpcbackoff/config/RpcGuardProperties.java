package com.rpcbackoff.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * rpc:
 *   backoff:
 *     guard:
 *       enabled: true
 *       circuit-breaker:
 *         enabled: true
 *         failure-rate-threshold: 60
 *         sliding-window-size: 200
 *         wait-duration-in-open-state: 15s
 *       bulkhead:
 *         enabled: true
 *         max-concurrent-calls: 200
 *       rate-limiter:
 *         enabled: true
 *         limit-for-period: 300
 *         limit-refresh-period: 100ms
 *         timeout-duration: 10ms
 *       cb-per-entrypoint:
 *         payment.charge: { failure-rate-threshold: 30, wait-duration-in-open-state: 5s }
 *
 * 被拒绝的调用会转为 Backoff, 稍后重投递
 */
@Data
@ConfigurationProperties(prefix = "rpc.backoff.guard")
public class RpcGuardProperties {
    /** 总开关 */
    private boolean enabled = false;

    /** 默认配置（可被 service.method 覆盖） */
    private CbConfig circuitBreaker = new CbConfig();
    private BhConfig bulkhead = new BhConfig();
    private RlConfig rateLimiter = new RlConfig();

    /** 按 service.method 覆盖 */
    private Map<String, CbConfig> cbPerEntrypoint;
    private Map<String, BhConfig> bhPerEntrypoint;
    private Map<String, RlConfig> rlPerEntrypoint;

    @Data
    public static class CbConfig {
        private boolean enabled = false;
        private float failureRateThreshold = 50f;
        private float slowCallRateThreshold = 100f;
        private Duration slowCallDurationThreshold = Duration.ofSeconds(5);
        private int slidingWindowSize = 100;
        private Duration waitDurationInOpenState = Duration.ofSeconds(10);
        private int permittedNumberOfCallsInHalfOpenState = 10;
    }

    @Data
    public static class BhConfig {
        private boolean enabled = false;
        private int maxConcurrentCalls = 100;
        // 0=非阻塞
        private Duration maxWaitDuration = Duration.ofMillis(0);
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        // 每个窗口许可数
        private int limitForPeriod = 200;
        private Duration limitRefreshPeriod = Duration.ofMillis(100);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ofMillis(0);
    }
}
