package com.rpcbackoff.core.backoff;

import com.rpcbackoff.config.RpcBackoffProperties;
import com.rpcbackoff.core.spi.BackoffPolicy;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 schedule / fixed / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy（name() 返回的名字）
 * - 线程安全
 */
public class BackoffRegistry implements InitializingBean {

    private static final String PREFIX_SPI = "spi:";

    private static final String DEFAULT = "schedule";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    private final RpcBackoffProperties props;

    public BackoffRegistry(RpcBackoffProperties props, @Nullable List<BackoffPolicy> discovered) {
        this.props = Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(p -> registry(p.name(), p));
        }
        // 内置策略
        policies.putIfAbsent("schedule", new ScheduleBackoffPolicy());
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent("exponential", new ExponentialBackoffPolicy());
    }

    public BackoffRegistry(RpcBackoffProperties props) {
        this(props, null);
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry registry(String name, BackoffPolicy policy) {
        String key = normalize(name);
        policies.put(key, policy);
        return this;
    }

    /**
     * 按名称解析策略
     * 支持 spi:{name} 前缀, 不存在则采用默认schedule策略
     */
    public BackoffPolicy resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get(DEFAULT);
        }
        return policies.getOrDefault(keyOf(strategy), policies.get(DEFAULT));
    }

    public boolean contains(String strategy) {
        return strategy == null || strategy.isBlank() || policies.containsKey(keyOf(strategy));
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    /**
     * 注册 entrypoint 时校验, 配置错误直接启动失败
     */
    public void validate(String owner, BackoffSettings s) {
        if (!contains(s.getStrategy())) {
            throw new IllegalArgumentException(owner + ": unknown backoff strategy '" + s.getStrategy()
                    + "', registered=" + names());
        }
        if (s.getInitialDelay() == null || s.getInitialDelay().isNegative()) {
            throw new IllegalArgumentException(owner + ": initial delay must be >= 0");
        }
        if (s.getMaxDelay() == null || s.getMaxDelay().compareTo(s.getInitialDelay()) < 0) {
            throw new IllegalArgumentException(owner + ": max delay must be >= initial delay");
        }
        if (s.getJitterRatio() < 0 || s.getJitterRatio() > 1) {
            throw new IllegalArgumentException(owner + ": jitter ratio must be within [0, 1]");
        }
        List<Duration> schedule = s.getSchedule();
        if (schedule != null) {
            for (int i = 1; i < schedule.size(); i++) {
                // 阶梯表必须单调不减
                if (schedule.get(i).compareTo(schedule.get(i - 1)) < 0) {
                    throw new IllegalArgumentException(owner + ": backoff schedule must be non-decreasing, got " + schedule);
                }
            }
        }
    }

    private static String keyOf(String strategy) {
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            return normalize(s.substring(PREFIX_SPI.length()));
        }
        return normalize(s);
    }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    @Override
    public void afterPropertiesSet() throws Exception {
        // 参数校验
        long initial = props.backoffInitialMillis(), max = props.backoffMaxMillis();
        if (max < initial) {
            throw new IllegalArgumentException("rpc.backoff.backoff.max-delay must be >= rpc.backoff.backoff.initial-delay");
        }
        RpcBackoffProperties.Backoff b = props.getBackoff();
        validate("rpc.backoff.backoff", BackoffSettings.builder()
                .strategy(b.getStrategy())
                .schedule(b.getSchedule())
                .initialDelay(b.getInitialDelay())
                .maxDelay(b.getMaxDelay())
                .multiplier(b.getMultiplier())
                .jitterRatio(b.getJitterRatio())
                .maxAttempts(props.getDefaultMaxAttempts())
                .build());
    }
}
