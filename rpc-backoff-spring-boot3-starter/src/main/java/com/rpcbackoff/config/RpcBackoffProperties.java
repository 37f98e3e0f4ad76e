package com.rpcbackoff.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * RPC 退避配置（绑定前缀：rpc.backoff）
 *
 * YAML 示例：
 * rpc:
 *   backoff:
 *     enabled: true
 *     default-max-attempts: 0
 *     history-limit: 16
 *     default-call-timeout: 30s
 *     backoff:
 *       strategy: schedule
 *       schedule: 1s,2s,3s,5s,8s,13s,21s,34s,55s
 *       initial-delay: 1s
 *       max-delay: 60s
 *       multiplier: 2.0
 *       jitter-ratio: 0
 *     wheel:
 *       tick-duration: 100ms
 *       ticks-per-wheel: 512
 *       max-pending-timeouts: 100000
 *     executor:
 *       core-pool-size: 8
 *       max-pool-size: 32
 *       queue-capacity: 1000
 *       keep-alive: 60s
 *       rejected-handler: CALLER_RUNS
 *     shutdown:
 *       await: 30s
 */
@Validated
@ConfigurationProperties(prefix = "rpc.backoff")
public class RpcBackoffProperties {

    /** 是否启动消费者 */
    private boolean enabled = true;

    /** 默认最大重试次数, <=0 表示不限, 可被 @Rpc(maxAttempts) 覆盖 */
    private int defaultMaxAttempts = 0;

    /** 随消息传递的退避记录条数上限 */
    private int historyLimit = 16;

    /** 调用方默认等待时长 */
    private Duration defaultCallTimeout = Duration.ofSeconds(30);

    private Backoff backoff = new Backoff();

    private Wheel wheel = new Wheel();

    private Exec executor = new Exec();

    private Shutdown shutdown = new Shutdown();

    // ----------------- 嵌套配置对象 -----------------

    public static class Backoff {
        /** 策略：schedule | fixed | exponential | spi:{name} */
        private String strategy = "schedule";

        /** 阶梯表, 超出部分取最后一项 */
        private List<Duration> schedule = new ArrayList<>(List.of(
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3),
                Duration.ofSeconds(5), Duration.ofSeconds(8), Duration.ofSeconds(13),
                Duration.ofSeconds(21), Duration.ofSeconds(34), Duration.ofSeconds(55)));

        /** fixed 的间隔 / exponential 的 base */
        private Duration initialDelay = Duration.ofSeconds(1);

        /** 最大间隔 */
        private Duration maxDelay = Duration.ofSeconds(60);

        /** exponential 增长倍率 */
        private double multiplier = 2.0;

        /** 抖动比例（0~1），只向上抖动，0 表示确定性 */
        private double jitterRatio = 0.0;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public List<Duration> getSchedule() { return schedule; }
        public void setSchedule(List<Duration> schedule) { this.schedule = schedule; }
        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
    }

    public static class Wheel {
        /** 时间轮刻度（Duration 友好写法：100ms、1s） */
        private Duration tickDuration = Duration.ofMillis(100);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数）, 超出后延迟投递会被拒绝 */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    /** 每个服务队列各自一个消费线程池, 以下为单个线程池的参数 */
    public static class Exec {
        private int corePoolSize = 8;

        private int maxPoolSize = 32;

        /** 任务队列容量 */
        private int queueCapacity = 1000;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        /** 拒绝策略：ABORT | CALLER_RUNS | DISCARD | DISCARD_OLDEST */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.CALLER_RUNS;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    // ----------------- 公共枚举/工具 -----------------

    /** 线程池拒绝策略枚举（YAML 中大小写均可） */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS, DISCARD, DISCARD_OLDEST;

        public static RejectedHandlerPolicy from(String v) {
            return RejectedHandlerPolicy.valueOf(v.trim().toUpperCase(Locale.ROOT));
        }
        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> new ThreadPoolExecutor.CallerRunsPolicy();
                case DISCARD -> new ThreadPoolExecutor.DiscardPolicy();
                case DISCARD_OLDEST -> new ThreadPoolExecutor.DiscardOldestPolicy();
            };
        }
    }

    // ----------------- getters/setters 顶层 -----------------

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getDefaultMaxAttempts() { return defaultMaxAttempts; }
    public void setDefaultMaxAttempts(int defaultMaxAttempts) { this.defaultMaxAttempts = defaultMaxAttempts; }

    public int getHistoryLimit() { return historyLimit; }
    public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }

    public Duration getDefaultCallTimeout() { return defaultCallTimeout; }
    public void setDefaultCallTimeout(Duration defaultCallTimeout) { this.defaultCallTimeout = defaultCallTimeout; }

    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Exec getExecutor() { return executor; }
    public void setExecutor(Exec executor) { this.executor = executor; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    // ----------------- 便捷换算 -----------------

    /** 以毫秒返回刻度（供 HashedWheelTimer 使用） */
    public long wheelTickMillis() { return wheel.getTickDuration().toMillis(); }

    /** 退避：基础/最大毫秒 */
    public long backoffInitialMillis() { return backoff.getInitialDelay().toMillis(); }
    public long backoffMaxMillis() { return backoff.getMaxDelay().toMillis(); }
}
