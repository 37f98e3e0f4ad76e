package com.rpcbackoff.core.backoff;

import com.rpcbackoff.core.spi.BackoffPolicy;
import com.rpcbackoff.core.spi.RpcTransport;
import com.rpcbackoff.exception.RedeliveryFailedException;
import com.rpcbackoff.model.BackoffTrace;
import com.rpcbackoff.model.RpcMessage;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 计算下一次投递的等待时长, 并交给传输层延迟重投递
 */
@Slf4j
public class BackoffScheduler {

    private final BackoffRegistry registry;

    private final AttemptTracker tracker;

    private final RpcTransport transport;

    /** 随消息传递的退避记录上限 */
    private final int historyLimit;

    public BackoffScheduler(BackoffRegistry registry, AttemptTracker tracker, RpcTransport transport, int historyLimit) {
        this.registry = registry;
        this.tracker = tracker;
        this.transport = transport;
        this.historyLimit = historyLimit;
    }

    /**
     * 确定性的等待时长
     * 对 attempt 单调不减, 上限 maxDelay
     */
    public Duration delayFor(int attempt, BackoffSettings s) {
        BackoffPolicy policy = registry.resolve(s.getStrategy());
        long max = s.getMaxDelay().toMillis();
        // 自定义策略不保证单调, 取前缀最大值
        long delay = 0;
        for (int i = 0; i <= Math.max(0, attempt); i++) {
            long d = Math.max(0, policy.delay(i, s).toMillis());
            if (d > delay) {
                delay = d;
            }
            if (delay >= max) {
                return Duration.ofMillis(max);
            }
        }
        return Duration.ofMillis(delay);
    }

    /**
     * 带抖动的等待时长, 只向上抖动且不超过 maxDelay
     */
    public Duration jittered(int attempt, BackoffSettings s) {
        Duration base = delayFor(attempt, s);
        double jr = s.getJitterRatio();
        if (jr <= 0) {
            return base;
        }
        long ideal = base.toMillis();
        long jitter = Math.round(ThreadLocalRandom.current().nextDouble(0, jr) * ideal);
        return Duration.ofMillis(Math.min(ideal + jitter, s.getMaxDelay().toMillis()));
    }

    /**
     * 前 limit 次退避的确定性总等待
     */
    public Duration totalDelay(int limit, BackoffSettings s) {
        BackoffPolicy policy = registry.resolve(s.getStrategy());
        long max = s.getMaxDelay().toMillis();
        // 与 delayFor 相同的前缀最大值, 一次遍历累加
        long delay = 0;
        long total = 0;
        for (int i = 0; i < limit; i++) {
            delay = Math.max(delay, Math.max(0, policy.delay(i, s).toMillis()));
            if (delay >= max) {
                total += (long) (limit - i) * max;
                break;
            }
            total += delay;
        }
        return Duration.ofMillis(total);
    }

    /**
     * 发布次数+1的重投递, 当前投递不产生任何响应
     * 发布失败包装为 RedeliveryFailedException 抛出
     *
     * @return 实际等待时长
     */
    public Duration reschedule(String queue, RpcMessage message, int attempt, BackoffSettings s,
                               List<BackoffTrace> history, BackoffTrace trace) {
        Duration delay = jittered(attempt, s);
        RpcMessage next = tracker.appendHistory(tracker.next(message), history, trace, historyLimit);
        try {
            transport.publishDelayed(queue, next, delay);
        } catch (RuntimeException e) {
            throw new RedeliveryFailedException("failed to schedule redelivery of message "
                    + message.getMessageId() + " (attempt " + (attempt + 1) + ") on " + queue, e);
        }
        log.debug("[Backoff] message id={} queue={} attempt={} redelivery in {} ms",
                message.getMessageId(), queue, attempt + 1, delay.toMillis());
        return delay;
    }
}
