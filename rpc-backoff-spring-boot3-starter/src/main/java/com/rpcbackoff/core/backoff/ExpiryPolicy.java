package com.rpcbackoff.core.backoff;

import com.rpcbackoff.exception.Backoff;
import com.rpcbackoff.model.BackoffTrace;

import java.util.List;

/**
 * 判断退避是否耗尽
 * maxAttempts<=0 永不过期; 达到上限时构造 Expired, cause 指向触发的 Backoff
 */
public class ExpiryPolicy {

    private final BackoffScheduler scheduler;

    public ExpiryPolicy(BackoffScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public ExpiryDecision check(int attempt, BackoffSettings s, Backoff signal, List<BackoffTrace> history) {
        if (!s.isLimited() || attempt < s.getMaxAttempts()) {
            return ExpiryDecision.proceed();
        }
        int limit = s.getMaxAttempts();
        long seconds = Math.round(scheduler.totalDelay(limit, s).toMillis() / 1000.0);
        String message = String.format("Backoff aborted after '%d' retries (~%d seconds)", limit, seconds);
        return ExpiryDecision.expired(new Backoff.Expired(message, limit, signal, history));
    }
}
