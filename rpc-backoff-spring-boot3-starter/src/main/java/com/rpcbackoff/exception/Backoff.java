package com.rpcbackoff.exception;

import com.rpcbackoff.model.BackoffTrace;

import java.util.Collections;
import java.util.List;

/**
 * 退避信号
 * entrypoint 抛出表示"暂时无法完成, 稍后重新投递", 由分发拦截器吸收, 不会直接返回给调用方
 *
 * <pre>
 * try {
 *     ...
 * } catch (NotReadyException e) {
 *     throw new Backoff(e);
 * }
 * </pre>
 */
public class Backoff extends RuntimeException {

    public Backoff() {
        super();
    }

    /**
     * 携带根因
     */
    public Backoff(Throwable cause) {
        super(cause == null ? null : cause.toString(), cause);
    }

    public Backoff(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 重试次数耗尽
     * 只由 ExpiryPolicy 构造, cause 为触发的 Backoff(可继续指向业务根因)
     */
    public static class Expired extends RuntimeException {

        /** 配置的最大重试次数 */
        private final int attempts;

        /** 之前各次投递的退避记录, 按 attempt 升序 */
        private final List<BackoffTrace> history;

        public Expired(String message, int attempts, Backoff cause, List<BackoffTrace> history) {
            super(message, cause);
            this.attempts = attempts;
            this.history = history == null ? List.of() : List.copyOf(history);
            // 之前的投递在别的线程/消息里, 只能以记录的形式挂到异常链上
            for (BackoffTrace trace : this.history) {
                addSuppressed(new PriorAttemptException(trace));
            }
        }

        public int getAttempts() {
            return attempts;
        }

        public List<BackoffTrace> getHistory() {
            return Collections.unmodifiableList(history);
        }
    }
}
