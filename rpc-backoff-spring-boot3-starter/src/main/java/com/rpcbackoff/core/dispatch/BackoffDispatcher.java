package com.rpcbackoff.core.dispatch;

import com.rpcbackoff.core.backoff.AttemptTracker;
import com.rpcbackoff.core.backoff.BackoffScheduler;
import com.rpcbackoff.core.backoff.BackoffSettings;
import com.rpcbackoff.core.backoff.ExpiryDecision;
import com.rpcbackoff.core.backoff.ExpiryPolicy;
import com.rpcbackoff.core.entrypoint.EntrypointInvoker;
import com.rpcbackoff.core.entrypoint.RpcEntrypoint;
import com.rpcbackoff.core.metric.RpcBackoffMetrics;
import com.rpcbackoff.core.notify.NotifyContexts;
import com.rpcbackoff.core.notify.NotifyingFacade;
import com.rpcbackoff.core.spi.EntrypointListener;
import com.rpcbackoff.exception.Backoff;
import com.rpcbackoff.exception.RedeliveryFailedException;
import com.rpcbackoff.model.BackoffTrace;
import com.rpcbackoff.model.InvocationResult;
import com.rpcbackoff.model.RpcMessage;
import com.rpcbackoff.model.ctx.DispatchContext;
import com.rpcbackoff.model.enums.DispatchOutcome;
import com.rpcbackoff.model.enums.Severity;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * 单次投递的状态机
 *
 * SUCCEEDED / EXPECTED_FAILURE / UNEXPECTED_FAILURE 直接回复;
 * BACKOFF 未达上限则延迟重投递且不回复, 达到上限回复 Expired.
 * 一条调用链只会有一次终态回复.
 */
@Slf4j
public class BackoffDispatcher {

    private final EntrypointInvoker invoker;

    private final AttemptTracker tracker;

    private final BackoffScheduler scheduler;

    private final ExpiryPolicy expiry;

    private final RpcResponder responder;

    private final List<EntrypointListener> listeners;

    private final RpcBackoffMetrics metrics;

    private final NotifyingFacade notifier;

    public BackoffDispatcher(EntrypointInvoker invoker, AttemptTracker tracker, BackoffScheduler scheduler,
                             ExpiryPolicy expiry, RpcResponder responder, List<EntrypointListener> listeners,
                             RpcBackoffMetrics metrics, NotifyingFacade notifier) {
        this.invoker = invoker;
        this.tracker = tracker;
        this.scheduler = scheduler;
        this.expiry = expiry;
        this.responder = responder;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.metrics = metrics;
        this.notifier = notifier;
    }

    /**
     * @param decodedArgs 已按方法签名解码的参数(不含 DispatchContext)
     */
    public DispatchOutcome dispatch(RpcEntrypoint ep, RpcMessage message, Object[] decodedArgs) {
        BackoffSettings settings = ep.getSettings();
        int attempt = tracker.read(message);
        DispatchContext ctx = DispatchContext.builder()
                .service(ep.getService())
                .method(ep.getMethod())
                .messageId(message.getMessageId())
                .correlationId(message.getCorrelationId())
                .headers(message.getHeaders())
                .attempt(attempt)
                .maxAttempts(settings.getMaxAttempts())
                .build();

        InvocationResult result = invoker.invoke(ep, ep.arguments(decodedArgs, ctx));
        metrics.recordExecNanos(result.getElapsedNanos());

        switch (result.getKind()) {
            case SUCCEEDED -> {
                metrics.incSuccess();
                metrics.recordAttempts(attempt);
                fireListeners(ctx, result.getValue(), null);
                responder.replyResult(message, result.getValue());
                return DispatchOutcome.SUCCEEDED;
            }
            case EXPECTED_FAILURE -> {
                log.warn("[Dispatch] {} message id={} attempt={} failed with expected {}",
                        ctx.entrypointKey(), ctx.getMessageId(), attempt, result.getError().toString());
                metrics.incExpected();
                metrics.recordAttempts(attempt);
                fireListeners(ctx, null, result.getError());
                responder.replyError(message, result.getError());
                return DispatchOutcome.EXPECTED_FAILURE;
            }
            case UNEXPECTED_FAILURE -> {
                return unexpected(ctx, message, result.getError());
            }
            case BACKOFF -> {
                return backoff(ep, ctx, message, result.getBackoff());
            }
            default -> throw new IllegalStateException("unknown invocation result " + result.getKind());
        }
    }

    private DispatchOutcome backoff(RpcEntrypoint ep, DispatchContext ctx, RpcMessage message, Backoff signal) {
        BackoffSettings settings = ep.getSettings();
        int attempt = ctx.getAttempt();
        List<BackoffTrace> history = tracker.history(message);

        ExpiryDecision decision = expiry.check(attempt, settings, signal, history);
        if (decision.isExpired()) {
            Backoff.Expired expired = decision.getExpired();
            log.warn("[Backoff] {} message id={} expired: {}", ctx.entrypointKey(), ctx.getMessageId(), expired.getMessage());
            metrics.incExpired();
            metrics.recordAttempts(attempt);
            notifier.fire(NotifyContexts.ctxForExpired(ctx, expired), Severity.WARNING);
            fireListeners(ctx, null, expired);
            responder.replyError(message, expired);
            return DispatchOutcome.EXPIRED;
        }

        Duration delay;
        try {
            delay = scheduler.reschedule(ep.queue(), message, attempt, settings, history, BackoffTrace.of(attempt, signal));
        } catch (RedeliveryFailedException e) {
            // 无法安排重投递, 当前这次按非预期失败回复, 调用方不会一直等待
            metrics.incRedeliveryFailed();
            notifier.fire(NotifyContexts.ctxForRedeliveryFailed(ctx, null, e), Severity.ERROR);
            return unexpected(ctx, message, e);
        }
        metrics.incRescheduled();
        log.info("[Backoff] {} message id={} attempt={} backing off {} ms",
                ctx.entrypointKey(), ctx.getMessageId(), attempt, delay.toMillis());
        fireListeners(ctx, null, signal);
        return DispatchOutcome.RESCHEDULED;
    }

    private DispatchOutcome unexpected(DispatchContext ctx, RpcMessage message, Throwable error) {
        log.error("[Dispatch] {} message id={} attempt={} failed unexpectedly",
                ctx.entrypointKey(), ctx.getMessageId(), ctx.getAttempt(), error);
        metrics.incUnexpected();
        metrics.recordAttempts(ctx.getAttempt());
        notifier.fire(NotifyContexts.ctxForUnexpected(ctx, error), Severity.ERROR);
        fireListeners(ctx, null, error);
        responder.replyError(message, error);
        return DispatchOutcome.UNEXPECTED_FAILURE;
    }

    private void fireListeners(DispatchContext ctx, Object result, Throwable error) {
        for (EntrypointListener l : listeners) {
            try {
                l.onExecution(ctx, result, error);
            } catch (RuntimeException e) {
                // 监听器异常不影响回复
                log.error("[Dispatch] listener {} failed on {}", l.getClass().getName(), ctx.entrypointKey(), e);
            }
        }
    }
}
