package com.rpcbackoff.core.notify;

import com.rpcbackoff.core.metric.RpcBackoffMetrics;
import com.rpcbackoff.core.spi.notify.Notifier;
import com.rpcbackoff.core.spi.notify.NotifierFilter;
import com.rpcbackoff.core.spi.notify.NotifierRouter;
import com.rpcbackoff.model.ctx.NotifyContext;
import com.rpcbackoff.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 异步派发
 * 通过路由、限流、异步执行通知, 不阻塞消费线程
 */
public class AsyncNotifyingService {

    private final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    private static final int MAX_TRIES = 3;

    private final ExecutorService exec;

    private final NotifierRouter router;

    private final NotifierFilter filter;

    private final RpcBackoffMetrics metrics;

    public AsyncNotifyingService(ExecutorService exec, NotifierRouter router, NotifierFilter filter, RpcBackoffMetrics metrics) {
        this.exec = exec;
        this.router = router;
        this.filter = filter;
        this.metrics = metrics;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        if (filter != null && !filter.allow(ctx, sev)) {
            metrics.incNotifySuppressed();
            return;
        }
        try {
            exec.execute(() -> dispatch(ctx, sev));
        } catch (RejectedExecutionException e) {
            metrics.incNotifySuppressed();
            log.warn("[Notify] event={} entrypoint={} dropped: notify executor saturated",
                    ctx.getType(), ctx.entrypointKey());
        }
    }

    private void dispatch(NotifyContext ctx, Severity sev) {
        List<Notifier> notifiers = router.route(ctx, sev);
        for (Notifier n : notifiers) {
            if (!n.supports(ctx)) {
                continue;
            }
            try {
                int attempt = 0;
                long backoff = 200;
                while (true) {
                    try {
                        n.notify(ctx, sev);
                        break;
                    } catch (RuntimeException e) {
                        if (++ attempt >= MAX_TRIES) {
                            throw e;
                        }
                        Thread.sleep(backoff);
                        // 指数退避
                        backoff = Math.min(backoff * 2, 4000);
                    }
                }
                metrics.incNotifySent();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                metrics.incNotifyFailed();
                log.warn("[Notify] channel={} event={} interrupted", n.name(), ctx.getType());
                return;
            } catch (RuntimeException e) {
                metrics.incNotifyFailed();
                log.error("[Notify] channel={} event={} failed", n.name(), ctx.getType(), e);
            }
        }
    }
}
