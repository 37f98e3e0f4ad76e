package com.rpcbackoff.core.notify.notifier;

import com.rpcbackoff.core.spi.notify.Notifier;
import com.rpcbackoff.model.ctx.NotifyContext;
import com.rpcbackoff.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知, 默认启用
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotifyContext ctx, Severity severity) {
        switch (severity) {
            case CRITICAL, ERROR -> log.error("[Notify-{}] entrypoint={}, message={}, attempt={}/{}, reason={}, err={}, attrs={}",
                    ctx.getType(), ctx.entrypointKey(), ctx.getMessageId(), ctx.getAttempt(), ctx.getMaxAttempts(),
                    ctx.getReasonCode(), truncate(ctx.getLastError()), ctx.getAttributes());
            case WARNING -> log.warn("[Notify-{}] entrypoint={}, message={}, attempt={}/{}, reason={}, attrs={}",
                    ctx.getType(), ctx.entrypointKey(), ctx.getMessageId(), ctx.getAttempt(), ctx.getMaxAttempts(),
                    ctx.getReasonCode(), ctx.getAttributes());
            default -> log.info("[Notify-{}] entrypoint={}, message={}", ctx.getType(), ctx.entrypointKey(), ctx.getMessageId());
        }
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
