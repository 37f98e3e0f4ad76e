package com.rpcbackoff.core.dispatch;

import com.rpcbackoff.core.entrypoint.EntrypointRegistry;
import com.rpcbackoff.core.entrypoint.RpcEntrypoint;
import com.rpcbackoff.core.metric.RpcBackoffMetrics;
import com.rpcbackoff.core.notify.NotifyContexts;
import com.rpcbackoff.core.notify.NotifyingFacade;
import com.rpcbackoff.core.spi.MessageHandler;
import com.rpcbackoff.core.spi.PayloadSerializer;
import com.rpcbackoff.exception.IncorrectSignatureException;
import com.rpcbackoff.model.RpcMessage;
import com.rpcbackoff.model.enums.Severity;
import lombok.extern.slf4j.Slf4j;

/**
 * 一个服务队列的消费者
 * 查找 entrypoint, 解码参数, 交给 BackoffDispatcher;
 * 这之前的错误(方法不存在/参数不匹配等)不进入退避流程, 直接以错误响应返回
 */
@Slf4j
public class RpcConsumer implements MessageHandler {

    private static final Object[] NO_ARGS = new Object[0];

    private final String service;

    private final EntrypointRegistry registry;

    private final PayloadSerializer serializer;

    private final BackoffDispatcher dispatcher;

    private final RpcResponder responder;

    private final RpcBackoffMetrics metrics;

    private final NotifyingFacade notifier;

    public RpcConsumer(String service, EntrypointRegistry registry, PayloadSerializer serializer,
                       BackoffDispatcher dispatcher, RpcResponder responder,
                       RpcBackoffMetrics metrics, NotifyingFacade notifier) {
        this.service = service;
        this.registry = registry;
        this.serializer = serializer;
        this.dispatcher = dispatcher;
        this.responder = responder;
        this.metrics = metrics;
        this.notifier = notifier;
    }

    @Override
    public void onMessage(RpcMessage message) {
        try {
            handleMessage(message);
        } catch (Exception e) {
            log.error("[Dispatch] service={} message id={} method={} could not be handled",
                    service, message.getMessageId(), message.getRoutingKey(), e);
            metrics.incEngineErr();
            notifier.fire(NotifyContexts.ctxForEngineError(service, message.getMessageId(), e), Severity.ERROR);
            responder.replyError(message, e);
        } catch (Error e) {
            // 调用方仍需收到终态响应, Error 本身继续向上抛
            log.error("[Dispatch] service={} message id={} method={} failed with fatal error",
                    service, message.getMessageId(), message.getRoutingKey(), e);
            metrics.incEngineErr();
            try {
                responder.replyError(message, e);
            } catch (RuntimeException replyFailure) {
                e.addSuppressed(replyFailure);
            }
            throw e;
        }
    }

    protected void handleMessage(RpcMessage message) {
        RpcEntrypoint ep = registry.get(service, message.getRoutingKey());
        dispatcher.dispatch(ep, message, decode(ep, message));
    }

    Object[] decode(RpcEntrypoint ep, RpcMessage message) {
        String payload = message.getPayload();
        if (payload == null || payload.isBlank()) {
            if (ep.getPayloadTypes().length == 0) {
                return NO_ARGS;
            }
            throw new IncorrectSignatureException(ep.key() + " expects " + ep.getPayloadTypes().length
                    + " argument(s), got none", null);
        }
        try {
            return serializer.deserializeArgs(payload, ep.getPayloadTypes());
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IncorrectSignatureException(ep.key() + ": " + e.getMessage(), e);
        }
    }

    public String getService() {
        return service;
    }
}
