package com.rpcbackoff.core.dispatch;

import com.rpcbackoff.core.spi.PayloadSerializer;
import com.rpcbackoff.core.spi.RpcTransport;
import com.rpcbackoff.model.RpcMessage;
import com.rpcbackoff.model.RpcResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * 把终态结果回投到请求的 replyTo 队列
 * 无 replyTo 的请求(单向调用)不回复
 */
@Slf4j
public class RpcResponder {

    private final RpcTransport transport;

    private final PayloadSerializer serializer;

    public RpcResponder(RpcTransport transport, PayloadSerializer serializer) {
        this.transport = transport;
        this.serializer = serializer;
    }

    public void replyResult(RpcMessage request, Object result) {
        String payload;
        try {
            payload = serializer.serialize(RpcResponse.success(result));
        } catch (IllegalStateException e) {
            // 结果无法序列化, 以错误响应返回
            log.error("[Dispatch] result of message id={} is not serializable", request.getMessageId(), e);
            payload = serializer.serialize(RpcResponse.failure(e));
        }
        send(request, payload);
    }

    public void replyError(RpcMessage request, Throwable error) {
        send(request, serializer.serialize(RpcResponse.failure(error)));
    }

    private void send(RpcMessage request, String payload) {
        if (request.getReplyTo() == null) {
            log.debug("[Dispatch] message id={} has no reply-to, response dropped", request.getMessageId());
            return;
        }
        RpcMessage reply = RpcMessage.builder()
                .messageId(UUID.randomUUID().toString())
                .correlationId(request.getCorrelationId())
                .payload(payload)
                .build();
        transport.publish(request.getReplyTo(), reply);
    }
}
