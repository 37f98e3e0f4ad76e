package com.rpcbackoff.transport;

import com.rpcbackoff.core.spi.PayloadSerializer;
import com.rpcbackoff.core.spi.RpcTransport;
import com.rpcbackoff.exception.RemoteError;
import com.rpcbackoff.exception.RpcTimeoutException;
import com.rpcbackoff.model.RpcError;
import com.rpcbackoff.model.RpcHeaders;
import com.rpcbackoff.model.RpcMessage;
import com.rpcbackoff.model.RpcResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * RPC 调用方
 * 每个实例独占一个回复队列, 按 correlationId 匹配响应.
 * 只有终态响应会到达; 超时不会取消服务端的退避重试
 */
@Slf4j
public class RpcClient implements AutoCloseable {

    private final RpcTransport transport;

    private final PayloadSerializer serializer;

    private final Duration timeout;

    private final String replyQueue;

    private final Map<String, CompletableFuture<RpcResponse>> inflight = new ConcurrentHashMap<>();

    public RpcClient(RpcTransport transport, PayloadSerializer serializer, Duration timeout) {
        this.transport = transport;
        this.serializer = serializer;
        this.timeout = timeout;
        this.replyQueue = "rpc.reply-" + UUID.randomUUID();
        transport.subscribeReplies(replyQueue, this::onReply);
    }

    public Object call(String service, String method, Object... args) {
        return await(callAsync(service, method, args));
    }

    public <T> T call(Class<T> resultType, String service, String method, Object... args) {
        return serializer.convert(call(service, method, args), resultType);
    }

    public CompletableFuture<Object> callAsync(String service, String method, Object... args) {
        String correlationId = UUID.randomUUID().toString();
        CompletableFuture<RpcResponse> raw = new CompletableFuture<>();
        inflight.put(correlationId, raw);
        raw.whenComplete((r, e) -> inflight.remove(correlationId));

        List<Object> payload = args == null ? List.of() : Arrays.asList(args);
        RpcMessage request = RpcMessage.builder()
                .messageId(UUID.randomUUID().toString())
                .correlationId(correlationId)
                .replyTo(replyQueue)
                .routingKey(method)
                .payload(serializer.serialize(payload))
                .build();
        try {
            transport.publish(RpcHeaders.requestQueue(service), request);
        } catch (RuntimeException e) {
            inflight.remove(correlationId);
            throw e;
        }

        return raw.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, err) -> {
                    if (err != null) {
                        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                        if (cause instanceof TimeoutException) {
                            throw new RpcTimeoutException(service + "." + method + " got no reply within "
                                    + timeout.toMillis() + " ms");
                        }
                        throw cause instanceof RuntimeException re ? re : new CompletionException(cause);
                    }
                    return unwrap(response);
                });
    }

    public ServiceProxy proxy(String service) {
        return new ServiceProxy(service);
    }

    @Override
    public void close() {
        transport.unsubscribe(replyQueue);
        inflight.values().forEach(f -> f.completeExceptionally(new IllegalStateException("rpc client closed")));
    }

    public String getReplyQueue() {
        return replyQueue;
    }

    private void onReply(RpcMessage message) {
        CompletableFuture<RpcResponse> future = inflight.get(message.getCorrelationId());
        if (future == null) {
            // 已超时或不属于本客户端
            log.debug("[Transport] reply for unknown correlation id={} dropped", message.getCorrelationId());
            return;
        }
        try {
            future.complete(serializer.deserialize(message.getPayload(), RpcResponse.class));
        } catch (IllegalStateException e) {
            future.completeExceptionally(e);
        }
    }

    private Object unwrap(RpcResponse response) {
        if (response == null) {
            return null;
        }
        if (response.isError()) {
            RpcError e = response.getError();
            throw new RemoteError(e.getExcType(), e.getExcPath(), e.getExcMessage());
        }
        return response.getResult();
    }

    private static Object await(CompletableFuture<Object> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for rpc reply", e);
        }
    }

    /**
     * 绑定到某个服务的调用入口
     */
    public final class ServiceProxy {

        private final String service;

        private ServiceProxy(String service) {
            this.service = service;
        }

        public Object call(String method, Object... args) {
            return RpcClient.this.call(service, method, args);
        }

        public CompletableFuture<Object> callAsync(String method, Object... args) {
            return RpcClient.this.callAsync(service, method, args);
        }

        public String getService() {
            return service;
        }
    }
}
