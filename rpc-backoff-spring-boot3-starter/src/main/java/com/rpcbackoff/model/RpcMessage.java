package com.rpcbackoff.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 消息信封
 * payload 为调用参数(JSON), headers 承载重试元数据, 对传输层不透明
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class RpcMessage {

    private final String messageId;

    /** 请求/响应关联id */
    private final String correlationId;

    /** 响应回投的队列 */
    private final String replyTo;

    /** 请求为方法名, 响应为空 */
    private final String routingKey;

    private final String payload;

    @Builder.Default
    private final Map<String, Object> headers = Map.of();

    public Object header(String name) {
        return headers == null ? null : headers.get(name);
    }

    /**
     * 返回新消息, 只替换/追加给定header, 其余内容不变
     */
    public RpcMessage withHeader(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(headers == null ? Map.of() : headers);
        copy.put(name, value);
        return toBuilder().headers(Collections.unmodifiableMap(copy)).build();
    }
}
