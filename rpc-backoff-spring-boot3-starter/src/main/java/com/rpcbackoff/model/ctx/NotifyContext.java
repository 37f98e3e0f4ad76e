package com.rpcbackoff.model.ctx;

import com.rpcbackoff.model.enums.NotifyEventType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * 事件上下文
 */
@Getter
@Builder
@ToString
public class NotifyContext {

    private final NotifyEventType type;
    private final String service;
    private final String method;
    private final String messageId;
    private final Integer attempt;
    private final Integer maxAttempts;
    // 自定义分类码，如 MAX_ATTEMPTS/PUBLISH_FAILED
    private final String reasonCode;
    // 可被截断
    private final String lastError;
    private final Instant when;
    // 额外字段：correlationId、delay 等
    private final Map<String, Object> attributes;

    public String entrypointKey() {
        return service + "." + method;
    }
}
