package com.rpcbackoff.model.ctx;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 单次投递的上下文
 * entrypoint 方法声明该类型参数时会被注入
 */
@Data
@Builder
public class DispatchContext {

    private String service;
    private String method;
    private String messageId;
    private String correlationId;
    private Map<String, Object> headers;
    /** 当前第几次投递, 首次为0 */
    private int attempt;
    /** <=0 表示不限 */
    private int maxAttempts;

    public String entrypointKey() {
        return service + "." + method;
    }
}
