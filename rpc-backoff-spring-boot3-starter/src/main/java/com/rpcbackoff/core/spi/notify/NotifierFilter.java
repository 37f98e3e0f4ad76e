package com.rpcbackoff.core.spi.notify;

import com.rpcbackoff.model.ctx.NotifyContext;
import com.rpcbackoff.model.enums.Severity;

/**
 * 过滤器：限流、去抖等
 */
public interface NotifierFilter {

    /**
     * 返回 true 表示放行，false 表示丢弃/抑制
     */
    boolean allow(NotifyContext ctx, Severity severity);
}
