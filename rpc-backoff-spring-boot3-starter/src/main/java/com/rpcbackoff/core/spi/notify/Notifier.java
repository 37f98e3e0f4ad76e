package com.rpcbackoff.core.spi.notify;

import com.rpcbackoff.model.ctx.NotifyContext;
import com.rpcbackoff.model.enums.Severity;

/**
 * 告警通知器（退避耗尽/重投递失败等）
 */
public interface Notifier {

    /**
     * 返回此Notifier支持的渠道/名称, 用于路由日志与指标纬度
     */
    String name();

    /**
     * 能否处理此事件, 粗粒度过滤
     */
    default boolean supports(NotifyContext ctx) {
        return true;
    }

    /**
     * 派发通知, 同步方法 框架层负责异步调用
     */
    void notify(NotifyContext ctx, Severity severity);

}
