package com.rpcbackoff.core.notify.route;

import com.rpcbackoff.core.spi.notify.Notifier;
import com.rpcbackoff.core.spi.notify.NotifierRouter;
import com.rpcbackoff.model.ctx.NotifyContext;
import com.rpcbackoff.model.enums.Severity;

import java.util.List;

/**
 * 简单路由
 * 所有事件发给全部已注册的通知器
 */
public class SimpleRouter implements NotifierRouter {

    private final List<Notifier> notifiers;

    public SimpleRouter(List<Notifier> notifiers) {
        this.notifiers = List.copyOf(notifiers);
    }

    @Override
    public List<Notifier> route(NotifyContext ctx, Severity severity) {
        return notifiers;
    }
}
