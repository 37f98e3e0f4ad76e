package com.rpcbackoff.core.notify;

import com.rpcbackoff.model.ctx.NotifyContext;
import com.rpcbackoff.model.enums.Severity;
import org.springframework.beans.factory.ObjectProvider;

import java.util.function.Supplier;

public class NotifyingFacade {
    private final Supplier<AsyncNotifyingService> delegate;

    public NotifyingFacade(ObjectProvider<AsyncNotifyingService> p) {
        // 未启用notify则为 null
        this((Supplier<AsyncNotifyingService>) p::getIfAvailable);
    }

    public NotifyingFacade(Supplier<AsyncNotifyingService> delegate) {
        this.delegate = delegate;
    }

    public static NotifyingFacade noop() {
        Supplier<AsyncNotifyingService> none = () -> null;
        return new NotifyingFacade(none);
    }

    public void fire(NotifyContext ctx, Severity sev) {
        AsyncNotifyingService s = delegate.get();
        if (s != null) s.fire(ctx, sev);
    }
}
