package com.rpcbackoff.support;

import com.rpcbackoff.core.spi.EntrypointListener;
import com.rpcbackoff.model.ctx.DispatchContext;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 记录每次 entrypoint 执行的结果/异常
 */
public class EntrypointTracker implements EntrypointListener {

    @Value
    public static class Execution {
        String entrypoint;
        int attempt;
        Object result;
        Throwable error;
    }

    private final List<Execution> executions = new CopyOnWriteArrayList<>();

    @Override
    public void onExecution(DispatchContext ctx, Object result, Throwable error) {
        executions.add(new Execution(ctx.entrypointKey(), ctx.getAttempt(), result, error));
    }

    public List<Execution> executions(String entrypoint) {
        List<Execution> out = new ArrayList<>();
        for (Execution e : executions) {
            if (e.getEntrypoint().equals(entrypoint)) {
                out.add(e);
            }
        }
        return out;
    }

    public List<Object> results(String entrypoint) {
        List<Object> out = new ArrayList<>();
        executions(entrypoint).forEach(e -> out.add(e.getResult()));
        return out;
    }

    public List<Class<?>> errorTypes(String entrypoint) {
        List<Class<?>> out = new ArrayList<>();
        executions(entrypoint).forEach(e -> out.add(e.getError() == null ? null : e.getError().getClass()));
        return out;
    }

    public void clear() {
        executions.clear();
    }
}
