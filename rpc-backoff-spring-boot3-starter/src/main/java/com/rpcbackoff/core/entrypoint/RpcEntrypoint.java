package com.rpcbackoff.core.entrypoint;

import com.rpcbackoff.core.backoff.BackoffSettings;
import com.rpcbackoff.model.RpcHeaders;
import com.rpcbackoff.model.ctx.DispatchContext;
import lombok.Getter;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 已注册的 entrypoint
 * expectedExceptions 已并入 Backoff, settings 已解析, 注册后不再变化
 */
@Getter
public class RpcEntrypoint {

    private final String service;

    private final String method;

    private final Object bean;

    private final Method target;

    private final Set<Class<? extends Throwable>> expectedExceptions;

    private final BackoffSettings settings;

    /** 需要从payload解码的参数类型(不含 DispatchContext) */
    private final Type[] payloadTypes;

    /** DispatchContext 参数下标, -1 表示无 */
    private final int contextIndex;

    public RpcEntrypoint(String service, String method, Object bean, Method target,
                         Set<Class<? extends Throwable>> expectedExceptions, BackoffSettings settings) {
        this.service = service;
        this.method = method;
        this.bean = bean;
        this.target = target;
        this.expectedExceptions = Set.copyOf(expectedExceptions);
        this.settings = settings;

        int ctxIdx = -1;
        List<Type> types = new ArrayList<>();
        Class<?>[] raw = target.getParameterTypes();
        Type[] generic = target.getGenericParameterTypes();
        for (int i = 0; i < raw.length; i++) {
            if (DispatchContext.class.equals(raw[i])) {
                ctxIdx = i;
            } else {
                types.add(generic[i]);
            }
        }
        this.contextIndex = ctxIdx;
        this.payloadTypes = types.toArray(new Type[0]);
    }

    public String key() {
        return service + "." + method;
    }

    public String queue() {
        return RpcHeaders.requestQueue(service);
    }

    /**
     * 是否为声明过的预期异常(Backoff 恒为真)
     */
    public boolean isExpected(Class<? extends Throwable> type) {
        return matchExpected(type).isPresent();
    }

    /**
     * 同类型匹配时选择离异常类最近的声明
     */
    public Optional<Class<? extends Throwable>> matchExpected(Class<? extends Throwable> type) {
        return expectedExceptions.stream()
                .filter(e -> e.isAssignableFrom(type))
                .min(Comparator.comparingInt(e -> distance(type, e)));
    }

    /**
     * 解码后的参数 + 上下文 合成实际调用参数
     */
    public Object[] arguments(Object[] decoded, DispatchContext ctx) {
        if (contextIndex < 0) {
            return decoded;
        }
        Object[] full = new Object[decoded.length + 1];
        for (int i = 0, j = 0; i < full.length; i++) {
            full[i] = i == contextIndex ? ctx : decoded[j++];
        }
        return full;
    }

    /**
     * 反射调用, 抛出方法自身的异常
     */
    public Object invoke(Object[] args) throws Exception {
        try {
            return target.invoke(bean, args);
        } catch (InvocationTargetException e) {
            Throwable t = e.getTargetException();
            if (t instanceof Exception ex) {
                throw ex;
            }
            if (t instanceof Error err) {
                throw err;
            }
            throw new UndeclaredThrowableException(t);
        }
    }

    private static int distance(Class<?> from, Class<?> to) {
        // 计算from向上继承到to的距离
        int d = 0;
        Class<?> c = from;
        while (c != null && !to.equals(c)) {
            c = c.getSuperclass();
            ++ d;
        }
        return (c == null) ? Integer.MAX_VALUE : d;
    }

    @Override
    public String toString() {
        return "RpcEntrypoint{" + key() + ", expected=" + expectedExceptions.size() + ", " + settings + "}";
    }
}
