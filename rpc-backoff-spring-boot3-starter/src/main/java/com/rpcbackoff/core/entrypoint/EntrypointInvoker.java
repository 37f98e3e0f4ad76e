package com.rpcbackoff.core.entrypoint;

import com.rpcbackoff.core.handler.GuardedEntrypointExecutor;
import com.rpcbackoff.exception.Backoff;
import com.rpcbackoff.model.InvocationResult;
import org.springframework.lang.Nullable;

/**
 * 执行 entrypoint 并分类结果
 * Backoff 优先, 其次是声明的预期异常, 其余为非预期
 */
public class EntrypointInvoker {

    @Nullable
    private final GuardedEntrypointExecutor guard;

    public EntrypointInvoker(@Nullable GuardedEntrypointExecutor guard) {
        this.guard = guard;
    }

    public InvocationResult invoke(RpcEntrypoint ep, Object[] args) {
        long start = System.nanoTime();
        try {
            Object value = guard == null
                    ? ep.invoke(args)
                    : guard.execute(ep.key(), () -> ep.invoke(args));
            return InvocationResult.success(value, System.nanoTime() - start);
        } catch (Backoff b) {
            return InvocationResult.backoff(b, System.nanoTime() - start);
        } catch (VirtualMachineError fatal) {
            throw fatal;
        } catch (Throwable t) {
            long nanos = System.nanoTime() - start;
            return ep.isExpected(t.getClass())
                    ? InvocationResult.expected(t, nanos)
                    : InvocationResult.unexpected(t, nanos);
        }
    }
}
