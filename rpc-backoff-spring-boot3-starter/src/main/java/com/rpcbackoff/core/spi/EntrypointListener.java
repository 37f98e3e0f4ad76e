package com.rpcbackoff.core.spi;

import com.rpcbackoff.model.ctx.DispatchContext;

/**
 * 每次 entrypoint 执行结束回调(包括触发退避的执行)
 * 退避的执行 result 为 null, error 为 Backoff; 耗尽的那次 error 为 Backoff.Expired
 */
public interface EntrypointListener {

    void onExecution(DispatchContext ctx, Object result, Throwable error);
}
