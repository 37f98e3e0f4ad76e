package com.rpcbackoff.exception.guard;

/**
 * 异常类型
 * 作为 Backoff 的根因, 标记 系统性故障
 */
public class DownstreamOpenCircuitException extends RuntimeException {

    public DownstreamOpenCircuitException(Throwable cause) {
        super("downstream circuit open", cause);
    }
}
