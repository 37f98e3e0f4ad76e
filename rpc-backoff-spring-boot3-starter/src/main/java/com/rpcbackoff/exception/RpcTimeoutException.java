package com.rpcbackoff.exception;

/**
 * 调用方等待超时
 * 不会取消服务端仍在进行的退避重试
 */
public class RpcTimeoutException extends RuntimeException {

    public RpcTimeoutException(String message) {
        super(message);
    }
}
