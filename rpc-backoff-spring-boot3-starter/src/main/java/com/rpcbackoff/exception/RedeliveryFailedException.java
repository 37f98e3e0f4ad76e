package com.rpcbackoff.exception;

/**
 * 延迟重投递本身失败(传输层拒绝/已停止)
 * 作为当前这次投递的非预期失败返回给调用方, 避免调用方一直等待
 */
public class RedeliveryFailedException extends RuntimeException {

    public RedeliveryFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
