package com.rpcbackoff.exception;

/**
 * 请求参数与 entrypoint 签名不匹配(个数/类型)
 */
public class IncorrectSignatureException extends RuntimeException {

    public IncorrectSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
