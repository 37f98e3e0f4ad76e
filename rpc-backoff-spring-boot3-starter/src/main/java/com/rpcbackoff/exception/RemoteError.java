package com.rpcbackoff.exception;

import lombok.Getter;

/**
 * 调用方收到的远端错误
 */
@Getter
public class RemoteError extends RuntimeException {

    /** 远端异常简单类名, 如 Expired */
    private final String excType;

    /** 远端异常全限定名 */
    private final String excPath;

    private final String excMessage;

    public RemoteError(String excType, String excPath, String excMessage) {
        super(excMessage == null ? excType : excType + " " + excMessage);
        this.excType = excType;
        this.excPath = excPath;
        this.excMessage = excMessage;
    }
}
