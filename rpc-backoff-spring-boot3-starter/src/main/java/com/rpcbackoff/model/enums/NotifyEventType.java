package com.rpcbackoff.model.enums;

/**
 * 通知事件
 */
public enum NotifyEventType {
    /** 退避次数耗尽 */
    BACKOFF_EXPIRED,

    /** 延迟重投递发布失败 */
    REDELIVERY_FAILED,

    /** entrypoint 未声明异常 */
    UNEXPECTED_FAILURE,

    /** 框架级异常（消费者/传输层） */
    ENGINE_ERROR
}
