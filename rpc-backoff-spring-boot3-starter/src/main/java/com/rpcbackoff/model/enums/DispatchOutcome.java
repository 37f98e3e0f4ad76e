package com.rpcbackoff.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 一次投递的分发结果
 */
@AllArgsConstructor
@Getter
public enum DispatchOutcome {
    SUCCEEDED(true, "正常返回，终态"),
    EXPECTED_FAILURE(true, "声明过的业务异常，终态"),
    UNEXPECTED_FAILURE(true, "未声明异常，终态"),
    RESCHEDULED(false, "已安排延迟重投递，不响应调用方"),
    EXPIRED(true, "重试次数耗尽，终态"),
    ;

    public final boolean terminal;
    public final String desc;
}
