package com.rpcbackoff.exception;

import com.rpcbackoff.model.BackoffTrace;

/**
 * 之前某次投递中的 Backoff 记录, 仅用于诊断输出
 */
public class PriorAttemptException extends RuntimeException {

    private final BackoffTrace trace;

    public PriorAttemptException(BackoffTrace trace) {
        super(trace.describe(), null, false, false);
        this.trace = trace;
    }

    public BackoffTrace getTrace() {
        return trace;
    }
}
