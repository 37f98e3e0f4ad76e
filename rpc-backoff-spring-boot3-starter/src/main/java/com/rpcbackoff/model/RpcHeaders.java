package com.rpcbackoff.model;

public final class RpcHeaders {

    /** 已重投递次数, 首次投递无此header */
    public static final String RETRY_COUNT = "x-retry-count";

    /** 之前各次投递的 Backoff 记录(JSON) */
    public static final String BACKOFF_HISTORY = "x-backoff-history";

    private static final String REQUEST_QUEUE_PREFIX = "rpc-";

    private RpcHeaders() {}

    public static String requestQueue(String service) {
        return REQUEST_QUEUE_PREFIX + service;
    }
}
