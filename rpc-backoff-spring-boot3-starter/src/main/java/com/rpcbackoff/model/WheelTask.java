package com.rpcbackoff.model;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 本地时间轮上的`重投递`任务封装
 * 让时间轮返回的 Timeout 能识别消息信息
 */
public class WheelTask implements TimerTask {

    private final String queue;

    private final RpcMessage message;

    /** 真正要执行的逻辑 */
    private final Runnable actual;

    public WheelTask(String queue, RpcMessage message, Runnable actual) {
        this.queue = queue;
        this.message = message;
        this.actual = actual;
    }

    @Override
    public void run(Timeout timeout) throws Exception {
        if (timeout.isCancelled()) {
            return;
        }
        actual.run();
    }

    public String getQueue() {
        return queue;
    }

    public RpcMessage getMessage() {
        return message;
    }
}
