package com.rpcbackoff.core.spi;

import com.rpcbackoff.model.RpcMessage;

import java.time.Duration;

/**
 * 消息传输(外部协作方)
 * 至少一次投递, header 原样往返
 */
public interface RpcTransport {

    /** 订阅队列, 同一队列只允许一个消费者 */
    void subscribe(String queue, MessageHandler handler);

    /**
     * 订阅回复队列
     * 回复消费者只完成等待中的调用, 传输层可以不经过请求消费线程池直接执行
     */
    default void subscribeReplies(String queue, MessageHandler handler) {
        subscribe(queue, handler);
    }

    void unsubscribe(String queue);

    /** 立即投递 */
    void publish(String queue, RpcMessage message);

    /**
     * 延迟投递, 不得阻塞调用线程
     * 无法安排时直接抛出异常
     */
    void publishDelayed(String queue, RpcMessage message, Duration delay);
}
