package com.rpcbackoff.transport;

import com.rpcbackoff.core.spi.MessageHandler;
import com.rpcbackoff.core.spi.RpcTransport;
import com.rpcbackoff.model.RpcMessage;
import com.rpcbackoff.model.WheelTask;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * 进程内传输
 * 每个请求队列独占一个消费线程池, 服务之间的嵌套调用不会互相占满线程;
 * 回复队列的消费者只完成 future, 直接在发布线程上执行.
 * 延迟投递挂在 Netty 时间轮上, 不占用任何工作线程.
 * 无消费者的队列先缓存, 订阅后按顺序投递; 已取消订阅的队列直接丢弃
 */
@Slf4j
public class LocalRpcTransport implements RpcTransport {

    /** 消费线程池饱和时, 重投递在时间轮上顺延的时长 */
    static final long SATURATED_RETRY_MS = 50;

    /** 当前线程正在执行时间轮上的重投递 */
    private static final ThreadLocal<Boolean> ON_TIMER = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final HashedWheelTimer timer;

    private final Function<String, ExecutorService> executorFactory;

    private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();

    private final Map<String, ExecutorService> queueExecutors = new ConcurrentHashMap<>();

    /** 创建过的全部线程池, 关闭时统一等待 */
    private final List<ExecutorService> executors = new CopyOnWriteArrayList<>();

    private final Set<String> replyQueues = ConcurrentHashMap.newKeySet();

    private final Set<String> closedQueues = ConcurrentHashMap.newKeySet();

    private final Map<String, Queue<RpcMessage>> pending = new ConcurrentHashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(true);

    /**
     * @param executorFactory 按队列名创建消费线程池
     */
    public LocalRpcTransport(HashedWheelTimer timer, Function<String, ExecutorService> executorFactory) {
        this.timer = timer;
        this.executorFactory = executorFactory;
    }

    @Override
    public void subscribe(String queue, MessageHandler handler) {
        Queue<RpcMessage> buffered;
        synchronized (this) {
            if (handlers.putIfAbsent(queue, handler) != null) {
                throw new IllegalStateException("queue " + queue + " already has a consumer");
            }
            closedQueues.remove(queue);
            if (!replyQueues.contains(queue)) {
                ExecutorService executor = executorFactory.apply(queue);
                queueExecutors.put(queue, executor);
                executors.add(executor);
            }
            buffered = pending.remove(queue);
        }
        if (buffered != null) {
            log.debug("[Transport] queue={} subscribed, {} buffered message(s) delivered", queue, buffered.size());
            buffered.forEach(m -> deliver(queue, handler, m));
        }
    }

    @Override
    public void subscribeReplies(String queue, MessageHandler handler) {
        replyQueues.add(queue);
        try {
            subscribe(queue, handler);
        } catch (RuntimeException e) {
            replyQueues.remove(queue);
            throw e;
        }
    }

    /**
     * 取消订阅, 缓存的消息一并丢弃, 之后发往该队列的消息不再保留
     */
    @Override
    public void unsubscribe(String queue) {
        Queue<RpcMessage> dropped;
        ExecutorService executor;
        synchronized (this) {
            handlers.remove(queue);
            replyQueues.remove(queue);
            closedQueues.add(queue);
            dropped = pending.remove(queue);
            executor = queueExecutors.remove(queue);
        }
        if (executor != null) {
            // 在途消息继续处理完
            executor.shutdown();
        }
        if (dropped != null && !dropped.isEmpty()) {
            log.debug("[Transport] queue={} unsubscribed, {} buffered message(s) discarded", queue, dropped.size());
        }
    }

    @Override
    public void publish(String queue, RpcMessage message) {
        ensureRunning();
        MessageHandler handler = handlers.get(queue);
        if (handler == null) {
            synchronized (this) {
                handler = handlers.get(queue);
                if (handler == null) {
                    if (closedQueues.contains(queue)) {
                        log.debug("[Transport] queue={} is closed, message id={} discarded", queue, message.getMessageId());
                        return;
                    }
                    pending.computeIfAbsent(queue, k -> new ArrayDeque<>()).add(message);
                    log.debug("[Transport] queue={} has no consumer, message id={} buffered", queue, message.getMessageId());
                    return;
                }
            }
        }
        deliver(queue, handler, message);
    }

    @Override
    public void publishDelayed(String queue, RpcMessage message, Duration delay) {
        ensureRunning();
        long ms = Math.max(0, delay.toMillis());
        // 时间轮满或已停止时 newTimeout 直接抛出
        timer.newTimeout(new WheelTask(queue, message, () -> redeliver(queue, message)), ms, TimeUnit.MILLISECONDS);
    }

    /** 时间轮上尚未到期的重投递 */
    public long pendingRedeliveries() {
        return timer.pendingTimeouts();
    }

    /** 无消费者而缓存的消息数 */
    public int bufferedMessages(String queue) {
        synchronized (this) {
            Queue<RpcMessage> buffered = pending.get(queue);
            return buffered == null ? 0 : buffered.size();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 停止接收, 丢弃未到期的重投递, 等待在途消费完成
     */
    public void close(Duration await) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Set<Timeout> dropped = timer.stop();
        if (!dropped.isEmpty()) {
            log.warn("[Transport] {} delayed redelivery(ies) dropped on close", dropped.size());
        }
        executors.forEach(ExecutorService::shutdown);
        long deadline = System.nanoTime() + await.toNanos();
        try {
            for (ExecutorService executor : executors) {
                long left = Math.max(0, deadline - System.nanoTime());
                if (!executor.awaitTermination(left, TimeUnit.NANOSECONDS)) {
                    log.warn("[Transport] consumers still busy after {} ms, forcing shutdown", await.toMillis());
                    executor.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executors.forEach(ExecutorService::shutdownNow);
        }
    }

    private void redeliver(String queue, RpcMessage message) {
        if (!running.get()) {
            log.warn("[Transport] transport closed, redelivery of message id={} to {} dropped", message.getMessageId(), queue);
            return;
        }
        ON_TIMER.set(Boolean.TRUE);
        try {
            publish(queue, message);
        } catch (RejectedExecutionException e) {
            defer(queue, message);
        } finally {
            ON_TIMER.remove();
        }
    }

    /**
     * 线程池满时不在时间轮线程上执行 entrypoint, 顺延后再投递
     */
    private void defer(String queue, RpcMessage message) {
        log.warn("[Transport] consumers of queue={} saturated, redelivery of message id={} deferred {} ms",
                queue, message.getMessageId(), SATURATED_RETRY_MS);
        try {
            timer.newTimeout(new WheelTask(queue, message, () -> redeliver(queue, message)),
                    SATURATED_RETRY_MS, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            log.error("[Transport] redelivery of message id={} to {} could not be deferred", message.getMessageId(), queue, e);
            throw e;
        }
    }

    private void deliver(String queue, MessageHandler handler, RpcMessage message) {
        if (replyQueues.contains(queue)) {
            consume(queue, handler, message);
            return;
        }
        ExecutorService executor = queueExecutors.get(queue);
        if (executor == null) {
            log.debug("[Transport] queue={} unsubscribed meanwhile, message id={} discarded", queue, message.getMessageId());
            return;
        }
        executor.execute(() -> {
            if (ON_TIMER.get()) {
                // CALLER_RUNS 把任务退回到了时间轮线程
                defer(queue, message);
                return;
            }
            consume(queue, handler, message);
        });
    }

    private void consume(String queue, MessageHandler handler, RpcMessage message) {
        try {
            handler.onMessage(message);
        } catch (RuntimeException e) {
            log.error("[Transport] consumer of queue={} failed on message id={}", queue, message.getMessageId(), e);
            throw e;
        }
    }

    private void ensureRunning() {
        if (!running.get()) {
            throw new IllegalStateException("transport is closed");
        }
    }
}
