package com.rpcbackoff.core;

import com.rpcbackoff.config.RpcBackoffProperties;
import com.rpcbackoff.config.RpcNotifierProperties;
import com.rpcbackoff.core.dispatch.RpcConsumer;
import com.rpcbackoff.core.entrypoint.EntrypointRegistry;
import com.rpcbackoff.core.spi.RpcTransport;
import com.rpcbackoff.model.RpcHeaders;
import com.rpcbackoff.transport.LocalRpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * 每个已注册服务订阅一个请求队列, 停止时退订并关闭本地传输
 */
public class RpcBackoffLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(RpcBackoffLifecycle.class);

    private final EntrypointRegistry registry;

    private final RpcTransport transport;

    private final Function<String, RpcConsumer> consumerFactory;

    private final RpcBackoffProperties props;

    private final RpcNotifierProperties notifyProps;

    private final List<String> subscribed = new ArrayList<>();

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RpcBackoffLifecycle(EntrypointRegistry registry, RpcTransport transport,
                               Function<String, RpcConsumer> consumerFactory,
                               RpcBackoffProperties props, RpcNotifierProperties notifyProps) {
        this.registry = registry;
        this.transport = transport;
        this.consumerFactory = consumerFactory;
        this.props = props;
        this.notifyProps = notifyProps;
    }

    @Override
    public void start() {
        if (!props.isEnabled()) {
            log.info("[RpcBackoff] start skipped, consumers disabled");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        // 打印关键启动信息
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ RpcBackoff starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ services              : {}", registry.services());
            log.info("│ transport             : {}", transport.getClass().getSimpleName());
            log.info("│ backoff.strategy      : {}", props.getBackoff().getStrategy());
            log.info("│ backoff.schedule      : {}", props.getBackoff().getSchedule());
            log.info("│ backoff.maxDelay      : {} ms", props.backoffMaxMillis());
            log.info("│ defaultMaxAttempts    : {}", props.getDefaultMaxAttempts());
            log.info("│ props.wheel.tick      : {} ms", props.wheelTickMillis());
            log.info("│ props.wheel.size      : {}", props.getWheel().getTicksPerWheel());
            log.info("│ props.exec.core       : {}", props.getExecutor().getCorePoolSize());
            log.info("│ props.exec.max        : {}", props.getExecutor().getMaxPoolSize());
            log.info("│ notifier.enabled      : {}", notifyProps.isEnabled());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (RuntimeException t) {
            // 启动日志打印本身不应阻断启动
            log.warn("[RpcBackoff] failed to render startup banner: {}", t.toString());
        }
        for (String service : registry.services()) {
            String queue = RpcHeaders.requestQueue(service);
            transport.subscribe(queue, consumerFactory.apply(service));
            subscribed.add(queue);
        }
        log.info("[RpcBackoff] started, consuming {}", subscribed);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[RpcBackoff] stop skipped: not running");
            return;
        }
        log.info("[RpcBackoff] stopping...");
        try {
            subscribed.forEach(transport::unsubscribe);
            subscribed.clear();
            if (transport instanceof LocalRpcTransport local) {
                local.close(props.getShutdown().getAwait());
            }
        } finally {
            log.info("[RpcBackoff] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
