package com.rpcbackoff.autoconfig;

import com.rpcbackoff.annotation.EnableRpcBackoff;
import com.rpcbackoff.config.RpcBackoffProperties;
import com.rpcbackoff.config.RpcNotifierProperties;
import com.rpcbackoff.core.RpcBackoffLifecycle;
import com.rpcbackoff.core.backoff.AttemptTracker;
import com.rpcbackoff.core.backoff.BackoffRegistry;
import com.rpcbackoff.core.backoff.BackoffScheduler;
import com.rpcbackoff.core.backoff.ExpiryPolicy;
import com.rpcbackoff.core.dispatch.BackoffDispatcher;
import com.rpcbackoff.core.dispatch.RpcConsumer;
import com.rpcbackoff.core.dispatch.RpcResponder;
import com.rpcbackoff.core.entrypoint.EntrypointInvoker;
import com.rpcbackoff.core.entrypoint.EntrypointRegistry;
import com.rpcbackoff.core.entrypoint.RpcEntrypointFactory;
import com.rpcbackoff.core.entrypoint.RpcEntrypointRegistrar;
import com.rpcbackoff.core.handler.GuardedEntrypointExecutor;
import com.rpcbackoff.core.metric.RpcBackoffMetrics;
import com.rpcbackoff.core.notify.NotifyingFacade;
import com.rpcbackoff.core.serializer.JacksonPayloadSerializer;
import com.rpcbackoff.core.spi.BackoffPolicy;
import com.rpcbackoff.core.spi.EntrypointListener;
import com.rpcbackoff.core.spi.PayloadSerializer;
import com.rpcbackoff.core.spi.RpcTransport;
import com.rpcbackoff.transport.LocalRpcTransport;
import com.rpcbackoff.transport.RpcClient;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮/本地传输/退避状态机/entrypoint 注册与消费
 */
@AutoConfiguration(after = {
        RpcBackoffMetricsAutoConfiguration.class,
        RpcNotifierAutoConfiguration.class,
        RpcGuardAutoConfiguration.class
})
@EnableConfigurationProperties({
        RpcBackoffProperties.class,
        RpcNotifierProperties.class
})
public class RpcBackoffAutoConfiguration {

    /**
     * 时间轮
     */
    @Bean(destroyMethod = "stop")
    public HashedWheelTimer rpcBackoffWheelTimer(RpcBackoffProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("rpc-backoff-wheel"),
                props.wheelTickMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * 默认进程内传输, 每个服务队列一个消费线程池
     */
    @Bean
    @ConditionalOnMissingBean(RpcTransport.class)
    public RpcTransport rpcTransport(HashedWheelTimer rpcBackoffWheelTimer, RpcBackoffProperties props) {
        return new LocalRpcTransport(rpcBackoffWheelTimer, queue -> consumerExecutor(props, queue));
    }

    static ExecutorService consumerExecutor(RpcBackoffProperties props, String queue) {
        RpcBackoffProperties.Exec exec = props.getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory("rpc-consumer-" + queue),
                exec.getRejectedHandler().toHandler()
        );
    }

    /**
     * 默认序列化
     */
    @Bean
    @ConditionalOnMissingBean(PayloadSerializer.class)
    public PayloadSerializer payloadSerializer() {
        return new JacksonPayloadSerializer();
    }

    /**
     * 策略注册中心
     */
    @Bean
    public BackoffRegistry backoffRegistry(RpcBackoffProperties props,
                                           @Autowired(required = false) List<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(props, discoveredPolicies);
    }

    @Bean
    public AttemptTracker attemptTracker(PayloadSerializer serializer) {
        return new AttemptTracker(serializer);
    }

    @Bean
    public BackoffScheduler backoffScheduler(BackoffRegistry registry, AttemptTracker tracker,
                                             RpcTransport transport, RpcBackoffProperties props) {
        return new BackoffScheduler(registry, tracker, transport, props.getHistoryLimit());
    }

    @Bean
    public ExpiryPolicy expiryPolicy(BackoffScheduler scheduler) {
        return new ExpiryPolicy(scheduler);
    }

    @Bean
    public EntrypointRegistry entrypointRegistry() {
        return new EntrypointRegistry();
    }

    @Bean
    public RpcEntrypointFactory rpcEntrypointFactory(RpcBackoffProperties props, BackoffRegistry registry) {
        return new RpcEntrypointFactory(props, registry);
    }

    /**
     * 扫描 @RpcService
     */
    @Bean
    public RpcEntrypointRegistrar rpcEntrypointRegistrar(EntrypointRegistry registry, RpcEntrypointFactory factory) {
        return new RpcEntrypointRegistrar(registry, factory);
    }

    @Bean
    public EntrypointInvoker entrypointInvoker(ObjectProvider<GuardedEntrypointExecutor> guard) {
        return new EntrypointInvoker(guard.getIfAvailable());
    }

    @Bean
    public RpcResponder rpcResponder(RpcTransport transport, PayloadSerializer serializer) {
        return new RpcResponder(transport, serializer);
    }

    /**
     * 退避状态机
     */
    @Bean
    public BackoffDispatcher backoffDispatcher(EntrypointInvoker invoker,
                                               AttemptTracker tracker,
                                               BackoffScheduler scheduler,
                                               ExpiryPolicy expiry,
                                               RpcResponder responder,
                                               ObjectProvider<EntrypointListener> listeners,
                                               RpcBackoffMetrics metrics,
                                               NotifyingFacade notifyingFacade) {
        return new BackoffDispatcher(invoker, tracker, scheduler, expiry, responder,
                listeners.orderedStream().toList(), metrics, notifyingFacade);
    }

    /**
     * 消费启动器
     */
    @Bean
    public RpcBackoffLifecycle rpcBackoffLifecycle(EntrypointRegistry registry,
                                                   RpcTransport transport,
                                                   PayloadSerializer serializer,
                                                   BackoffDispatcher dispatcher,
                                                   RpcResponder responder,
                                                   RpcBackoffMetrics metrics,
                                                   NotifyingFacade notifyingFacade,
                                                   RpcBackoffProperties props,
                                                   RpcNotifierProperties notifyProps,
                                                   ApplicationContext applicationContext) {
        EnableRpcBackoff enableRpcBackoff = findEnableRpcBackoff(applicationContext);
        if (enableRpcBackoff != null) {
            props.setEnabled(enableRpcBackoff.value());
        }
        return new RpcBackoffLifecycle(registry, transport,
                service -> new RpcConsumer(service, registry, serializer, dispatcher, responder, metrics, notifyingFacade),
                props, notifyProps);
    }

    /**
     * 调用方
     */
    @Bean
    @ConditionalOnMissingBean
    public RpcClient rpcClient(RpcTransport transport, PayloadSerializer serializer, RpcBackoffProperties props) {
        return new RpcClient(transport, serializer, props.getDefaultCallTimeout());
    }

    private EnableRpcBackoff findEnableRpcBackoff(ListableBeanFactory factory) {
        String[] names = factory.getBeanDefinitionNames();
        for (String n : names) {
            Class<?> type = factory.getType(n, false);
            if (type == null) continue;
            EnableRpcBackoff an = AnnotationUtils.findAnnotation(type, EnableRpcBackoff.class);
            if (an != null) return an;
        }
        return null;
    }
}
