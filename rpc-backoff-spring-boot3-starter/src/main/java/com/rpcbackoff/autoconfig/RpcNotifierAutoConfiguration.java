package com.rpcbackoff.autoconfig;

import com.rpcbackoff.config.RpcNotifierProperties;
import com.rpcbackoff.core.metric.RpcBackoffMetrics;
import com.rpcbackoff.core.notify.AsyncNotifyingService;
import com.rpcbackoff.core.notify.NotifyingFacade;
import com.rpcbackoff.core.notify.notifier.LoggingNotifier;
import com.rpcbackoff.core.notify.ratelimit.RateLimitFilter;
import com.rpcbackoff.core.notify.route.SimpleRouter;
import com.rpcbackoff.core.spi.notify.Notifier;
import com.rpcbackoff.core.spi.notify.NotifierRouter;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@AutoConfiguration(after = RpcBackoffMetricsAutoConfiguration.class)
@EnableConfigurationProperties(RpcNotifierProperties.class)
public class RpcNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnMissingBean(NotifierRouter.class)
    public NotifierRouter notifierRouter(ObjectProvider<Notifier> notifiers) {
        return new SimpleRouter(notifiers.orderedStream().toList());
    }

    @Bean
    @ConditionalOnProperty(prefix = "rpc.backoff.notify", name = "enabled")
    public AsyncNotifyingService asyncNotifyingService(NotifierRouter router,
                                                       RpcBackoffMetrics metrics,
                                                       RpcNotifierProperties props) {
        RpcNotifierProperties.Async cfg = props.getAsync();
        ThreadPoolExecutor exec = new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "rpc-backoff-notify");
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((th, e) -> LoggerFactory.getLogger("notify").error("uncaught", e));
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        RateLimitFilter filter = new RateLimitFilter(props.getRateLimit().getWindow(), props.getRateLimit().getThreshold());
        return new AsyncNotifyingService(exec, router, filter, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifyingFacade notifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        return new NotifyingFacade(provider);
    }
}
