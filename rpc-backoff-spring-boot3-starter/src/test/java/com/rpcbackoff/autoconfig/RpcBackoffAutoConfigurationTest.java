package com.rpcbackoff.autoconfig;

import com.rpcbackoff.annotation.EnableRpcBackoff;
import com.rpcbackoff.config.RpcBackoffProperties;
import com.rpcbackoff.core.RpcBackoffLifecycle;
import com.rpcbackoff.core.dispatch.BackoffDispatcher;
import com.rpcbackoff.core.entrypoint.EntrypointRegistry;
import com.rpcbackoff.core.handler.GuardedEntrypointExecutor;
import com.rpcbackoff.core.notify.AsyncNotifyingService;
import com.rpcbackoff.core.notify.NotifyingFacade;
import com.rpcbackoff.core.spi.RpcTransport;
import com.rpcbackoff.support.TestServices;
import com.rpcbackoff.transport.LocalRpcTransport;
import com.rpcbackoff.transport.RpcClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RpcBackoffAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    RpcBackoffMetricsAutoConfiguration.class,
                    RpcNotifierAutoConfiguration.class,
                    RpcGuardAutoConfiguration.class,
                    RpcBackoffAutoConfiguration.class));

    @Configuration(proxyBeanMethods = false)
    @EnableRpcBackoff(false)
    @Import(TestServices.class)
    static class DisabledConsumers {
    }

    @Test
    void testDefaults_WiresLocalTransportAndStartsConsumers() {
        runner.withUserConfiguration(TestServices.class).run(ctx -> {
            assertInstanceOf(LocalRpcTransport.class, ctx.getBean(RpcTransport.class));
            assertNotNull(ctx.getBean(BackoffDispatcher.class));
            assertNotNull(ctx.getBean(RpcClient.class));
            assertNotNull(ctx.getBean(NotifyingFacade.class));
            assertTrue(ctx.getBeansOfType(GuardedEntrypointExecutor.class).isEmpty());
            assertTrue(ctx.getBeansOfType(AsyncNotifyingService.class).isEmpty());

            assertTrue(ctx.getBean(RpcBackoffLifecycle.class).isRunning());
            EntrypointRegistry registry = ctx.getBean(EntrypointRegistry.class);
            assertTrue(registry.services().containsAll(List.of("service", "one", "two", "multi")));
            assertEquals(3, registry.get("service", "limited").getSettings().getMaxAttempts());
        });
    }

    @Test
    void testEnableRpcBackoffFalse_SkipsConsumers() {
        runner.withUserConfiguration(DisabledConsumers.class).run(ctx -> {
            assertFalse(ctx.getBean(RpcBackoffProperties.class).isEnabled());
            assertFalse(ctx.getBean(RpcBackoffLifecycle.class).isRunning());
            // 注册表仍然构建, 只是不订阅队列
            assertNotNull(ctx.getBean(EntrypointRegistry.class).get("service", "method"));
        });
    }

    @Test
    void testProperties_AreBound() {
        runner.withPropertyValues(
                        "rpc.backoff.default-max-attempts=5",
                        "rpc.backoff.backoff.schedule=1s,2s,3s",
                        "rpc.backoff.wheel.tick-duration=20ms",
                        "rpc.backoff.guard.enabled=true",
                        "rpc.backoff.notify.enabled=true")
                .run(ctx -> {
                    RpcBackoffProperties props = ctx.getBean(RpcBackoffProperties.class);
                    assertEquals(5, props.getDefaultMaxAttempts());
                    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3)),
                            props.getBackoff().getSchedule());
                    assertEquals(Duration.ofMillis(20), props.getWheel().getTickDuration());
                    assertNotNull(ctx.getBean(GuardedEntrypointExecutor.class));
                    assertNotNull(ctx.getBean(AsyncNotifyingService.class));
                });
    }
}
