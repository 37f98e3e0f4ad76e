package com.rpcbackoff.core.entrypoint;

import com.rpcbackoff.annotation.Rpc;
import com.rpcbackoff.config.RpcBackoffProperties;
import com.rpcbackoff.core.backoff.BackoffRegistry;
import com.rpcbackoff.core.backoff.BackoffSettings;
import com.rpcbackoff.exception.Backoff;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 由 @Rpc 注解 + 全局配置 构造 entrypoint
 * 注解上的值优先, 未设置的取 rpc.backoff.*
 */
public class RpcEntrypointFactory {

    private final RpcBackoffProperties props;

    private final BackoffRegistry registry;

    public RpcEntrypointFactory(RpcBackoffProperties props, BackoffRegistry registry) {
        this.props = props;
        this.registry = registry;
    }

    public RpcEntrypoint create(String service, Object bean, Method method, Rpc rpc) {
        String name = StringUtils.hasText(rpc.name()) ? rpc.name().trim() : method.getName();
        String owner = service + "." + name;

        Set<Class<? extends Throwable>> expected = new LinkedHashSet<>(Arrays.asList(rpc.expectedExceptions()));
        expected.add(Backoff.class);

        BackoffSettings settings = settingsOf(owner, rpc);
        registry.validate(owner, settings);

        method.setAccessible(true);
        return new RpcEntrypoint(service, name, bean, method, expected, settings);
    }

    BackoffSettings settingsOf(String owner, Rpc rpc) {
        RpcBackoffProperties.Backoff def = props.getBackoff();
        List<Duration> schedule = rpc.schedule().length > 0
                ? Arrays.stream(rpc.schedule()).map(v -> parse(owner, "schedule", v)).toList()
                : List.copyOf(def.getSchedule());
        return BackoffSettings.builder()
                .strategy(StringUtils.hasText(rpc.strategy()) ? rpc.strategy().trim() : def.getStrategy())
                .schedule(schedule)
                .initialDelay(StringUtils.hasText(rpc.initialDelay())
                        ? parse(owner, "initialDelay", rpc.initialDelay()) : def.getInitialDelay())
                .maxDelay(StringUtils.hasText(rpc.maxDelay())
                        ? parse(owner, "maxDelay", rpc.maxDelay()) : def.getMaxDelay())
                .multiplier(rpc.multiplier() > 0 ? rpc.multiplier() : def.getMultiplier())
                .jitterRatio(rpc.jitterRatio() >= 0 ? rpc.jitterRatio() : def.getJitterRatio())
                .maxAttempts(rpc.maxAttempts() >= 0 ? rpc.maxAttempts() : props.getDefaultMaxAttempts())
                .build();
    }

    private static Duration parse(String owner, String attr, String value) {
        try {
            return DurationStyle.detectAndParse(value.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(owner + ": invalid @Rpc(" + attr + ") '" + value + "'", e);
        }
    }
}
