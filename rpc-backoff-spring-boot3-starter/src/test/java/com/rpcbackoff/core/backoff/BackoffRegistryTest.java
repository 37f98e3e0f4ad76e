package com.rpcbackoff.core.backoff;

import com.rpcbackoff.config.RpcBackoffProperties;
import com.rpcbackoff.core.spi.BackoffPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackoffRegistryTest {

    private static final BackoffPolicy TEN_MS = new BackoffPolicy() {
        @Override
        public String name() {
            return "tenMs";
        }

        @Override
        public Duration delay(int attempt, BackoffSettings settings) {
            return Duration.ofMillis(10);
        }
    };

    private static BackoffSettings.BackoffSettingsBuilder valid() {
        return BackoffSettings.builder()
                .strategy("schedule")
                .schedule(List.of(Duration.ofMillis(10), Duration.ofMillis(20)))
                .initialDelay(Duration.ofMillis(10))
                .maxDelay(Duration.ofSeconds(1))
                .multiplier(2.0)
                .jitterRatio(0);
    }

    @Test
    void testResolve_BuiltinsAndDefault() {
        BackoffRegistry registry = new BackoffRegistry(new RpcBackoffProperties());
        assertInstanceOf(ScheduleBackoffPolicy.class, registry.resolve(null));
        assertInstanceOf(FixedBackoffPolicy.class, registry.resolve("FIXED"));
        assertInstanceOf(ExponentialBackoffPolicy.class, registry.resolve("exponential"));
        assertInstanceOf(ScheduleBackoffPolicy.class, registry.resolve("no-such"));
    }

    @Test
    void testResolve_SpiPrefix() {
        BackoffRegistry registry = new BackoffRegistry(new RpcBackoffProperties(), List.of(TEN_MS));
        assertSame(TEN_MS, registry.resolve("spi:tenMs"));
        assertTrue(registry.contains("spi:tenms"));
    }

    @Test
    void testValidate_RejectsBadSettings() {
        BackoffRegistry registry = new BackoffRegistry(new RpcBackoffProperties());
        assertDoesNotThrow(() -> registry.validate("svc.m", valid().build()));
        assertThrows(IllegalArgumentException.class, () -> registry.validate("svc.m", valid().strategy("spi:missing").build()));
        assertThrows(IllegalArgumentException.class, () -> registry.validate("svc.m", valid().maxDelay(Duration.ofMillis(1)).build()));
        assertThrows(IllegalArgumentException.class, () -> registry.validate("svc.m", valid().jitterRatio(1.5).build()));
        assertThrows(IllegalArgumentException.class, () -> registry.validate("svc.m",
                valid().schedule(List.of(Duration.ofSeconds(2), Duration.ofSeconds(1))).build()));
    }

    @Test
    void testAfterPropertiesSet_RejectsInvalidDefaults() {
        RpcBackoffProperties props = new RpcBackoffProperties();
        props.getBackoff().setMaxDelay(Duration.ofMillis(10));
        props.getBackoff().setInitialDelay(Duration.ofSeconds(1));
        BackoffRegistry registry = new BackoffRegistry(props);
        assertThrows(IllegalArgumentException.class, registry::afterPropertiesSet);
    }
}
