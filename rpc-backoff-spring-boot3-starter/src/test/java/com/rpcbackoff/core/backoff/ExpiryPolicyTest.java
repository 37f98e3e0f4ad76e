package com.rpcbackoff.core.backoff;

import com.rpcbackoff.config.RpcBackoffProperties;
import com.rpcbackoff.core.serializer.JacksonPayloadSerializer;
import com.rpcbackoff.core.spi.RpcTransport;
import com.rpcbackoff.exception.Backoff;
import com.rpcbackoff.exception.PriorAttemptException;
import com.rpcbackoff.model.BackoffTrace;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpiryPolicyTest {

    private final BackoffScheduler scheduler = new BackoffScheduler(
            new BackoffRegistry(new RpcBackoffProperties()),
            new AttemptTracker(new JacksonPayloadSerializer()),
            Mockito.mock(RpcTransport.class), 16);

    private final ExpiryPolicy policy = new ExpiryPolicy(scheduler);

    private static BackoffSettings settings(int maxAttempts) {
        RpcBackoffProperties.Backoff b = new RpcBackoffProperties().getBackoff();
        return BackoffSettings.builder()
                .strategy("schedule")
                .schedule(b.getSchedule())
                .initialDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(60))
                .maxAttempts(maxAttempts)
                .build();
    }

    @Test
    void testCheck_WhenUnlimited_NeverExpires() {
        assertFalse(policy.check(10_000, settings(0), new Backoff(), List.of()).isExpired());
        assertFalse(policy.check(10_000, settings(-1), new Backoff(), List.of()).isExpired());
    }

    @Test
    void testCheck_BelowLimit_Continues() {
        for (int attempt = 0; attempt < 3; attempt++) {
            assertFalse(policy.check(attempt, settings(3), new Backoff(), List.of()).isExpired());
        }
    }

    @Test
    void testCheck_AtLimit_ExpiresWithLimitAndTotalDelay() {
        Backoff signal = new Backoff(new IllegalStateException("not yet"));
        ExpiryDecision decision = policy.check(3, settings(3), signal, List.of());

        assertTrue(decision.isExpired());
        Backoff.Expired expired = decision.getExpired();
        assertEquals("Backoff aborted after '3' retries (~6 seconds)", expired.getMessage());
        assertEquals(3, expired.getAttempts());
        assertSame(signal, expired.getCause());
        assertEquals("Expired", expired.getClass().getSimpleName());
    }

    @Test
    void testCheck_ExpiredCarriesHistoryAsSuppressed() {
        List<BackoffTrace> history = List.of(
                BackoffTrace.of(0, new Backoff()),
                BackoffTrace.of(1, new Backoff(new IllegalStateException("busy"))));
        Backoff.Expired expired = policy.check(2, settings(2), new Backoff(), history).getExpired();

        assertEquals(2, expired.getHistory().size());
        assertEquals(2, expired.getSuppressed().length);
        assertInstanceOf(PriorAttemptException.class, expired.getSuppressed()[1]);
        assertTrue(expired.getSuppressed()[1].getMessage().contains("busy"));
    }
}
