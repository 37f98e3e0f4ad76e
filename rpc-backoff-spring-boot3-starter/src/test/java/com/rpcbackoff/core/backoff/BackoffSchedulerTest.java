package com.rpcbackoff.core.backoff;

import com.rpcbackoff.config.RpcBackoffProperties;
import com.rpcbackoff.core.serializer.JacksonPayloadSerializer;
import com.rpcbackoff.core.spi.BackoffPolicy;
import com.rpcbackoff.core.spi.RpcTransport;
import com.rpcbackoff.exception.Backoff;
import com.rpcbackoff.exception.RedeliveryFailedException;
import com.rpcbackoff.model.BackoffTrace;
import com.rpcbackoff.model.RpcHeaders;
import com.rpcbackoff.model.RpcMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BackoffSchedulerTest {

    @Mock
    private RpcTransport transport;

    private AttemptTracker tracker;

    private BackoffScheduler scheduler;

    @BeforeEach
    void setUp() {
        tracker = new AttemptTracker(new JacksonPayloadSerializer());
        scheduler = new BackoffScheduler(new BackoffRegistry(new RpcBackoffProperties()), tracker, transport, 16);
    }

    private static BackoffSettings defaults() {
        RpcBackoffProperties.Backoff b = new RpcBackoffProperties().getBackoff();
        return BackoffSettings.builder()
                .strategy(b.getStrategy())
                .schedule(b.getSchedule())
                .initialDelay(b.getInitialDelay())
                .maxDelay(b.getMaxDelay())
                .multiplier(b.getMultiplier())
                .jitterRatio(b.getJitterRatio())
                .build();
    }

    @Test
    void testDelayFor_DefaultScheduleFollowsStepsThenRepeatsLast() {
        BackoffSettings s = defaults();
        long[] expected = {1, 2, 3, 5, 8, 13, 21, 34, 55, 55, 55};
        for (int i = 0; i < expected.length; i++) {
            assertEquals(Duration.ofSeconds(expected[i]), scheduler.delayFor(i, s), "attempt " + i);
        }
    }

    @Test
    void testDelayFor_ExponentialIsMonotonicAndCapped() {
        BackoffSettings s = defaults().toBuilder()
                .strategy("exponential")
                .initialDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofSeconds(2))
                .multiplier(2.0)
                .build();
        Duration prev = Duration.ZERO;
        for (int i = 0; i < 40; i++) {
            Duration d = scheduler.delayFor(i, s);
            assertTrue(d.compareTo(prev) >= 0, "attempt " + i);
            assertTrue(d.compareTo(Duration.ofSeconds(2)) <= 0, "attempt " + i);
            prev = d;
        }
        assertEquals(Duration.ofMillis(400), scheduler.delayFor(2, s));
        assertEquals(Duration.ofSeconds(2), scheduler.delayFor(39, s));
    }

    @Test
    void testDelayFor_FixedReturnsInitialDelay() {
        BackoffSettings s = defaults().toBuilder().strategy("fixed").initialDelay(Duration.ofMillis(250)).build();
        assertEquals(Duration.ofMillis(250), scheduler.delayFor(0, s));
        assertEquals(Duration.ofMillis(250), scheduler.delayFor(7, s));
    }

    @Test
    void testJittered_NeverBelowDeterministicDelayOrAboveCap() {
        BackoffSettings s = defaults().toBuilder().jitterRatio(0.5).build();
        for (int i = 0; i < 200; i++) {
            int attempt = i % 10;
            Duration d = scheduler.jittered(attempt, s);
            assertTrue(d.compareTo(scheduler.delayFor(attempt, s)) >= 0);
            assertTrue(d.compareTo(s.getMaxDelay()) <= 0);
        }
    }

    @Test
    void testTotalDelay_SumsDeterministicDelays() {
        assertEquals(Duration.ofSeconds(6), scheduler.totalDelay(3, defaults()));
        assertEquals(Duration.ZERO, scheduler.totalDelay(0, defaults()));
    }

    @Test
    void testTotalDelay_MatchesSumOfCappedDelays() {
        BackoffSettings s = defaults().toBuilder()
                .strategy("exponential")
                .initialDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofSeconds(2))
                .build();
        Duration expected = Duration.ZERO;
        for (int i = 0; i < 40; i++) {
            expected = expected.plus(scheduler.delayFor(i, s));
        }
        assertEquals(expected, scheduler.totalDelay(40, s));
    }

    @Test
    void testTotalDelay_LargeLimit_EvaluatesEachAttemptOnce() {
        AtomicInteger calls = new AtomicInteger();
        BackoffRegistry registry = new BackoffRegistry(new RpcBackoffProperties()).registry("counting", new BackoffPolicy() {
            @Override
            public String name() {
                return "counting";
            }

            @Override
            public Duration delay(int attempt, BackoffSettings settings) {
                calls.incrementAndGet();
                return Duration.ofMillis(attempt);
            }
        });
        BackoffScheduler counting = new BackoffScheduler(registry, tracker, transport, 16);
        BackoffSettings s = defaults().toBuilder().strategy("counting").maxDelay(Duration.ofHours(1)).build();

        assertEquals(Duration.ofMillis(10_000L * 9_999 / 2), counting.totalDelay(10_000, s));
        assertEquals(10_000, calls.get());
    }

    @Test
    void testReschedule_PublishesIncrementedMessageWithHistory() {
        RpcMessage msg = RpcMessage.builder().messageId("m-1").correlationId("c-1").routingKey("method").payload("[]").build();
        BackoffTrace trace = BackoffTrace.of(0, new Backoff());

        Duration delay = scheduler.reschedule("rpc-svc", msg, 0, defaults(), List.of(), trace);

        ArgumentCaptor<RpcMessage> captor = ArgumentCaptor.forClass(RpcMessage.class);
        verify(transport).publishDelayed(eq("rpc-svc"), captor.capture(), eq(Duration.ofSeconds(1)));
        assertEquals(Duration.ofSeconds(1), delay);
        RpcMessage next = captor.getValue();
        assertEquals(1, tracker.read(next));
        assertEquals(1, tracker.history(next).size());
        assertNotNull(next.header(RpcHeaders.BACKOFF_HISTORY));
        // 原消息不变
        assertNull(msg.header(RpcHeaders.RETRY_COUNT));
    }

    @Test
    void testReschedule_WhenPublishFails_ThrowsRedeliveryFailed() {
        RpcMessage msg = RpcMessage.builder().messageId("m-1").payload("[]").build();
        IllegalStateException down = new IllegalStateException("broker down");
        doThrow(down).when(transport).publishDelayed(any(), any(), any());

        RedeliveryFailedException ex = assertThrows(RedeliveryFailedException.class,
                () -> scheduler.reschedule("rpc-svc", msg, 2, defaults(), List.of(), BackoffTrace.of(2, new Backoff())));
        assertSame(down, ex.getCause());
    }
}
