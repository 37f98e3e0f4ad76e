package com.rpcbackoff.core.dispatch;

import com.rpcbackoff.config.RpcBackoffProperties;
import com.rpcbackoff.core.backoff.AttemptTracker;
import com.rpcbackoff.core.backoff.BackoffRegistry;
import com.rpcbackoff.core.backoff.BackoffScheduler;
import com.rpcbackoff.core.backoff.BackoffSettings;
import com.rpcbackoff.core.backoff.ExpiryPolicy;
import com.rpcbackoff.core.entrypoint.EntrypointInvoker;
import com.rpcbackoff.core.entrypoint.RpcEntrypoint;
import com.rpcbackoff.core.metric.RpcBackoffMetrics;
import com.rpcbackoff.core.notify.NotifyingFacade;
import com.rpcbackoff.core.serializer.JacksonPayloadSerializer;
import com.rpcbackoff.core.spi.EntrypointListener;
import com.rpcbackoff.core.spi.RpcTransport;
import com.rpcbackoff.exception.Backoff;
import com.rpcbackoff.exception.RedeliveryFailedException;
import com.rpcbackoff.model.RpcHeaders;
import com.rpcbackoff.model.RpcMessage;
import com.rpcbackoff.model.RpcResponse;
import com.rpcbackoff.model.ctx.DispatchContext;
import com.rpcbackoff.model.enums.DispatchOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BackoffDispatcherTest {

    static class UserException extends RuntimeException {
        UserException(String message) {
            super(message);
        }
    }

    /** 行为由测试设置 */
    public static class Handler {
        final AtomicReference<RuntimeException> toThrow = new AtomicReference<>();

        public String handle(String arg, DispatchContext ctx) {
            RuntimeException e = toThrow.get();
            if (e != null) {
                throw e;
            }
            return arg + "@" + ctx.getAttempt();
        }
    }

    @Mock
    private RpcTransport transport;

    @Mock
    private EntrypointListener listener;

    private final JacksonPayloadSerializer serializer = new JacksonPayloadSerializer();

    private final AttemptTracker tracker = new AttemptTracker(serializer);

    private Handler handler;

    private BackoffDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        handler = new Handler();
        BackoffScheduler scheduler = new BackoffScheduler(new BackoffRegistry(new RpcBackoffProperties()), tracker, transport, 16);
        dispatcher = new BackoffDispatcher(new EntrypointInvoker(null), tracker, scheduler, new ExpiryPolicy(scheduler),
                new RpcResponder(transport, serializer), List.of(listener), RpcBackoffMetrics.noop(), NotifyingFacade.noop());
    }

    private RpcEntrypoint entrypoint(int maxAttempts) throws NoSuchMethodException {
        BackoffSettings settings = BackoffSettings.builder()
                .strategy("fixed")
                .initialDelay(Duration.ofMillis(50))
                .maxDelay(Duration.ofSeconds(1))
                .maxAttempts(maxAttempts)
                .build();
        return new RpcEntrypoint("svc", "handle", handler,
                Handler.class.getMethod("handle", String.class, DispatchContext.class),
                Set.of(UserException.class, Backoff.class), settings);
    }

    private static RpcMessage request(int attempt) {
        RpcMessage msg = RpcMessage.builder()
                .messageId("m-1")
                .correlationId("c-1")
                .replyTo("reply-q")
                .routingKey("handle")
                .payload("[\"x\"]")
                .build();
        return attempt == 0 ? msg : msg.withHeader(RpcHeaders.RETRY_COUNT, attempt);
    }

    private RpcResponse reply() {
        ArgumentCaptor<RpcMessage> captor = ArgumentCaptor.forClass(RpcMessage.class);
        verify(transport).publish(eq("reply-q"), captor.capture());
        assertEquals("c-1", captor.getValue().getCorrelationId());
        return serializer.deserialize(captor.getValue().getPayload(), RpcResponse.class);
    }

    @Test
    void testDispatch_Success_RepliesResultAndInjectsAttempt() throws Exception {
        DispatchOutcome outcome = dispatcher.dispatch(entrypoint(0), request(2), new Object[]{"x"});

        assertEquals(DispatchOutcome.SUCCEEDED, outcome);
        assertEquals("x@2", reply().getResult());
        verify(listener).onExecution(any(), eq("x@2"), eq(null));
    }

    @Test
    void testDispatch_Backoff_ReschedulesWithoutReply() throws Exception {
        Backoff signal = new Backoff();
        handler.toThrow.set(signal);

        DispatchOutcome outcome = dispatcher.dispatch(entrypoint(3), request(1), new Object[]{"x"});

        assertEquals(DispatchOutcome.RESCHEDULED, outcome);
        assertFalse(outcome.isTerminal());
        ArgumentCaptor<RpcMessage> captor = ArgumentCaptor.forClass(RpcMessage.class);
        verify(transport).publishDelayed(eq("rpc-svc"), captor.capture(), eq(Duration.ofMillis(50)));
        assertEquals(2, tracker.read(captor.getValue()));
        verify(transport, never()).publish(any(), any());
        verify(listener).onExecution(any(), eq(null), eq(signal));
    }

    @Test
    void testDispatch_BackoffAtLimit_RepliesExpired() throws Exception {
        handler.toThrow.set(new Backoff(new IllegalStateException("not yet")));

        DispatchOutcome outcome = dispatcher.dispatch(entrypoint(3), request(3), new Object[]{"x"});

        assertEquals(DispatchOutcome.EXPIRED, outcome);
        RpcResponse response = reply();
        assertEquals("Expired", response.getError().getExcType());
        assertEquals(Backoff.Expired.class.getName(), response.getError().getExcPath());
        assertTrue(response.getError().getExcMessage().startsWith("Backoff aborted after '3' retries"));
        verify(transport, never()).publishDelayed(any(), any(), any());

        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(listener).onExecution(any(), eq(null), error.capture());
        Backoff.Expired expired = assertInstanceOf(Backoff.Expired.class, error.getValue());
        assertInstanceOf(IllegalStateException.class, expired.getCause().getCause());
    }

    @Test
    void testDispatch_ExpectedFailure_RepliesError() throws Exception {
        handler.toThrow.set(new UserException("bad input"));

        assertEquals(DispatchOutcome.EXPECTED_FAILURE, dispatcher.dispatch(entrypoint(0), request(0), new Object[]{"x"}));
        RpcResponse response = reply();
        assertEquals("UserException", response.getError().getExcType());
        assertEquals("bad input", response.getError().getExcMessage());
    }

    @Test
    void testDispatch_UnexpectedFailure_RepliesError() throws Exception {
        handler.toThrow.set(new IllegalArgumentException("Boom"));

        assertEquals(DispatchOutcome.UNEXPECTED_FAILURE, dispatcher.dispatch(entrypoint(0), request(0), new Object[]{"x"}));
        assertEquals("IllegalArgumentException", reply().getError().getExcType());
    }

    @Test
    void testDispatch_WhenRedeliveryCannotBeScheduled_RepliesRedeliveryFailed() throws Exception {
        handler.toThrow.set(new Backoff());
        doThrow(new IllegalStateException("wheel full")).when(transport).publishDelayed(any(), any(), any());

        DispatchOutcome outcome = dispatcher.dispatch(entrypoint(0), request(0), new Object[]{"x"});

        assertEquals(DispatchOutcome.UNEXPECTED_FAILURE, outcome);
        assertEquals(RedeliveryFailedException.class.getSimpleName(), reply().getError().getExcType());
        verify(listener).onExecution(any(), eq(null), any(RedeliveryFailedException.class));
    }

    @Test
    void testDispatch_WithoutReplyTo_SendsNothing() throws Exception {
        RpcMessage oneWay = request(0).toBuilder().replyTo(null).build();

        assertEquals(DispatchOutcome.SUCCEEDED, dispatcher.dispatch(entrypoint(0), oneWay, new Object[]{"x"}));
        verify(transport, never()).publish(any(), any());
    }
}
