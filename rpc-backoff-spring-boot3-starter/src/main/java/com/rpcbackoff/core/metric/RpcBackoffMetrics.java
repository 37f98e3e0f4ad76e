package com.rpcbackoff.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class RpcBackoffMetrics {
    private final Counter success;
    private final Counter expected;
    private final Counter unexpected;
    private final Counter rescheduled;
    private final Counter expired;
    private final Counter redeliveryFailed;
    private final Counter engineErr;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final DistributionSummary attempts;
    private final Timer execTimer;

    private RpcBackoffMetrics(MeterRegistry reg) {
        this.success    = Counter.builder("rpc.entrypoint.success").description("calls replied with a result").register(reg);
        this.expected   = Counter.builder("rpc.entrypoint.expected").description("calls failed with a declared exception").register(reg);
        this.unexpected = Counter.builder("rpc.entrypoint.unexpected").description("calls failed with an undeclared exception").register(reg);
        this.rescheduled = Counter.builder("rpc.backoff.rescheduled").description("deliveries rescheduled by backoff").register(reg);
        this.expired    = Counter.builder("rpc.backoff.expired").description("calls that ran out of retries").register(reg);
        this.redeliveryFailed = Counter.builder("rpc.backoff.redelivery.failed").description("delayed republish failed").register(reg);
        this.engineErr  = Counter.builder("rpc.consumer.error").description("errors outside the entrypoint").register(reg);
        this.attempts = DistributionSummary.builder("rpc.backoff.attempts")
                .description("attempt count of terminal deliveries").baseUnit("times").register(reg);
        this.notifySuppressed = Counter.builder("rpc.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent   = Counter.builder("rpc.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("rpc.notify.failed").description("notify failed").register(reg);
        this.execTimer = Timer.builder("rpc.entrypoint.exec.time").description("entrypoint execution time").register(reg);
    }

    public static RpcBackoffMetrics create(MeterRegistry reg) { return new RpcBackoffMetrics(reg); }

    /** 未接入 micrometer 时使用 */
    public static RpcBackoffMetrics noop() { return new RpcBackoffMetrics(new SimpleMeterRegistry()); }

    public void incSuccess(){ success.increment(); }
    public void incExpected(){ expected.increment(); }
    public void incUnexpected(){ unexpected.increment(); }
    public void incRescheduled(){ rescheduled.increment(); }
    public void incExpired(){ expired.increment(); }
    public void incRedeliveryFailed(){ redeliveryFailed.increment(); }
    public void incEngineErr(){ engineErr.increment(); }
    public void incNotifySuppressed(){ notifySuppressed.increment(); }
    public void incNotifyFailed(){ notifyFailed.increment(); }
    public void incNotifySent(){ notifySent.increment(); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordExecNanos(long nanos){ execTimer.record(nanos, TimeUnit.NANOSECONDS); }
}
