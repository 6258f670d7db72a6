package com.retrywrap.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * 聚合指标（只计数, 不记录单次调用明细）
 */
public final class RetryMetrics {
    private final Counter invocations;
    private final Counter attempts;
    private final Counter success;
    private final Counter exhausted;
    private final Counter rejected;
    private final Counter aborted;
    private final Timer waitTimer;

    private RetryMetrics(MeterRegistry reg) {
        this.invocations = Counter.builder("retry.invocations").description("wrapped invocations started").register(reg);
        this.attempts    = Counter.builder("retry.attempts").description("operation attempts").register(reg);
        this.success     = Counter.builder("retry.success").description("invocations succeeded").register(reg);
        this.exhausted   = Counter.builder("retry.exhausted").description("invocations failed after all attempts").register(reg);
        this.rejected    = Counter.builder("retry.rejected").description("invocations failed with a non-retryable error").register(reg);
        this.aborted     = Counter.builder("retry.aborted").description("invocations aborted while waiting").register(reg);
        this.waitTimer   = Timer.builder("retry.wait.time").description("time actually waited between attempts").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    public void incInvocations(){ invocations.increment(); }
    public void incAttempts(){    attempts.increment(); }
    public void incSuccess(){     success.increment(); }
    public void incExhausted(){   exhausted.increment(); }
    public void incRejected(){    rejected.increment(); }
    public void incAborted(){     aborted.increment(); }
    public void recordWaitNanos(long nanos){ waitTimer.record(nanos, TimeUnit.NANOSECONDS); }
}
