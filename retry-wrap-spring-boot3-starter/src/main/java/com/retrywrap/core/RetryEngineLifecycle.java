package com.retrywrap.core;

import com.retrywrap.config.RetryWrapProperties;
import com.retrywrap.core.schedule.WheelDelayScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 时间轮与恢复线程池的生命周期
 * 停止时终止所有挂起的异步等待, 再关闭线程池
 */
public class RetryEngineLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(RetryEngineLifecycle.class);

    private final WheelDelayScheduler scheduler;

    private final ExecutorService resumeExecutor;

    private final RetryWrapProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RetryEngineLifecycle(WheelDelayScheduler scheduler, ExecutorService resumeExecutor,
                                RetryWrapProperties props) {
        this.scheduler = scheduler;
        this.resumeExecutor = resumeExecutor;
        this.props = props;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("[Retry-Wrap] started: maxAttempts={}, backoff.strategy={}, backoff.base={} ms, "
                        + "backoff.factor={}, backoff.max={}, jitter={}, kinds={}, wheel.tick={} ms, exec.core={}, exec.max={}",
                props.getMaxAttempts(),
                props.getBackoff().getStrategy(),
                props.getBackoff().getBase().toMillis(),
                props.getBackoff().getFactor(),
                props.getBackoff().getMax() == null ? "none" : props.getBackoff().getMax().toMillis() + " ms",
                props.getBackoff().isJitter(),
                props.getRetryableErrorKinds().isEmpty() ? "ALL" : props.getRetryableErrorKinds(),
                props.wheelTickMillis(),
                props.getExecutor().getCorePoolSize(),
                props.getExecutor().getMaxPoolSize());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Retry-Wrap] stop skipped: already stopped");
            return;
        }
        log.info("[Retry-Wrap] stopping...");
        try {
            // 停止时间轮, 挂起的等待以 RetryAbortedException 结束
            int aborted = scheduler.shutdown();
            resumeExecutor.shutdown();
            long awaitMs = Math.max(1, props.getShutdown().getAwait().toMillis());
            try {
                if (!resumeExecutor.awaitTermination(awaitMs, TimeUnit.MILLISECONDS)) {
                    resumeExecutor.shutdownNow();
                    log.warn("[Retry-Wrap] resumeExecutor forced shutdown after {} ms", awaitMs);
                }
            } catch (InterruptedException ie) {
                resumeExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("[Retry-Wrap] graceful shutdown done, abortedWaits={}", aborted);
        } finally {
            log.info("[Retry-Wrap] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
