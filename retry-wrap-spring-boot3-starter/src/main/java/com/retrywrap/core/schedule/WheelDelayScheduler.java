package com.retrywrap.core.schedule;

import com.retrywrap.core.spi.DelayScheduler;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 基于 Netty 时间轮的非阻塞等待, 用于异步操作
 * 到期后在 executor 上恢复下一次尝试
 */
@Slf4j
public class WheelDelayScheduler implements DelayScheduler {

    /** 时间轮 */
    private final HashedWheelTimer timer;

    /** 恢复执行的线程池 */
    private final Executor executor;

    public WheelDelayScheduler(HashedWheelTimer timer, Executor executor) {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<Void> delay(long delayNanos) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        Timeout timeout;
        try {
            timeout = timer.newTimeout(new DelayTask(future, executor), Math.max(0, delayNanos), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException | IllegalStateException e) {
            // 时间轮已停止或挂起数量超限
            return CompletableFuture.failedFuture(e);
        }
        // 调用方取消时撤销时间轮上的任务
        future.whenComplete((v, e) -> {
            if (future.isCancelled()) {
                timeout.cancel();
            }
        });
        return future;
    }

    /**
     * 停止时间轮, 终止所有未触发的等待
     * @return 被终止的等待数量
     */
    public int shutdown() {
        Set<Timeout> unProcessed = timer.stop();
        if (unProcessed == null || unProcessed.isEmpty()) {
            log.info("[Retry-Scheduler] timer stopped with no pending waits.");
            return 0;
        }
        RejectedExecutionException reason = new RejectedExecutionException("retry scheduler stopped");
        int aborted = 0;
        for (Timeout t : unProcessed) {
            if (t != null && t.task() instanceof DelayTask dt && dt.abort(reason)) {
                aborted++;
            }
        }
        log.info("[Retry-Scheduler] timer stopped, aborted {} pending waits.", aborted);
        return aborted;
    }
}
