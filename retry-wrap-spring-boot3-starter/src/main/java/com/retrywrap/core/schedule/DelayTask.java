package com.retrywrap.core.schedule;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 时间轮上的等待任务
 * 让时间轮 stop() 返回的 Timeout 能识别出挂起的等待并将其终止
 */
class DelayTask implements TimerTask {

    private final CompletableFuture<Void> future;

    /** 到期后续逻辑切到该线程池执行, 不占用时间轮线程 */
    private final Executor executor;

    DelayTask(CompletableFuture<Void> future, Executor executor) {
        this.future = future;
        this.executor = executor;
    }

    @Override
    public void run(Timeout timeout) {
        if (future.isDone()) {
            return;
        }
        // 已关闭的线程池可能按拒绝策略静默丢弃任务
        if (executor instanceof ExecutorService es && es.isShutdown()) {
            future.completeExceptionally(new RejectedExecutionException("retry resume executor is shut down"));
            return;
        }
        try {
            executor.execute(() -> future.complete(null));
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
    }

    /** 时间轮停止时终止等待 */
    boolean abort(Throwable reason) {
        return future.completeExceptionally(reason);
    }
}
