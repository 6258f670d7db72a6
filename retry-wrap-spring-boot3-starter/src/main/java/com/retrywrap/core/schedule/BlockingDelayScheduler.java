package com.retrywrap.core.schedule;

import com.retrywrap.core.spi.DelayScheduler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 阻塞当前线程等待, 用于同步操作: 整个调用始终在调用方线程上执行
 */
public class BlockingDelayScheduler implements DelayScheduler {

    public static final BlockingDelayScheduler INSTANCE = new BlockingDelayScheduler();

    @Override
    public CompletableFuture<Void> delay(long delayNanos) {
        try {
            TimeUnit.NANOSECONDS.sleep(delayNanos);
            return CompletableFuture.completedFuture(null);
        } catch (InterruptedException ie) {
            // 保留中断标记, 交由上层中止本次调用
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(ie);
        }
    }
}
