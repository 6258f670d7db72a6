package com.retrywrap.core;

import com.retrywrap.core.backoff.BackoffRegistry;
import com.retrywrap.core.engine.RetryEngine;
import com.retrywrap.core.failure.ErrorKindFailureDecider;
import com.retrywrap.core.function.CheckedBiFunction;
import com.retrywrap.core.function.CheckedFunction;
import com.retrywrap.core.metric.RetryMetrics;
import com.retrywrap.core.schedule.WheelDelayScheduler;
import com.retrywrap.model.RetryConfig;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 非 Spring 环境下的静态入口
 *
 * 共享一个惰性创建的守护线程时间轮, 异步等待到期后在 ForkJoinPool.commonPool() 上恢复,
 * 指标登记到 Micrometer 全局注册表。
 */
public final class Retries {

    /** 时间轮刻度, 决定异步等待的精度 */
    static final long TICK_MILLIS = 10L;

    static final int TICKS_PER_WHEEL = 512;

    private Retries() {
    }

    private static final class Holder {
        static final RetryWrapper DEFAULT = new RetryWrapper(
                new RetryEngine(new ErrorKindFailureDecider(), new BackoffRegistry(),
                        RetryMetrics.create(Metrics.globalRegistry)),
                new WheelDelayScheduler(
                        new HashedWheelTimer(new NamedThreadFactory("retry-wrap-timer"),
                                TICK_MILLIS, TimeUnit.MILLISECONDS, TICKS_PER_WHEEL),
                        ForkJoinPool.commonPool()),
                RetryConfig.defaults());
    }

    /** 共享的默认包装器 */
    public static RetryWrapper shared() {
        return Holder.DEFAULT;
    }

    public static <R> Callable<R> wrap(Callable<R> operation) {
        return shared().wrap(operation);
    }

    public static <R> Callable<R> wrap(Callable<R> operation, RetryConfig config) {
        return shared().wrap(operation, config);
    }

    public static <T, R> CheckedFunction<T, R> wrap(CheckedFunction<T, R> operation) {
        return shared().wrap(operation);
    }

    public static <T, R> CheckedFunction<T, R> wrap(CheckedFunction<T, R> operation, RetryConfig config) {
        return shared().wrap(operation, config);
    }

    public static <T, U, R> CheckedBiFunction<T, U, R> wrap(CheckedBiFunction<T, U, R> operation) {
        return shared().wrap(operation);
    }

    public static <T, U, R> CheckedBiFunction<T, U, R> wrap(CheckedBiFunction<T, U, R> operation,
                                                           RetryConfig config) {
        return shared().wrap(operation, config);
    }

    public static <R> Supplier<CompletableFuture<R>> wrapAsync(Supplier<? extends CompletionStage<R>> operation) {
        return shared().wrapAsync(operation);
    }

    public static <R> Supplier<CompletableFuture<R>> wrapAsync(Supplier<? extends CompletionStage<R>> operation,
                                                              RetryConfig config) {
        return shared().wrapAsync(operation, config);
    }

    public static <T, R> Function<T, CompletableFuture<R>> wrapAsync(
            Function<T, ? extends CompletionStage<R>> operation) {
        return shared().wrapAsync(operation);
    }

    public static <T, R> Function<T, CompletableFuture<R>> wrapAsync(
            Function<T, ? extends CompletionStage<R>> operation, RetryConfig config) {
        return shared().wrapAsync(operation, config);
    }

    public static <T, U, R> BiFunction<T, U, CompletableFuture<R>> wrapAsync(
            BiFunction<T, U, ? extends CompletionStage<R>> operation) {
        return shared().wrapAsync(operation);
    }

    public static <T, U, R> BiFunction<T, U, CompletableFuture<R>> wrapAsync(
            BiFunction<T, U, ? extends CompletionStage<R>> operation, RetryConfig config) {
        return shared().wrapAsync(operation, config);
    }
}
