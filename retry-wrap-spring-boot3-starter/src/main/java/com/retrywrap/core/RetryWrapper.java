package com.retrywrap.core;

import com.retrywrap.core.engine.RetryEngine;
import com.retrywrap.core.function.CheckedBiFunction;
import com.retrywrap.core.function.CheckedFunction;
import com.retrywrap.core.schedule.BlockingDelayScheduler;
import com.retrywrap.core.spi.DelayScheduler;
import com.retrywrap.model.RetryConfig;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 重试包装工厂
 *
 * <p>{@code wrap} 包装同步操作, 返回同形状的操作: 阻塞直到成功或失败,
 * 失败时抛出最近一次归一化的 {@link com.retrywrap.exception.OperationFailure}。
 * 两次尝试之间在调用方线程上等待。
 *
 * <p>{@code wrapAsync} 包装异步操作, 返回参数相同、结果为 {@link CompletableFuture} 的操作,
 * 等待在时间轮上进行, 不占用线程。取消返回的 future 会撤销挂起的等待并停止后续尝试。
 *
 * <p>未显式传入配置时使用该包装器的默认配置。
 */
public class RetryWrapper {

    private final RetryEngine engine;

    /** 异步操作的等待方式 */
    private final DelayScheduler asyncScheduler;

    /** 同步操作的等待方式 */
    private final DelayScheduler blockingScheduler;

    private final RetryConfig defaultConfig;

    public RetryWrapper(RetryEngine engine, DelayScheduler asyncScheduler, RetryConfig defaultConfig) {
        this(engine, asyncScheduler, BlockingDelayScheduler.INSTANCE, defaultConfig);
    }

    public RetryWrapper(RetryEngine engine, DelayScheduler asyncScheduler,
                        DelayScheduler blockingScheduler, RetryConfig defaultConfig) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.asyncScheduler = Objects.requireNonNull(asyncScheduler, "asyncScheduler");
        this.blockingScheduler = Objects.requireNonNull(blockingScheduler, "blockingScheduler");
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
    }

    public RetryConfig getDefaultConfig() {
        return defaultConfig;
    }

    // ----------------- 同步 -----------------

    public <R> Callable<R> wrap(Callable<R> operation) {
        return wrap(operation, defaultConfig);
    }

    public <R> Callable<R> wrap(Callable<R> operation, RetryConfig config) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(config, "config");
        return () -> await(engine.execute(() -> invoke(operation), config, blockingScheduler));
    }

    public <T, R> CheckedFunction<T, R> wrap(CheckedFunction<T, R> operation) {
        return wrap(operation, defaultConfig);
    }

    public <T, R> CheckedFunction<T, R> wrap(CheckedFunction<T, R> operation, RetryConfig config) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(config, "config");
        return t -> await(engine.execute(() -> invoke(() -> operation.apply(t)), config, blockingScheduler));
    }

    public <T, U, R> CheckedBiFunction<T, U, R> wrap(CheckedBiFunction<T, U, R> operation) {
        return wrap(operation, defaultConfig);
    }

    public <T, U, R> CheckedBiFunction<T, U, R> wrap(CheckedBiFunction<T, U, R> operation, RetryConfig config) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(config, "config");
        return (t, u) -> await(engine.execute(() -> invoke(() -> operation.apply(t, u)), config, blockingScheduler));
    }

    // ----------------- 异步 -----------------

    public <R> Supplier<CompletableFuture<R>> wrapAsync(Supplier<? extends CompletionStage<R>> operation) {
        return wrapAsync(operation, defaultConfig);
    }

    public <R> Supplier<CompletableFuture<R>> wrapAsync(Supplier<? extends CompletionStage<R>> operation,
                                                       RetryConfig config) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(config, "config");
        return () -> engine.execute(operation, config, asyncScheduler);
    }

    public <T, R> Function<T, CompletableFuture<R>> wrapAsync(Function<T, ? extends CompletionStage<R>> operation) {
        return wrapAsync(operation, defaultConfig);
    }

    public <T, R> Function<T, CompletableFuture<R>> wrapAsync(Function<T, ? extends CompletionStage<R>> operation,
                                                             RetryConfig config) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(config, "config");
        return t -> engine.execute(() -> operation.apply(t), config, asyncScheduler);
    }

    public <T, U, R> BiFunction<T, U, CompletableFuture<R>> wrapAsync(
            BiFunction<T, U, ? extends CompletionStage<R>> operation) {
        return wrapAsync(operation, defaultConfig);
    }

    public <T, U, R> BiFunction<T, U, CompletableFuture<R>> wrapAsync(
            BiFunction<T, U, ? extends CompletionStage<R>> operation, RetryConfig config) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(config, "config");
        return (t, u) -> engine.execute(() -> operation.apply(t, u), config, asyncScheduler);
    }

    /**
     * 同步调用转为已完成的 stage
     */
    private static <R> CompletionStage<R> invoke(Callable<R> operation) {
        try {
            return CompletableFuture.completedFuture(operation.call());
        } catch (InterruptedException ie) {
            // 恢复中断标记, 后续等待将立即中止
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(ie);
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    /**
     * 同步等待结果, 失败时抛出原始的非受检异常
     */
    private static <R> R await(CompletableFuture<R> future) {
        try {
            return future.join();
        } catch (CompletionException ce) {
            Throwable cause = ce.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw ce;
        }
    }
}
