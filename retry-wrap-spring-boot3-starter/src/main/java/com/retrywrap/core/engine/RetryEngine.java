package com.retrywrap.core.engine;

import com.retrywrap.core.backoff.BackoffRegistry;
import com.retrywrap.core.failure.FailureNormalizer;
import com.retrywrap.core.metric.RetryMetrics;
import com.retrywrap.core.spi.BackoffPolicy;
import com.retrywrap.core.spi.DelayScheduler;
import com.retrywrap.core.spi.FailureDecider;
import com.retrywrap.exception.OperationFailure;
import com.retrywrap.exception.RetryAbortedException;
import com.retrywrap.model.RetryConfig;
import com.retrywrap.model.ctx.AttemptState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 重试核心引擎
 *
 * 同步/异步操作统一为延迟任务 {@code Supplier<CompletionStage<R>>}, 尝试循环只面向 CompletionStage：
 * 成功即完成; 失败则归一化、判定, 未耗尽时按回退策略等待后进入下一次尝试。
 * 引擎本身无状态, 每次调用独立持有 {@link AttemptState}。
 */
public class RetryEngine {

    private static final Logger log = LoggerFactory.getLogger(RetryEngine.class);

    private static final double NANOS_PER_MILLI = 1_000_000d;

    /** 失败判定器 */
    private final FailureDecider failureDecider;

    /** 回退策略注册中心 */
    private final BackoffRegistry backoff;

    /** 指标 */
    private final RetryMetrics meter;

    public RetryEngine(FailureDecider failureDecider, BackoffRegistry backoff, RetryMetrics meter) {
        this.failureDecider = Objects.requireNonNull(failureDecider, "failureDecider");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.meter = Objects.requireNonNull(meter, "meter");
    }

    /**
     * 执行一次带重试的调用
     * @param operation 延迟任务, 每次尝试调用一次
     * @param config    重试配置
     * @param scheduler 两次尝试之间的等待方式
     * @return 成功时以结果完成; 失败时以最近一次归一化失败异常完成
     */
    public <R> CompletableFuture<R> execute(Supplier<? extends CompletionStage<R>> operation,
                                            RetryConfig config,
                                            DelayScheduler scheduler) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(scheduler, "scheduler");

        CompletableFuture<R> result = new CompletableFuture<>();
        Invocation<R> invocation = new Invocation<>(operation, new AttemptState(config),
                backoff.resolve(config.getBackoffStrategy()), scheduler, result);
        meter.incInvocations();
        invocation.attempt();
        return result;
    }

    /**
     * 单次调用的尝试循环
     *
     * 同步完成的尝试与等待不会嵌套调用 attempt(): 请求计数非零时说明已有循环在运行,
     * 只登记请求, 由该循环迭代执行, 调用栈深度与尝试次数无关
     */
    private final class Invocation<R> {

        private final Supplier<? extends CompletionStage<R>> operation;
        private final AttemptState ctx;
        private final BackoffPolicy policy;
        private final DelayScheduler scheduler;
        private final CompletableFuture<R> result;

        /** 未处理的尝试请求数 */
        private final AtomicInteger requested = new AtomicInteger();

        private Invocation(Supplier<? extends CompletionStage<R>> operation, AttemptState ctx,
                           BackoffPolicy policy, DelayScheduler scheduler, CompletableFuture<R> result) {
            this.operation = operation;
            this.ctx = ctx;
            this.policy = policy;
            this.scheduler = scheduler;
            this.result = result;
        }

        void attempt() {
            if (requested.getAndIncrement() != 0) {
                return;
            }
            do {
                attemptOnce();
            } while (requested.decrementAndGet() != 0);
        }

        private void attemptOnce() {
            // 调用方已取消, 不再发起
            if (result.isDone()) {
                return;
            }
            meter.incAttempts();
            CompletionStage<R> stage;
            try {
                stage = Objects.requireNonNull(operation.get(), "operation returned a null stage");
            } catch (Throwable t) {
                stage = CompletableFuture.failedFuture(t);
            }
            stage.whenComplete((value, error) -> {
                try {
                    if (error == null) {
                        onSuccess(value);
                    } else {
                        onFailure(error);
                    }
                } catch (Throwable t) {
                    // 判定器/回退策略自身出错, 不能让调用悬挂
                    ctx.fail();
                    result.completeExceptionally(t);
                }
            });
        }

        private void onSuccess(R value) {
            ctx.succeed();
            meter.incSuccess();
            result.complete(value);
        }

        private void onFailure(Throwable error) {
            if (FailureNormalizer.isFatal(error)) {
                ctx.fail();
                result.completeExceptionally(error);
                return;
            }
            OperationFailure failure = FailureNormalizer.normalize(error);
            ctx.recordFailure(failure);

            if (!failureDecider.isRetryable(failure, ctx)) {
                log.debug("[Retry] non-retryable failure, kind={}, attempt={}/{}",
                        failure.getKind(), ctx.attemptsMade(), ctx.getConfig().getMaxAttempts());
                ctx.fail();
                meter.incRejected();
                result.completeExceptionally(failure);
                return;
            }
            // 最后一次尝试失败, 不再等待
            if (ctx.isLastAttempt()) {
                log.warn("[Retry] attempts exhausted, attempts={}, kind={}, err={}",
                        ctx.attemptsMade(), failure.getKind(), failure.getMessage());
                ctx.fail();
                meter.incExhausted();
                result.completeExceptionally(failure);
                return;
            }

            double delayMs = policy.delayMillis(ctx.getAttemptIndex(), ctx.getConfig());
            log.debug("[Retry] attempt {}/{} failed, kind={}, next in {} ms",
                    ctx.attemptsMade(), ctx.getConfig().getMaxAttempts(), failure.getKind(), delayMs);
            ctx.advance();

            long delayNanos = Math.round(delayMs * NANOS_PER_MILLI);
            if (delayNanos <= 0) {
                attempt();
                return;
            }
            long waitStart = System.nanoTime();
            CompletableFuture<Void> wait = scheduler.delay(delayNanos);
            if (!wait.isDone()) {
                // 调用方取消时撤销挂起的等待
                result.whenComplete((v, e) -> {
                    if (result.isCancelled()) {
                        wait.cancel(false);
                    }
                });
            }
            wait.whenComplete((v, e) -> {
                if (e == null) {
                    meter.recordWaitNanos(System.nanoTime() - waitStart);
                    attempt();
                } else {
                    onWaitAborted(e);
                }
            });
        }

        private void onWaitAborted(Throwable e) {
            // 调用方取消引起的等待取消无需处理
            if (result.isDone()) {
                return;
            }
            log.warn("[Retry] wait before attempt {} aborted: {}", ctx.attemptsMade(), e.toString());
            ctx.fail();
            meter.incAborted();
            result.completeExceptionally(new RetryAbortedException(
                    "retry aborted before attempt " + ctx.attemptsMade(), ctx.getLastFailure(), e));
        }
    }
}
