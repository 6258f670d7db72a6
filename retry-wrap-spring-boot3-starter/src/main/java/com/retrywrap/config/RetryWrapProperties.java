package com.retrywrap.config;

import com.retrywrap.model.RetryConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 重试包装配置（绑定前缀：retry）
 *
 * YAML 示例：
 * retry:
 *   max-attempts: 3
 *   retryable-error-kinds: [IOException, TimeoutException]
 *   backoff:
 *     strategy: exponential
 *     base: 1s
 *     factor: 2.0
 *     max: 30s
 *     jitter: true
 *   wheel:
 *     tick-duration: 10ms
 *     ticks-per-wheel: 512
 *     max-pending-timeouts: 100000
 *   executor:
 *     core-pool-size: 4
 *     max-pool-size: 16
 *     queue-capacity: 1000
 *     keep-alive: 60s
 *     rejected-handler: CALLER_RUNS
 *   shutdown:
 *     await: 30s
 */
@ConfigurationProperties(prefix = "retry")
public class RetryWrapProperties {

    private Backoff backoff = new Backoff();

    private Wheel wheel = new Wheel();

    private Exec executor = new Exec();

    private Shutdown shutdown = new Shutdown();

    /** 最大尝试次数（含首次） */
    private int maxAttempts = RetryConfig.DEFAULT_MAX_ATTEMPTS;

    /** 可重试的错误类别（异常简单类名或 OperationFailure#kind）, 为空表示全部可重试 */
    private List<String> retryableErrorKinds = new ArrayList<>();

    // ----------------- 嵌套配置对象 -----------------

    public static class Backoff {
        /** 策略：fixed | exponential | spi:{name} */
        private String strategy = RetryConfig.DEFAULT_BACKOFF_STRATEGY;

        /** 基础间隔（首次重试前的等待）：如 1s */
        private Duration base = Duration.ofMillis(RetryConfig.DEFAULT_BASE_INTERVAL_MS);

        /** 退避因子（>=1） */
        private double factor = RetryConfig.DEFAULT_BACKOFF_FACTOR;

        /** 最大间隔, 不配置则不封顶 */
        private Duration max;

        /** 是否启用 ±20% 抖动 */
        private boolean jitter = false;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }
        public double getFactor() { return factor; }
        public void setFactor(double factor) { this.factor = factor; }
        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
    }

    public static class Wheel {
        /** 时间轮刻度（异步等待的精度） */
        private Duration tickDuration = Duration.ofMillis(10);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大等待数量（Netty 参数, <=0 不限制） */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    public static class Exec {
        private int corePoolSize = 4;

        private int maxPoolSize = 16;

        /** 任务队列容量 */
        private int queueCapacity = 1000;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        /** 拒绝策略：ABORT | CALLER_RUNS */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.CALLER_RUNS;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    // ----------------- 公共枚举/工具 -----------------

    /**
     * 线程池拒绝策略枚举（YAML 中大小写均可）
     * 两种策略都不会静默丢弃恢复任务: 被拒绝时抛出 RejectedExecutionException, 对应等待以失败结束
     */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS;

        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> (r, executor) -> {
                    // 线程池已关闭时 CallerRunsPolicy 会直接丢弃任务
                    if (executor.isShutdown()) {
                        throw new RejectedExecutionException("retry resume executor is shut down");
                    }
                    r.run();
                };
            };
        }
    }

    // ----------------- getters/setters 顶层 -----------------

    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Exec getExecutor() { return executor; }
    public void setExecutor(Exec executor) { this.executor = executor; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public List<String> getRetryableErrorKinds() { return retryableErrorKinds; }
    public void setRetryableErrorKinds(List<String> retryableErrorKinds) { this.retryableErrorKinds = retryableErrorKinds; }

    // ----------------- 便捷换算 -----------------

    /** 以毫秒返回刻度（供 HashedWheelTimer 使用） */
    public long wheelTickMillis() { return wheel.getTickDuration().toMillis(); }

    /** 线程池 keepAlive 秒 */
    public long executorKeepAliveSeconds() { return executor.getKeepAlive().toSeconds(); }

    /**
     * 转换为默认重试配置（非法取值在此处抛 IllegalArgumentException）
     */
    public RetryConfig toRetryConfig() {
        return RetryConfig.builder()
                .retryableErrorKinds(retryableErrorKinds)
                .baseIntervalMs(backoff.getBase().toMillis())
                .backoffFactor(backoff.getFactor())
                .maxAttempts(maxAttempts)
                .maxIntervalMs(backoff.getMax() == null ? null : backoff.getMax().toMillis())
                .jitterEnabled(backoff.isJitter())
                .backoffStrategy(backoff.getStrategy())
                .build();
    }
}
