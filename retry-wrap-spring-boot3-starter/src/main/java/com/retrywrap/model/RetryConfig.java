package com.retrywrap.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 重试配置（不可变，每个包装器构造一次）
 *
 * 未设置的字段取默认值：
 * baseIntervalMs=1000, backoffFactor=2, maxAttempts=3, 不封顶, 不抖动, 策略 exponential
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryConfig {

    public static final long DEFAULT_BASE_INTERVAL_MS = 1000L;
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final String DEFAULT_BACKOFF_STRATEGY = "exponential";

    private static final RetryConfig DEFAULTS = RetryConfig.builder().build();

    /** 可重试的错误类别, 为空表示全部可重试 */
    private final Set<String> retryableErrorKinds;

    /** 基础间隔（毫秒） */
    private final long baseIntervalMs;

    /** 退避因子 */
    private final double backoffFactor;

    /** 最大尝试次数（含首次） */
    private final int maxAttempts;

    /** 间隔上限, null 表示不封顶 */
    private final Long maxIntervalMs;

    /** ±20% 抖动 */
    private final boolean jitterEnabled;

    /** fixed | exponential | spi:{name} */
    private final String backoffStrategy;

    @Builder
    private RetryConfig(Collection<String> retryableErrorKinds,
                        Long baseIntervalMs,
                        Double backoffFactor,
                        Integer maxAttempts,
                        Long maxIntervalMs,
                        Boolean jitterEnabled,
                        String backoffStrategy) {
        this.retryableErrorKinds = retryableErrorKinds == null || retryableErrorKinds.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(retryableErrorKinds));
        this.baseIntervalMs = baseIntervalMs == null ? DEFAULT_BASE_INTERVAL_MS : baseIntervalMs;
        this.backoffFactor = backoffFactor == null ? DEFAULT_BACKOFF_FACTOR : backoffFactor;
        this.maxAttempts = maxAttempts == null ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
        this.maxIntervalMs = maxIntervalMs;
        this.jitterEnabled = jitterEnabled != null && jitterEnabled;
        this.backoffStrategy = backoffStrategy == null || backoffStrategy.isBlank()
                ? DEFAULT_BACKOFF_STRATEGY : backoffStrategy.trim();

        // 参数校验
        if (this.retryableErrorKinds.contains(null)) {
            throw new IllegalArgumentException("retryableErrorKinds must not contain null");
        }
        if (this.baseIntervalMs < 0) {
            throw new IllegalArgumentException("baseIntervalMs must be >= 0, got " + this.baseIntervalMs);
        }
        if (Double.isNaN(this.backoffFactor) || Double.isInfinite(this.backoffFactor) || this.backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be a finite number >= 1, got " + this.backoffFactor);
        }
        if (this.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + this.maxAttempts);
        }
        if (this.maxIntervalMs != null && this.maxIntervalMs < 0) {
            throw new IllegalArgumentException("maxIntervalMs must be >= 0, got " + this.maxIntervalMs);
        }
    }

    public static RetryConfig defaults() {
        return DEFAULTS;
    }

    /** 是否对所有错误类别重试 */
    public boolean retriesAllKinds() {
        return retryableErrorKinds.isEmpty();
    }

    public boolean hasMaxInterval() {
        return maxIntervalMs != null;
    }
}
