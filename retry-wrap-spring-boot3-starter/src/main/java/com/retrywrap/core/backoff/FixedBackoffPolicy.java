package com.retrywrap.core.backoff;

import com.retrywrap.core.spi.BackoffPolicy;
import com.retrywrap.model.RetryConfig;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 固定间隔策略（忽略退避因子, 抖动与封顶规则同指数策略）
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    private final DoubleSupplier random;

    public FixedBackoffPolicy() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    public FixedBackoffPolicy(DoubleSupplier random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public double delayMillis(int attemptIndex, RetryConfig config) {
        return ExponentialJitterBackoffPolicy.jitterAndCap(config.getBaseIntervalMs(), config, random);
    }
}
