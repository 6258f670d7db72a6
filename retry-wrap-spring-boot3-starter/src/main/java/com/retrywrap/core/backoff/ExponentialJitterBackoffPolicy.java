package com.retrywrap.core.backoff;

import com.retrywrap.core.spi.BackoffPolicy;
import com.retrywrap.model.RetryConfig;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 指数退避：base * factor^attempt, 可选 ±20% 抖动, 抖动后再封顶
 */
public class ExponentialJitterBackoffPolicy implements BackoffPolicy {

    /** 抖动下界 0.8, 区间宽度 0.4 -> [0.8, 1.2) */
    static final double JITTER_FLOOR = 0.8;
    static final double JITTER_SPAN = 0.4;

    private final DoubleSupplier random;

    public ExponentialJitterBackoffPolicy() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random 返回 [0, 1) 的随机源, 测试时可注入固定值
     */
    public ExponentialJitterBackoffPolicy(DoubleSupplier random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public double delayMillis(int attemptIndex, RetryConfig config) {
        // attempt从0开始计数：0 -> base, 1 -> base * factor, 2 -> base * factor^2 ...
        double pow = Math.pow(config.getBackoffFactor(), Math.max(0, attemptIndex));
        double ideal = config.getBaseIntervalMs() * pow;
        return jitterAndCap(ideal, config, random);
    }

    static double jitterAndCap(double delay, RetryConfig config, DoubleSupplier random) {
        // base=0 时不抖动也不等待
        if (delay <= 0) {
            return 0;
        }
        if (config.isJitterEnabled()) {
            delay = delay * (JITTER_FLOOR + random.getAsDouble() * JITTER_SPAN);
        }
        if (config.hasMaxInterval()) {
            delay = Math.min(delay, config.getMaxIntervalMs());
        }
        // 溢出为无穷时按上限处理
        if (Double.isInfinite(delay) || Double.isNaN(delay)) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, delay);
    }
}
