package com.retrywrap.core.spi;

import com.retrywrap.model.RetryConfig;

/**
 * 回退策略（计算两次尝试之间的等待时长）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * 计算下一次尝试前的等待
     * @param attemptIndex 刚失败的尝试下标（从0开始, 0 对应第一次重试的等待）
     * @param config       重试配置（读取 base/factor/max/jitter）
     * @return 等待毫秒数, 非负
     */
    double delayMillis(int attemptIndex, RetryConfig config);
}
