package com.retrywrap.core.spi;

import com.retrywrap.exception.OperationFailure;
import com.retrywrap.model.ctx.AttemptState;

/**
 * 失败判定器（按错误类别决定是否可重试）
 */
public interface FailureDecider {

    /**
     * @param failure 已归一化的失败
     * @param ctx     当前调用上下文（含配置与尝试下标）
     * @return true=建议重试；false=立即失败
     */
    boolean isRetryable(OperationFailure failure, AttemptState ctx);

}
