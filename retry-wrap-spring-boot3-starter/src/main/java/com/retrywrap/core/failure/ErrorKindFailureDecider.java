package com.retrywrap.core.failure;

import com.retrywrap.core.spi.FailureDecider;
import com.retrywrap.exception.OperationFailure;
import com.retrywrap.model.RetryConfig;
import com.retrywrap.model.ctx.AttemptState;

/**
 * 默认判定：未配置类别时全部可重试, 否则按 kind 精确匹配
 */
public class ErrorKindFailureDecider implements FailureDecider {

    @Override
    public boolean isRetryable(OperationFailure failure, AttemptState ctx) {
        RetryConfig config = ctx.getConfig();
        return config.retriesAllKinds() || config.getRetryableErrorKinds().contains(failure.getKind());
    }
}
