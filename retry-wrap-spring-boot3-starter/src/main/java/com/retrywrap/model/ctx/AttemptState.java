package com.retrywrap.model.ctx;

import com.retrywrap.exception.OperationFailure;
import com.retrywrap.model.RetryConfig;
import com.retrywrap.model.enums.InvocationState;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 单次调用的重试上下文
 * 每次调用包装后的操作时新建, 调用结束即丢弃, 不在调用之间共享
 */
@Getter
@ToString
public class AttemptState {

    private final RetryConfig config;

    /** 当前尝试下标（从0开始） */
    private int attemptIndex;

    /** 最近一次失败（已归一化） */
    private OperationFailure lastFailure;

    private InvocationState state = InvocationState.ATTEMPTING;

    public AttemptState(RetryConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /** 已执行的尝试次数 */
    public int attemptsMade() {
        return attemptIndex + 1;
    }

    /** 当前是否为最后一次允许的尝试 */
    public boolean isLastAttempt() {
        return attemptIndex >= config.getMaxAttempts() - 1;
    }

    public void recordFailure(OperationFailure failure) {
        this.lastFailure = Objects.requireNonNull(failure, "failure");
    }

    /** 进入下一次尝试 */
    public void advance() {
        if (state.isTerminal()) {
            throw new IllegalStateException("invocation already " + state);
        }
        if (isLastAttempt()) {
            throw new IllegalStateException("no attempts left, maxAttempts=" + config.getMaxAttempts());
        }
        attemptIndex++;
    }

    public void succeed() {
        this.state = InvocationState.SUCCEEDED;
    }

    public void fail() {
        this.state = InvocationState.FAILED;
    }
}
