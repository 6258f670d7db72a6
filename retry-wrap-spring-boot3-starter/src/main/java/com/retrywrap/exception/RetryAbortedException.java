package com.retrywrap.exception;

/**
 * 两次尝试之间的等待未能完成（线程中断 / 调度器已停止 / 线程池拒绝）
 * 携带中止前最近一次的失败
 */
public class RetryAbortedException extends RuntimeException {

    private final OperationFailure lastFailure;

    public RetryAbortedException(String message, OperationFailure lastFailure, Throwable cause) {
        super(message, cause);
        this.lastFailure = lastFailure;
        if (lastFailure != null) {
            addSuppressed(lastFailure);
        }
    }

    public OperationFailure getLastFailure() {
        return lastFailure;
    }
}
