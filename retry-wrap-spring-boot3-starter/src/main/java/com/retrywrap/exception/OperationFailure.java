package com.retrywrap.exception;

import java.util.Objects;

/**
 * 归一化后的操作失败
 * kind 为错误类别标识, 用于判定是否可重试
 *
 * 业务方可直接抛出该异常(或其子类)显式指定类别, 其余异常由
 * {@link com.retrywrap.core.failure.FailureNormalizer} 按类名转换
 */
public class OperationFailure extends RuntimeException {

    private final String kind;

    public OperationFailure(String kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public OperationFailure(String kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String getKind() {
        return kind;
    }

    @Override
    public String toString() {
        String msg = getLocalizedMessage();
        return msg == null ? kind : kind + ": " + msg;
    }
}
