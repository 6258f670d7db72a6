package com.retrywrap.core.failure;

import com.retrywrap.exception.OperationFailure;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 失败归一化：任意异常 -> {@link OperationFailure}
 */
public final class FailureNormalizer {

    private FailureNormalizer() {
    }

    /**
     * 致命错误不归一化, 也不重试
     */
    public static boolean isFatal(Throwable t) {
        return unwrap(t) instanceof VirtualMachineError;
    }

    /**
     * 已是 OperationFailure 直接返回; 否则以类名为 kind、消息(为空时取 toString)为 message 包装
     */
    public static OperationFailure normalize(Throwable t) {
        if (t == null) {
            return new OperationFailure("Error", "null");
        }
        Throwable e = unwrap(t);
        if (e instanceof OperationFailure of) {
            return of;
        }
        String message = e.getMessage() != null ? e.getMessage() : e.toString();
        return new OperationFailure(kindOf(e), message, e);
    }

    /**
     * 错误类别：简单类名, 匿名类取完整类名
     */
    public static String kindOf(Throwable t) {
        if (t instanceof OperationFailure of) {
            return of.getKind();
        }
        String simple = t.getClass().getSimpleName();
        return simple.isEmpty() ? t.getClass().getName() : simple;
    }

    /**
     * 展开异步包装（CompletionException / ExecutionException）
     */
    static Throwable unwrap(Throwable t) {
        Throwable e = t;
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}
