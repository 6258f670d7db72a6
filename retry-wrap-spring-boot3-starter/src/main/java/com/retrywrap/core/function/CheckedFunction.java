package com.retrywrap.core.function;

/**
 * 单参数、可抛受检异常的同步操作
 */
@FunctionalInterface
public interface CheckedFunction<T, R> {

    R apply(T t) throws Exception;
}
