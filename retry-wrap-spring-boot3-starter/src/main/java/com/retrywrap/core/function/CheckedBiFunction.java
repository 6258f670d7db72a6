package com.retrywrap.core.function;

/**
 * 双参数、可抛受检异常的同步操作
 */
@FunctionalInterface
public interface CheckedBiFunction<T, U, R> {

    R apply(T t, U u) throws Exception;
}
