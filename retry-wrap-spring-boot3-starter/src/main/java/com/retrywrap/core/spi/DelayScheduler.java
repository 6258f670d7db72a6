package com.retrywrap.core.spi;

import java.util.concurrent.CompletableFuture;

/**
 * 两次尝试之间的等待
 *
 * 返回的 future 在等待结束后完成; 等待无法完成时异常完成（中断 / 已停止 / 被拒绝）。
 * 调用方取消返回的 future 时, 实现应尽量撤销挂起的等待。
 */
public interface DelayScheduler {

    CompletableFuture<Void> delay(long delayNanos);
}
