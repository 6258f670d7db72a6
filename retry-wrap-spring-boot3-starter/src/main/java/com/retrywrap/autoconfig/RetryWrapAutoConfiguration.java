package com.retrywrap.autoconfig;

import com.retrywrap.config.RetryWrapProperties;
import com.retrywrap.core.RetryEngineLifecycle;
import com.retrywrap.core.RetryWrapper;
import com.retrywrap.core.backoff.BackoffRegistry;
import com.retrywrap.core.engine.RetryEngine;
import com.retrywrap.core.failure.ErrorKindFailureDecider;
import com.retrywrap.core.metric.RetryMetrics;
import com.retrywrap.core.schedule.WheelDelayScheduler;
import com.retrywrap.core.spi.BackoffPolicy;
import com.retrywrap.core.spi.FailureDecider;
import com.retrywrap.model.RetryConfig;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮 / 恢复线程池 / 重试引擎 / 包装器
 */
@AutoConfiguration(after = RetryWrapMetricsAutoConfiguration.class)
@EnableConfigurationProperties(RetryWrapProperties.class)
public class RetryWrapAutoConfiguration {

    /**
     * 时间轮
     */
    @Bean
    @ConditionalOnMissingBean
    public HashedWheelTimer retryWheelTimer(RetryWrapProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("retry-wrap-timer"),
                props.wheelTickMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * 等待到期后恢复下一次尝试的线程池
     */
    @Bean("retryResumeExecutor")
    @ConditionalOnMissingBean(name = "retryResumeExecutor")
    public ExecutorService retryResumeExecutor(RetryWrapProperties props) {
        RetryWrapProperties.Exec exec = props.getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                props.executorKeepAliveSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(exec.getQueueCapacity()),
                new NamedThreadFactory("retry-resume-exec"),
                exec.getRejectedHandler().toHandler()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public WheelDelayScheduler wheelDelayScheduler(HashedWheelTimer retryWheelTimer,
                                                   @Qualifier("retryResumeExecutor") ExecutorService executor) {
        return new WheelDelayScheduler(retryWheelTimer, executor);
    }

    /**
     * 策略注册中心, 收集业务侧的 BackoffPolicy
     */
    @Bean
    @ConditionalOnMissingBean
    public BackoffRegistry backoffRegistry(ObjectProvider<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(discoveredPolicies.orderedStream().toList());
    }

    /**
     * 默认失败判定：按错误类别
     */
    @Bean
    @ConditionalOnMissingBean(FailureDecider.class)
    public FailureDecider failureDecider() {
        return new ErrorKindFailureDecider();
    }

    /**
     * 默认重试配置
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryConfig retryConfig(RetryWrapProperties props) {
        return props.toRetryConfig();
    }

    /**
     * 重试引擎
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryEngine retryEngine(FailureDecider failureDecider,
                                   BackoffRegistry backoffRegistry,
                                   RetryMetrics meter) {
        return new RetryEngine(failureDecider, backoffRegistry, meter);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryWrapper retryWrapper(RetryEngine engine, WheelDelayScheduler scheduler, RetryConfig retryConfig) {
        return new RetryWrapper(engine, scheduler, retryConfig);
    }

    /**
     * 时间轮与线程池的启停
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryEngineLifecycle retryEngineLifecycle(WheelDelayScheduler scheduler,
                                                     @Qualifier("retryResumeExecutor") ExecutorService executor,
                                                     RetryWrapProperties props) {
        return new RetryEngineLifecycle(scheduler, executor, props);
    }
}
