package com.retrywrap.core.backoff;

import com.retrywrap.core.spi.BackoffPolicy;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 fixed / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy（name() 返回的名字）
 * - 线程安全
 */
public class BackoffRegistry {

    private static final String PREFIX_SPI = "spi:";

    private static final String DEFAULT_STRATEGY = "exponential";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    public BackoffRegistry() {
        this(null);
    }

    public BackoffRegistry(@Nullable List<BackoffPolicy> discovered) {
        if (discovered != null) {
            discovered.forEach(p -> registry(p.name(), p));
        }
        // 内置策略
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent(DEFAULT_STRATEGY, new ExponentialJitterBackoffPolicy());
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry registry(String name, BackoffPolicy policy) {
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析策略
     * 支持 spi:{name} 前缀, 不存在则采用默认 exponential 策略
     */
    public BackoffPolicy resolve(@Nullable String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get(DEFAULT_STRATEGY);
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        return policies.getOrDefault(normalize(s), policies.get(DEFAULT_STRATEGY));
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }
}
