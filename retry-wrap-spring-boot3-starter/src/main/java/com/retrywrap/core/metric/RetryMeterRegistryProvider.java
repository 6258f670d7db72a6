package com.retrywrap.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 组合重试指标使用的注册表
 * 业务侧没有任何注册表时退化为 SimpleMeterRegistry, 保证指标可读
 */
public class RetryMeterRegistryProvider {

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    public RetryMeterRegistryProvider(List<MeterRegistry> discovered) {
        Set<MeterRegistry> flattened = new LinkedHashSet<>();
        if (discovered != null) {
            // 组合注册表展开, 避免同一指标被重复登记
            for (MeterRegistry mr : discovered) {
                if (mr instanceof CompositeMeterRegistry cmr) {
                    flattened.addAll(cmr.getRegistries());
                } else {
                    flattened.add(mr);
                }
            }
        }
        if (flattened.isEmpty()) {
            flattened.add(new SimpleMeterRegistry());
        }
        flattened.forEach(composite::add);
    }

    public MeterRegistry getRegistry() { return composite; }
}
