package com.rpcbackoff.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

public class RpcBackoffMeterRegistryProvider {

    private final CompositeMeterRegistry composite;

    public RpcBackoffMeterRegistryProvider(List<MeterRegistry> discovered) {
        // 保底 Simple
        this.composite = new CompositeMeterRegistry();
        this.composite.add(new SimpleMeterRegistry());

        // 合入应用已有的注册表
        if (discovered != null) {
            for (MeterRegistry mr : discovered) {
                if (mr instanceof CompositeMeterRegistry c) {
                    c.getRegistries().forEach(this.composite::add);
                } else {
                    this.composite.add(mr);
                }
            }
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
