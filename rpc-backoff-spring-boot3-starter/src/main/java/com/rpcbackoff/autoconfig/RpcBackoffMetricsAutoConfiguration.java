package com.rpcbackoff.autoconfig;

import com.rpcbackoff.core.metric.RpcBackoffMeterRegistryProvider;
import com.rpcbackoff.core.metric.RpcBackoffMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
public class RpcBackoffMetricsAutoConfiguration {

    @Bean
    public RpcBackoffMeterRegistryProvider rpcBackoffMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new RpcBackoffMeterRegistryProvider(discovered.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public RpcBackoffMetrics rpcBackoffMetrics(RpcBackoffMeterRegistryProvider provider) {
        return RpcBackoffMetrics.create(provider.getRegistry());
    }
}
