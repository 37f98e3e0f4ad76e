package com.rpcbackoff.autoconfig;

import com.rpcbackoff.config.RpcGuardProperties;
import com.rpcbackoff.core.handler.GuardedEntrypointExecutor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties({
        RpcGuardProperties.class
})
public class RpcGuardAutoConfiguration {

    /**
     * entrypoint 统一防护入口
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "rpc.backoff.guard", name = "enabled")
    public GuardedEntrypointExecutor guard(RpcGuardProperties props) {
        return new GuardedEntrypointExecutor(props);
    }
}
