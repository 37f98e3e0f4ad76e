package com.rpcbackoff.core.handler;

import com.rpcbackoff.config.RpcGuardProperties;
import com.rpcbackoff.exception.Backoff;
import com.rpcbackoff.exception.guard.DownstreamBulkheadFullException;
import com.rpcbackoff.exception.guard.DownstreamOpenCircuitException;
import com.rpcbackoff.exception.guard.DownstreamRateLimitedException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * entrypoint 调用的 RL/BH/CB 防护
 * 被拒绝的调用转为 Backoff, 由退避调度稍后重投递
 */
public class GuardedEntrypointExecutor {

    private final RpcGuardProperties props;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bulkhead>      bhCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RateLimiter>   rlCache = new ConcurrentHashMap<>();

    public GuardedEntrypointExecutor(RpcGuardProperties props) {
        this.props = props;
    }

    /**
     * 统一入口
     * key 为 service.method
     */
    public Object execute(String key, Callable<Object> call) throws Exception {
        if (!props.isEnabled()) {
            return call.call();
        }
        // 组合装饰 RateLimiter → Bulkhead → CircuitBreaker
        Callable<Object> decorated = call;

        // RateLimit最外层限流，抑制突发流量
        if (enabled(props.getRateLimiter(), props.getRlPerEntrypoint(), key, RpcGuardProperties.RlConfig::isEnabled)) {
            RateLimiter rl = rlCache.computeIfAbsent(key, this::buildRl);
            decorated = RateLimiter.decorateCallable(rl, decorated);
        }

        // Bulkhead 限制并发
        if (enabled(props.getBulkhead(), props.getBhPerEntrypoint(), key, RpcGuardProperties.BhConfig::isEnabled)) {
            Bulkhead bh = bhCache.computeIfAbsent(key, this::buildBh);
            decorated = Bulkhead.decorateCallable(bh, decorated);
        }

        // CircuitBreaker fail-fast 熔断器
        if (enabled(props.getCircuitBreaker(), props.getCbPerEntrypoint(), key, RpcGuardProperties.CbConfig::isEnabled)) {
            CircuitBreaker cb = cbCache.computeIfAbsent(key, this::buildCb);
            decorated = CircuitBreaker.decorateCallable(cb, decorated);
        }

        try {
            return decorated.call();
        } catch (CallNotPermittedException open) {
            throw new Backoff(new DownstreamOpenCircuitException(open));
        } catch (BulkheadFullException full) {
            throw new Backoff(new DownstreamBulkheadFullException(full));
        } catch (RequestNotPermitted rnp) {
            throw new Backoff(new DownstreamRateLimitedException(rnp));
        }
    }

    private RateLimiter buildRl(String key) {
        RpcGuardProperties.RlConfig r = pick(props.getRlPerEntrypoint(), key, props.getRateLimiter());
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + key, cfg);
    }

    private Bulkhead buildBh(String key) {
        RpcGuardProperties.BhConfig b = pick(props.getBhPerEntrypoint(), key, props.getBulkhead());
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(b.getMaxConcurrentCalls())
                .maxWaitDuration(b.getMaxWaitDuration())
                .fairCallHandlingStrategyEnabled(true)
                .build();
        return Bulkhead.of("bh:" + key, cfg);
    }

    private CircuitBreaker buildCb(String key) {
        RpcGuardProperties.CbConfig c = pick(props.getCbPerEntrypoint(), key, props.getCircuitBreaker());
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slowCallRateThreshold(c.getSlowCallRateThreshold())
                .slowCallDurationThreshold(c.getSlowCallDurationThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                // 主动退避不计入失败率
                .ignoreExceptions(Backoff.class)
                .build();
        return CircuitBreaker.of("cb:" + key, cfg);
    }

    private static <C> C pick(Map<String, C> map, String key, C def) {
        if (map == null) {
            return def;
        }
        return map.getOrDefault(key, def);
    }

    private static <C> boolean enabled(C defaultCfg, Map<String, C> map, String key, Predicate<C> flag) {
        if (defaultCfg == null) {
            return false;
        }
        C cfg = pick(map, key, defaultCfg);
        return flag.test(cfg);
    }

    public CircuitBreaker getCircuitBreakerIfEnabled(String key) {
        if (!props.isEnabled()
                || !enabled(props.getCircuitBreaker(), props.getCbPerEntrypoint(), key, RpcGuardProperties.CbConfig::isEnabled)) {
            return null;
        }
        return cbCache.computeIfAbsent(key, this::buildCb);
    }
}
