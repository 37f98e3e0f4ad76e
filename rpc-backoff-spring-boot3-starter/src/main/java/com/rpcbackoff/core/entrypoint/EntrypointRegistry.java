package com.rpcbackoff.core.entrypoint;

import com.rpcbackoff.exception.MethodNotFoundException;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * entrypoint 注册中心 service -> method -> entrypoint
 */
public class EntrypointRegistry {

    private final Map<String, Map<String, RpcEntrypoint>> services = new ConcurrentHashMap<>();

    public void register(RpcEntrypoint ep) {
        RpcEntrypoint prev = services.computeIfAbsent(ep.getService(), k -> new ConcurrentHashMap<>())
                .putIfAbsent(ep.getMethod(), ep);
        if (prev != null) {
            throw new IllegalStateException("duplicate rpc entrypoint " + ep.key()
                    + ": " + prev.getTarget() + " and " + ep.getTarget());
        }
    }

    public RpcEntrypoint get(String service, String method) {
        RpcEntrypoint ep = services.getOrDefault(service, Map.of()).get(method);
        if (ep == null) {
            throw new MethodNotFoundException(service, method);
        }
        return ep;
    }

    public Set<String> services() {
        return Collections.unmodifiableSet(services.keySet());
    }

    public Map<String, RpcEntrypoint> entrypoints(String service) {
        return Collections.unmodifiableMap(services.getOrDefault(service, Map.of()));
    }
}
