package com.rpcbackoff.support;

import com.rpcbackoff.annotation.Rpc;
import com.rpcbackoff.annotation.RpcService;
import com.rpcbackoff.exception.Backoff;
import com.rpcbackoff.model.ctx.DispatchContext;
import com.rpcbackoff.transport.RpcClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 端到端测试用的服务
 */
@Configuration(proxyBeanMethods = false)
public class TestServices {

    public static final int BACKOFF_COUNT = 3;

    public static class NotYet extends Exception {
        public NotYet(String message) {
            super(message);
        }
    }

    public static class Boom extends RuntimeException {
        public Boom() {
            super("boom");
        }
    }

    public static class UserException extends RuntimeException {
        public UserException(String message) {
            super(message);
        }
    }

    /** 按方法计数 */
    static class Counter {
        private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();

        int next(String key) {
            return counts.computeIfAbsent(key, k -> new AtomicInteger()).getAndIncrement();
        }
    }

    @RpcService("service")
    public static class Service {

        private final Counter counter = new Counter();

        @Rpc
        public String method() {
            if (counter.next("method") < BACKOFF_COUNT) {
                throw new Backoff();
            }
            return "result";
        }

        @Rpc(maxAttempts = 3)
        public String limited() {
            throw new Backoff();
        }

        @Rpc
        public String chained() {
            if (counter.next("chained") < BACKOFF_COUNT) {
                throw new Backoff(new NotYet("try again later"));
            }
            return "result";
        }

        @Rpc(maxAttempts = 3)
        public String chainedExpired() {
            throw new Backoff(new NotYet("try again later"));
        }

        @Rpc
        public String boom() {
            throw new Boom();
        }

        @Rpc(expectedExceptions = UserException.class)
        public String user() {
            throw new UserException("bad input");
        }

        @Rpc
        public String overflow() {
            return overflow();
        }

        @Rpc
        public int add(int a, int b) {
            return a + b;
        }

        @Rpc
        public String whoami(DispatchContext ctx) {
            return ctx.entrypointKey() + "@" + ctx.getAttempt();
        }
    }

    @RpcService("one")
    public static class ServiceOne {

        private final Counter counter = new Counter();

        @Rpc
        public String a() {
            if (counter.next("a") < 2) {
                throw new Backoff();
            }
            return "a";
        }
    }

    @RpcService("two")
    public static class ServiceTwo {

        private final Counter counter = new Counter();

        private final RpcClient client;

        public ServiceTwo(RpcClient client) {
            this.client = client;
        }

        @Rpc
        public String b() {
            if (counter.next("b") < 2) {
                throw new Backoff();
            }
            return "b";
        }

        @Rpc
        public String viaOne() {
            return client.proxy("one").call("a") + "+two";
        }
    }

    @RpcService("multi")
    public static class MultiMethod {

        private final Counter counter = new Counter();

        @Rpc
        public String a() {
            if (counter.next("a") < 2) {
                throw new Backoff();
            }
            return "a";
        }

        @Rpc
        public String b() {
            if (counter.next("b") < 2) {
                throw new Backoff();
            }
            return "b";
        }
    }

    @Bean
    public Service service() {
        return new Service();
    }

    @Bean
    public ServiceOne serviceOne() {
        return new ServiceOne();
    }

    @Bean
    public ServiceTwo serviceTwo(RpcClient client) {
        return new ServiceTwo(client);
    }

    @Bean
    public MultiMethod multiMethod() {
        return new MultiMethod();
    }

    @Bean
    public EntrypointTracker entrypointTracker() {
        return new EntrypointTracker();
    }
}
