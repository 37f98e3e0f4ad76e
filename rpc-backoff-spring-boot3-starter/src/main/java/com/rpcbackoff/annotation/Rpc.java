package com.rpcbackoff.annotation;

import java.lang.annotation.*;

/**
 * RPC entrypoint 声明
 *
 * 未设置的项使用 rpc.backoff.* 全局配置, 注册时解析一次
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Rpc {

    /** 方法名, 默认取 Java 方法名 */
    String name() default "";

    /**
     * 预期的业务异常, 以 error 响应返回且 WARN 级别日志
     * Backoff 总是被处理, 写不写在这里都一样
     */
    Class<? extends Throwable>[] expectedExceptions() default {};

    /** 最大重试次数, -1 使用全局默认, 0 不限 */
    int maxAttempts() default -1;

    /** schedule | fixed | exponential | spi:{name} */
    String strategy() default "";

    /** 如 "500ms", "2s" */
    String initialDelay() default "";

    String maxDelay() default "";

    /** 阶梯表, 如 {"100ms", "1s", "5s"} */
    String[] schedule() default {};

    /** exponential 倍率, <=0 使用全局默认 */
    double multiplier() default -1;

    /** 抖动比例, <0 使用全局默认 */
    double jitterRatio() default -1;
}
