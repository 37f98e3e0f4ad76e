package com.rpcbackoff.annotation;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableRpcBackoff {

    /**
     * 是否启动 entrypoint 消费
     */
    boolean value() default true;
}
