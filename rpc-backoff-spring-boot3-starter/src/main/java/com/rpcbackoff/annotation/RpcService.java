package com.rpcbackoff.annotation;

import java.lang.annotation.*;

/**
 * 声明一个RPC服务, 请求队列为 rpc-{value}
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RpcService {

    /** 服务名 */
    String value();
}
