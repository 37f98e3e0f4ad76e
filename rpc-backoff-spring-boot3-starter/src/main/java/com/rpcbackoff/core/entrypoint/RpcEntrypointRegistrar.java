package com.rpcbackoff.core.entrypoint;

import com.rpcbackoff.annotation.Rpc;
import com.rpcbackoff.annotation.RpcService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.util.Map;

/**
 * 单例初始化完成后扫描 @RpcService bean 中的 @Rpc 方法并注册
 */
@Slf4j
public class RpcEntrypointRegistrar implements SmartInitializingSingleton, ApplicationContextAware {

    private final EntrypointRegistry registry;

    private final RpcEntrypointFactory factory;

    private ApplicationContext applicationContext;

    public RpcEntrypointRegistrar(EntrypointRegistry registry, RpcEntrypointFactory factory) {
        this.registry = registry;
        this.factory = factory;
    }

    @Override
    public void setApplicationContext(ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = applicationContext.getBeansWithAnnotation(RpcService.class);
        beans.forEach(this::register);
        log.info("[RpcBackoff] registered services={}", registry.services());
    }

    void register(String beanName, Object bean) {
        Class<?> targetClass = AopUtils.getTargetClass(bean);
        RpcService service = AnnotationUtils.findAnnotation(targetClass, RpcService.class);
        if (service == null || !StringUtils.hasText(service.value())) {
            throw new IllegalStateException("bean '" + beanName + "' must declare a non-empty @RpcService name");
        }
        Map<Method, Rpc> methods = MethodIntrospector.selectMethods(targetClass,
                (MethodIntrospector.MetadataLookup<Rpc>) m -> AnnotatedElementUtils.findMergedAnnotation(m, Rpc.class));
        methods.forEach((method, rpc) -> {
            // 代理bean上调用, 保证AOP生效
            Method invocable = AopUtils.selectInvocableMethod(method, bean.getClass());
            RpcEntrypoint ep = factory.create(service.value().trim(), bean, invocable, rpc);
            registry.register(ep);
            log.debug("[RpcBackoff] entrypoint {} -> {}", ep.key(), ep);
        });
    }
}
