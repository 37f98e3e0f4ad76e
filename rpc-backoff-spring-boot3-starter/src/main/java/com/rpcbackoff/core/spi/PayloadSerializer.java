package com.rpcbackoff.core.spi;

import com.fasterxml.jackson.core.type.TypeReference;

import java.lang.reflect.Type;

/**
 * 序列化
 */
public interface PayloadSerializer {

    /** 反序列化 JSON 为指定泛型类型 */
    <T> T deserialize(String json, TypeReference<T> typeRef);

    <T> T deserialize(String json, Class<T> type);

    /** 将对象序列化为 JSON 字符串 */
    String serialize(Object obj);

    /** 位置参数数组 按方法参数类型逐个转换 */
    Object[] deserializeArgs(String json, Type[] parameterTypes);

    /** 已反序列化的值转换为目标类型 */
    <T> T convert(Object value, Class<T> type);
}
