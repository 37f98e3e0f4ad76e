package com.rpcbackoff.core.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.rpcbackoff.core.spi.PayloadSerializer;

import java.lang.reflect.Type;

public class JacksonPayloadSerializer implements PayloadSerializer {

    private final ObjectMapper mapper;

    /** 使用推荐的默认配置构造 */
    public JacksonPayloadSerializer() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonPayloadSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public <T> T deserialize(String json, TypeReference<T> typeRef) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readValue(json, typeRef);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize payload from JSON", e);
        }
    }

    @Override
    public <T> T deserialize(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize payload from JSON", e);
        }
    }

    @Override
    public String serialize(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload to JSON", e);
        }
    }

    @Override
    public Object[] deserializeArgs(String json, Type[] parameterTypes) {
        JsonNode node;
        try {
            node = json == null ? mapper.createArrayNode() : mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize arguments from JSON", e);
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("Arguments must be a JSON array, got " + node.getNodeType());
        }
        if (node.size() != parameterTypes.length) {
            throw new IllegalArgumentException("Expected " + parameterTypes.length
                    + " argument(s), got " + node.size());
        }
        Object[] args = new Object[parameterTypes.length];
        for (int i = 0; i < parameterTypes.length; i++) {
            args[i] = mapper.convertValue(node.get(i), mapper.constructType(parameterTypes[i]));
        }
        return args;
    }

    @Override
    public <T> T convert(Object value, Class<T> type) {
        if (value == null) {
            return null;
        }
        return mapper.convertValue(value, type);
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 反序列化忽略未知字段，增强前后兼容
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // 自动发现（如 JDK8 Optional、JSR310 等）
        m.findAndRegisterModules();
        return m;
    }
}
