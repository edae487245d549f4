package com.resource.guard.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON {@link ValueCodec} backed by a Jackson {@link ObjectMapper}.
 */
public class JacksonValueCodec<V> implements ValueCodec<V> {

    private final ObjectMapper objectMapper;
    private final JavaType type;

    public JacksonValueCodec(ObjectMapper objectMapper, Class<V> type) {
        this(objectMapper, objectMapper.constructType(type));
    }

    public JacksonValueCodec(ObjectMapper objectMapper, JavaType type) {
        this.objectMapper = objectMapper;
        this.type = type;
    }

    public static <V> JacksonValueCodec<V> of(Class<V> type) {
        return new JacksonValueCodec<>(new ObjectMapper(), type);
    }

    @Override
    public String encode(V value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + type + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public V decode(String raw) {
        try {
            return objectMapper.readValue(raw, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize " + type + ": " + e.getOriginalMessage(), e);
        }
    }
}
