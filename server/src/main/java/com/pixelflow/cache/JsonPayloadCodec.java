package com.pixelflow.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Jackson-backed codec for values without a dedicated binary format.
 */
public class JsonPayloadCodec<V> implements PayloadCodec<V> {

    private final ObjectMapper mapper;
    private final JavaType type;

    public JsonPayloadCodec(Class<V> type) {
        this(new ObjectMapper(), type);
    }

    public JsonPayloadCodec(ObjectMapper mapper, Class<V> type) {
        this.mapper = mapper;
        this.type = mapper.constructType(type);
    }

    public JsonPayloadCodec(ObjectMapper mapper, TypeReference<V> type) {
        this.mapper = mapper;
        this.type = mapper.getTypeFactory().constructType(type);
    }

    @Override
    public byte[] encode(V value) throws IOException {
        return mapper.writeValueAsBytes(value);
    }

    @Override
    public V decode(byte[] bytes) throws IOException {
        return mapper.readValue(bytes, type);
    }
}
