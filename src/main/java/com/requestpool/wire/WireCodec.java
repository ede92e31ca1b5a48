package com.requestpool.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.requestpool.exception.WireFormatException;

import java.io.IOException;

/**
 * Serializes policy service requests and responses in CBOR, the binary encoding used across the bridge.
 * Thread-safe once constructed.
 */
public class WireCodec {

    private final ObjectMapper objectMapper;

    public WireCodec() {
        this(CBORMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public WireCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Encode a wire object.
     *
     * @param value Request or response object
     * @return Encoded bytes
     */
    public byte[] encode(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new WireFormatException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Decode a wire object.
     *
     * @param bytes Encoded bytes
     * @param type  Expected type
     * @return Decoded object
     */
    public <T> T decode(byte[] bytes, Class<T> type) {
        if (bytes == null || bytes.length == 0) {
            throw new WireFormatException("Empty " + type.getSimpleName() + " payload");
        }
        try {
            T value = objectMapper.readValue(bytes, type);
            if (value == null) {
                throw new WireFormatException("Null " + type.getSimpleName() + " payload");
            }
            return value;
        } catch (IOException e) {
            throw new WireFormatException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
