// file: src/main/java/io/difflite/core/CborPayloadCodec.java
package io.difflite.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

/**
 * {@link PayloadCodec} writing CBOR (RFC 8949) through Jackson.
 * <p>
 * CBOR keeps payloads compact and binary-safe (byte[] fields stay raw) while
 * reusing the same Jackson bindings callers already have for their objects.
 * Unknown properties are ignored on decode so callbacks may bind partial views.
 */
public final class CborPayloadCodec implements PayloadCodec {

    private final ObjectMapper mapper;

    public CborPayloadCodec() {
        this(CBORMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public CborPayloadCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            String type = value == null ? "null" : value.getClass().getName();
            throw new CodecException("failed to encode " + type, e);
        }
    }

    @Override
    public Decoder decoder(byte[] data) {
        return new CborDecoder(mapper, Objects.requireNonNull(data, "data"));
    }

    /** Decoder bound to one payload; decodes afresh on every call. */
    private static final class CborDecoder implements Decoder {
        private final ObjectMapper mapper;
        private final byte[] data;

        CborDecoder(ObjectMapper mapper, byte[] data) {
            this.mapper = mapper;
            this.data = data;
        }

        @Override
        public <T> T decode(Class<T> type) {
            try {
                return mapper.readValue(data, type);
            } catch (IOException e) {
                throw new CodecException("failed to decode payload as " + type.getName(), e);
            }
        }

        @Override
        public <T> T decode(TypeReference<T> type) {
            try {
                return mapper.readValue(data, type);
            } catch (IOException e) {
                throw new CodecException("failed to decode payload as " + type.getType(), e);
            }
        }

        @Override
        public JsonNode tree() {
            try {
                return mapper.readTree(data);
            } catch (IOException e) {
                throw new CodecException("failed to read payload tree", e);
            }
        }

        @Override
        public byte[] bytes() {
            return Arrays.copyOf(data, data.length);
        }
    }
}
