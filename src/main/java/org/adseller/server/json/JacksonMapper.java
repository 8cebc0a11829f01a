package org.adseller.server.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

public class JacksonMapper {

    private static final String FAILED_TO_DECODE = "Failed to decode: %s";

    private final ObjectMapper mapper;

    public JacksonMapper(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    public <T> T decodeValue(String str, Class<T> clazz) throws DecodeException {
        try {
            return mapper.readValue(str, clazz);
        } catch (JsonProcessingException e) {
            throw new DecodeException(FAILED_TO_DECODE.formatted(e.getMessage()), e);
        }
    }

    public <T> T decodeValue(byte[] bytes, Class<T> clazz) throws DecodeException {
        try {
            return mapper.readValue(bytes, clazz);
        } catch (IOException e) {
            throw new DecodeException(FAILED_TO_DECODE.formatted(e.getMessage()), e);
        }
    }
}
