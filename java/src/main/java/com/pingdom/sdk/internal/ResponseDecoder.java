package com.pingdom.sdk.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pingdom.sdk.ResponseDecodeException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Unmarshals successful response bodies into caller-chosen types.
 */
public final class ResponseDecoder {

    static final String NIL_TARGET = "nil decode target";

    private static final ObjectMapper MAPPER = Json.mapper();

    private ResponseDecoder() {
    }

    public static <T> T decode(int statusCode, InputStream bodyStream, Class<T> type)
        throws ResponseDecodeException, IOException {
        Objects.requireNonNull(type, NIL_TARGET);
        byte[] bytes = bodyStream.readAllBytes();
        try {
            return MAPPER.readValue(bytes, type);
        } catch (IOException ex) {
            throw decodeFailure(statusCode, type.getSimpleName(), ex);
        }
    }

    public static <T> T decode(int statusCode, InputStream bodyStream, TypeReference<T> type)
        throws ResponseDecodeException, IOException {
        Objects.requireNonNull(type, NIL_TARGET);
        byte[] bytes = bodyStream.readAllBytes();
        try {
            return MAPPER.readValue(bytes, type);
        } catch (IOException ex) {
            throw decodeFailure(statusCode, type.getType().getTypeName(), ex);
        }
    }

    /**
     * Updates {@code target} in place. Fields of the target are unspecified after a failure.
     */
    public static <T> T decodeInto(int statusCode, InputStream bodyStream, T target)
        throws ResponseDecodeException, IOException {
        Objects.requireNonNull(target, NIL_TARGET);
        byte[] bytes = bodyStream.readAllBytes();
        try {
            return MAPPER.readerForUpdating(target).readValue(bytes);
        } catch (IOException ex) {
            throw decodeFailure(statusCode, target.getClass().getSimpleName(), ex);
        }
    }

    private static ResponseDecodeException decodeFailure(int statusCode, String targetName, IOException cause) {
        return new ResponseDecodeException(statusCode,
            "decode response into " + targetName + ": " + cause.getMessage(), cause);
    }
}
