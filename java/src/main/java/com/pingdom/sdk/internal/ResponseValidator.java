package com.pingdom.sdk.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pingdom.sdk.MalformedErrorResponseException;
import com.pingdom.sdk.PingdomApiException;
import com.pingdom.sdk.PingdomResponseException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Classifies responses by status code and decodes error payloads from the Pingdom API.
 */
public final class ResponseValidator {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ResponseValidator() {
    }

    public static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode <= 299;
    }

    /**
     * Returns silently for 2xx responses. Otherwise consumes the body and throws the decoded error.
     *
     * @throws PingdomApiException             when the body carries the error envelope.
     * @throws MalformedErrorResponseException when the body cannot be parsed as the envelope.
     * @throws IOException                     when the body cannot be read.
     */
    public static void validate(int statusCode, InputStream bodyStream) throws PingdomResponseException, IOException {
        if (isSuccess(statusCode)) {
            return;
        }

        byte[] bytes = bodyStream == null ? new byte[0] : bodyStream.readAllBytes();
        String body = new String(bytes, StandardCharsets.UTF_8);

        ErrorEnvelope envelope;
        try {
            envelope = MAPPER.readValue(bytes, ErrorEnvelope.class);
        } catch (IOException ex) {
            throw new MalformedErrorResponseException(statusCode, body, ex);
        }
        if (envelope == null || envelope.error() == null) {
            throw new MalformedErrorResponseException(statusCode, body, null);
        }

        ErrorEnvelope.Detail detail = envelope.error();
        throw new PingdomApiException(statusCode, detail.statusCode(), detail.statusDesc(), detail.message());
    }
}
