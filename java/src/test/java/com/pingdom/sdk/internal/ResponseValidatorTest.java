package com.pingdom.sdk.internal;

import com.pingdom.sdk.MalformedErrorResponseException;
import com.pingdom.sdk.PingdomApiException;
import com.pingdom.sdk.PingdomResponseException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ResponseValidatorTest {

    private static final String ERROR_BODY = "{\"error\":{\"message\":\"X\"}}";

    @Test
    void acceptsEveryTwoHundredStatus() {
        for (int status = 200; status <= 299; status++) {
            int code = status;
            assertDoesNotThrow(() -> ResponseValidator.validate(code, body(ERROR_BODY)), "status " + code);
        }
    }

    @Test
    void rejectsStatusesOutsideTwoHundredRange() {
        for (int status : new int[] {100, 199, 300, 304, 400, 401, 404, 429, 500, 503, 599}) {
            PingdomResponseException ex = assertThrows(PingdomResponseException.class,
                () -> ResponseValidator.validate(status, body(ERROR_BODY)), "status " + status);
            assertEquals(status, ex.getStatusCode());
        }
    }

    @Test
    void decodesMessageFromEnvelope() {
        PingdomApiException ex = assertThrows(PingdomApiException.class,
            () -> ResponseValidator.validate(400, body(ERROR_BODY)));

        assertEquals("X", ex.getMessage());
    }

    @Test
    void decodesPingdomErrorFields() {
        String payload = "{\"error\":{\"statuscode\":401,\"statusdesc\":\"Unauthorized\",\"errormessage\":\"Invalid email and/or password\"}}";

        PingdomApiException ex = assertThrows(PingdomApiException.class,
            () -> ResponseValidator.validate(401, body(payload)));

        assertEquals("Invalid email and/or password", ex.getMessage());
        assertEquals(401, ex.getErrorStatusCode());
        assertEquals("Unauthorized", ex.getStatusDescription());
    }

    @Test
    void fallsBackToStatusMessageWhenEnvelopeHasNone() {
        PingdomApiException ex = assertThrows(PingdomApiException.class,
            () -> ResponseValidator.validate(500, body("{\"error\":{\"statusdesc\":\"Internal Server Error\"}}")));

        assertEquals("Pingdom request failed with status 500 (Internal Server Error)", ex.getMessage());
    }

    @Test
    void surfacesParseFailureForNonJsonBody() {
        MalformedErrorResponseException ex = assertThrows(MalformedErrorResponseException.class,
            () -> ResponseValidator.validate(503, body("Service Unavailable")));

        assertEquals("Service Unavailable", ex.getBody());
        assertInstanceOf(com.fasterxml.jackson.core.JsonProcessingException.class, ex.getCause());
    }

    @Test
    void trailingContentAfterEnvelopeIsMalformed() {
        String payload = "{\"error\":{\"message\":\"X\"}} <html>oops</html>";

        MalformedErrorResponseException ex = assertThrows(MalformedErrorResponseException.class,
            () -> ResponseValidator.validate(500, body(payload)));

        assertEquals(payload, ex.getBody());
        assertNotNull(ex.getCause());
    }

    @Test
    void treatsEmptyBodyAsMalformed() {
        assertThrows(MalformedErrorResponseException.class, () -> ResponseValidator.validate(404, body("")));
    }

    @Test
    void treatsMissingErrorObjectAsMalformed() {
        MalformedErrorResponseException ex = assertThrows(MalformedErrorResponseException.class,
            () -> ResponseValidator.validate(400, body("{\"message\":\"not wrapped\"}")));

        assertNull(ex.getCause());
    }

    @Test
    void consumesBodyOnFailure() throws Exception {
        InputStream stream = body(ERROR_BODY);

        assertThrows(PingdomApiException.class, () -> ResponseValidator.validate(500, stream));
        assertEquals(-1, stream.read());
    }

    private static InputStream body(String value) {
        return new ByteArrayInputStream(value.getBytes(StandardCharsets.UTF_8));
    }
}
