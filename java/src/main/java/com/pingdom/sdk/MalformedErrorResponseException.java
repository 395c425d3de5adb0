package com.pingdom.sdk;

/**
 * Raised for a non-2xx response whose body could not be parsed as the Pingdom error envelope. The parse failure is
 * kept as the cause. This is deliberately not a {@link PingdomApiException}: the service did not report a message.
 */
public final class MalformedErrorResponseException extends PingdomResponseException {

    private static final long serialVersionUID = 1L;

    private final String body;

    public MalformedErrorResponseException(int statusCode, String body, Throwable cause) {
        super(statusCode, "unparsable error response (status " + statusCode + "): "
            + (cause == null ? "missing error object" : cause.getMessage()), cause);
        this.body = body;
    }

    /**
     * @return raw response body as received.
     */
    public String getBody() {
        return body;
    }
}
