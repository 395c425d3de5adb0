package com.pingdom.sdk;

/**
 * Raised when a 2xx response body does not match the requested target shape.
 */
public final class ResponseDecodeException extends PingdomResponseException {

    private static final long serialVersionUID = 1L;

    public ResponseDecodeException(int statusCode, String message, Throwable cause) {
        super(statusCode, message, cause);
    }
}
