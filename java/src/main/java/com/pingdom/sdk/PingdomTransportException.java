package com.pingdom.sdk;

/**
 * Raised when the round trip itself fails (connection refused, DNS failure, interrupted send, ...). No response was
 * obtained, so there is no status code to inspect.
 */
public final class PingdomTransportException extends PingdomException {

    private static final long serialVersionUID = 1L;

    public PingdomTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
