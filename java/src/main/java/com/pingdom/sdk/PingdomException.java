package com.pingdom.sdk;

/**
 * Base exception thrown by the Pingdom Java SDK.
 */
public class PingdomException extends Exception {

    private static final long serialVersionUID = 1L;

    public PingdomException(String message) {
        super(message);
    }

    public PingdomException(String message, Throwable cause) {
        super(message, cause);
    }
}
