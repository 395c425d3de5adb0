package com.pingdom.sdk;

/**
 * Failure raised after a response was received. Carries the HTTP status code of that response.
 */
public abstract class PingdomResponseException extends PingdomException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    protected PingdomResponseException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status code of the response that triggered the failure.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
