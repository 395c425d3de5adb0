package com.pingdom.sdk;

/**
 * Exception representing an error reported by the Pingdom API. When the service responds with a non-2xx status and an
 * {@code {"error": {...}}} envelope, the SDK hydrates this type so callers can inspect both the HTTP status and the
 * message the service returned.
 */
public final class PingdomApiException extends PingdomResponseException {

    private static final long serialVersionUID = 1L;

    private final int errorStatusCode;
    private final String statusDescription;

    public PingdomApiException(int statusCode, int errorStatusCode, String statusDescription, String message) {
        super(statusCode, message == null || message.isBlank() ? defaultMessage(statusCode, statusDescription) : message, null);
        this.errorStatusCode = errorStatusCode;
        this.statusDescription = statusDescription;
    }

    /**
     * @return status code reported inside the error envelope ({@code statuscode}); zero when absent.
     */
    public int getErrorStatusCode() {
        return errorStatusCode;
    }

    /**
     * @return status description reported inside the error envelope ({@code statusdesc}); nullable.
     */
    public String getStatusDescription() {
        return statusDescription;
    }

    private static String defaultMessage(int status, String description) {
        if (description == null || description.isBlank()) {
            return "Pingdom request failed with status " + status;
        }
        return "Pingdom request failed with status " + status + " (" + description + ")";
    }
}
