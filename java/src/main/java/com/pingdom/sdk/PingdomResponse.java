package com.pingdom.sdk;

import java.net.http.HttpHeaders;

/**
 * Successful response: status code, headers and the decoded body.
 */
public record PingdomResponse<T>(int statusCode, HttpHeaders headers, T body) {
}
