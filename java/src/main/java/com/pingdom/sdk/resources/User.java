package com.pingdom.sdk.resources;

import java.util.List;

/**
 * Account user with its email contact targets. {@code paused} and {@code primary} are the API's
 * {@code "YES"}/{@code "NO"} flags.
 */
public record User(int id, String name, String paused, String primary, List<Email> email) {

    public record Email(int id, String address, String severity) {
    }
}
