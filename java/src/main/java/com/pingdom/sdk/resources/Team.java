package com.pingdom.sdk.resources;

import java.util.List;

/**
 * Alerting team and its members.
 */
public record Team(int id, String name, List<Member> members) {

    public record Member(int id, String name, String type) {
    }
}
