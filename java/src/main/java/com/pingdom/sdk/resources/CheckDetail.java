package com.pingdom.sdk.resources;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Full check description. {@code type} keeps the raw per-protocol settings object, keyed by check type
 * (e.g. {@code {"http": {"url": "/", "port": 80}}}).
 */
public record CheckDetail(
    int id,
    String name,
    String hostname,
    String status,
    int resolution,
    Instant created,
    @JsonProperty("lasterrortime") Instant lastErrorTime,
    @JsonProperty("lasttesttime") Instant lastTestTime,
    @JsonProperty("lastresponsetime") long lastResponseTime,
    @JsonProperty("sendnotificationwhendown") int sendNotificationWhenDown,
    @JsonProperty("notifyagainevery") int notifyAgainEvery,
    @JsonProperty("notifywhenbackup") boolean notifyWhenBackUp,
    @JsonProperty("userids") List<Integer> userIds,
    @JsonProperty("teamids") List<Integer> teamIds,
    JsonNode type
) {

    /**
     * @return the check protocol, e.g. {@code http}; null when the response carried no type object.
     */
    public String typeName() {
        if (type == null || !type.isObject() || type.size() == 0) {
            return null;
        }
        return type.fieldNames().next();
    }
}
