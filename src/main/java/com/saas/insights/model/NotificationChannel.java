package com.saas.insights.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Channels a rule asks its alerts to be delivered on. The engine only records
 * them on the alert; dispatch happens elsewhere.
 */
public enum NotificationChannel {
    EMAIL("email"),
    SLACK("slack"),
    IN_APP("in_app");

    private final String key;

    NotificationChannel(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static NotificationChannel fromKey(String value) {
        for (NotificationChannel channel : values()) {
            if (channel.key.equalsIgnoreCase(value) || channel.name().equalsIgnoreCase(value)) {
                return channel;
            }
        }
        throw new IllegalArgumentException("Unknown notification channel: " + value);
    }
}
