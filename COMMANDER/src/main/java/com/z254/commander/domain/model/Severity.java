package com.z254.commander.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * High and critical notifications jump ahead of routine traffic.
     */
    public boolean isUrgent() {
        return this == HIGH || this == CRITICAL;
    }
}
