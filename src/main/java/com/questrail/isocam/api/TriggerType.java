package com.questrail.isocam.api;

import java.util.Optional;

/**
 * Acquisition trigger source.
 */
public enum TriggerType
{
    SOFTWARE("SW Trigger"),
    HARDWARE("HW Trigger");

    private final String wireName;

    TriggerType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<TriggerType> fromWireName(String name) {
        for (TriggerType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
