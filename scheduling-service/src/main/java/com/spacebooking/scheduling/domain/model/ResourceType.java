package com.spacebooking.scheduling.domain.model;

import java.util.Locale;

public enum ResourceType {
    MEETING_ROOM,
    PRIVATE_OFFICE,
    SHARED_DESK,
    EVENT_SPACE,
    OTHER;

    /**
     * Lenient parse of upstream type names such as {@code meeting_room} or {@code event-space}.
     */
    public static ResourceType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ResourceType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
