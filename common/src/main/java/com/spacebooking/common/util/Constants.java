package com.spacebooking.common.util;

/**
 * Constants shared between services.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String LOCK_PREFIX = "lock:slots:";
    public static final String CACHE_RESOURCE_PREFIX = "resource:metadata:";

    public static final String TOPIC_SLOTS_COMMITTED = "slots-committed";
    public static final String TOPIC_SLOTS_RELEASED = "slots-released";

    public static final int MINUTES_PER_DAY = 24 * 60;
}
