package com.openstay.common.util;

/**
 * Common constants used across modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String LISTING_LOCK_PREFIX = "lock:listing:";
    public static final String BOOKING_REF_PREFIX = "BK";

    public static final int RATING_SCALE = 2;
    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;
}
