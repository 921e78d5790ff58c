package com.openstay.stay.booking.domain.service;

import com.openstay.common.util.Constants;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Booking references of the form {@code BK<time>-<random>}: a strictly increasing millisecond clock in
 * base 36 followed by a random suffix, so references stay unique across instances and restarts.
 */
@Component
public class BookingReferenceGenerator {

    private static final int SUFFIX_LENGTH = 6;
    private static final char[] ALPHABET = "0123456789ABCDEFGHJKLMNPQRSTUVWXYZ".toCharArray();

    private final AtomicLong lastTick = new AtomicLong();
    private final SecureRandom random = new SecureRandom();

    public String next() {
        long tick = lastTick.updateAndGet(previous -> Math.max(previous + 1, System.currentTimeMillis()));
        StringBuilder ref = new StringBuilder(Constants.BOOKING_REF_PREFIX)
                .append(Long.toString(tick, 36).toUpperCase(Locale.ROOT))
                .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            ref.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return ref.toString();
    }
}
