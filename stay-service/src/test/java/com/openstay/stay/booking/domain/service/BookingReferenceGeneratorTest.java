package com.openstay.stay.booking.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class BookingReferenceGeneratorTest {

    private final BookingReferenceGenerator generator = new BookingReferenceGenerator();

    @Test
    @DisplayName("references carry the BK prefix, a clock part and a six character suffix")
    void next_format() {
        assertThat(generator.next()).matches("BK[0-9A-Z]+-[0-9A-Z]{6}");
    }

    @Test
    @DisplayName("clock part strictly increases even within one millisecond")
    void next_clockStrictlyIncreases() {
        Set<String> clockParts = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            String ref = generator.next();
            clockParts.add(ref.substring(2, ref.indexOf('-')));
        }
        assertThat(clockParts).hasSize(1000);
    }

    @Test
    @DisplayName("concurrent callers never receive the same reference")
    void next_uniqueAcrossThreads() {
        Set<String> refs = ConcurrentHashMap.newKeySet();
        IntStream.range(0, 2000).parallel().forEach(i -> refs.add(generator.next()));
        assertThat(refs).hasSize(2000);
    }
}
