package com.microshop.actor.order;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class OrderIdsTest {

    @Test
    void testIdsIncreaseEvenWhenClockStands() {
        Clock fixed = Clock.fixed(Instant.parse("2030-01-01T00:00:00Z"), ZoneOffset.UTC);

        long first = Long.parseLong(OrderIds.next(fixed).substring("ORD-".length()));
        long second = Long.parseLong(OrderIds.next(fixed).substring("ORD-".length()));

        assertTrue(second > first);
    }

    @Test
    void testIdUsesEpochNanos() {
        Instant instant = Instant.parse("2031-06-01T12:00:00.000000123Z");
        String id = OrderIds.next(Clock.fixed(instant, ZoneOffset.UTC));

        assertEquals("ORD-" + (instant.getEpochSecond() * 1_000_000_000L + 123), id);
    }
}
