package com.microshop.discovery.store;

import com.microshop.discovery.MutableClock;
import com.microshop.discovery.RegistryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKeyValueStoreTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new InMemoryKeyValueStore(clock);
    }

    @Test
    void testKeepAliveExtendsExpiry() {
        Lease lease = store.grant(Duration.ofSeconds(30));
        store.put("/svc/a/1", "1", lease);

        clock.advance(Duration.ofSeconds(20));
        store.keepAlive(lease);
        clock.advance(Duration.ofSeconds(20));

        assertEquals(List.of("1"), store.getPrefix("/svc/a/", Duration.ofSeconds(1)));
    }

    @Test
    void testExpiredLeaseRemovesBoundKeys() {
        Lease lease = store.grant(Duration.ofSeconds(30));
        store.put("/svc/a/1", "1", lease);

        clock.advance(Duration.ofSeconds(30));

        assertTrue(store.getPrefix("/svc/a/", Duration.ofSeconds(1)).isEmpty());
        assertThrows(RegistryException.class, () -> store.keepAlive(lease));
    }

    @Test
    void testPutWithUnknownLeaseFails() {
        assertThrows(RegistryException.class, () -> store.put("/svc/a/1", "1", new Lease(42, Duration.ofSeconds(30))));
    }

    @Test
    void testPutOverwritesValue() {
        Lease lease = store.grant(Duration.ofSeconds(30));
        store.put("/svc/a/1", "old", lease);
        store.put("/svc/a/1", "new", lease);

        assertEquals(List.of("new"), store.getPrefix("/svc/a/", Duration.ofSeconds(1)));
    }

    @Test
    void testGrantRejectsNonPositiveTtl() {
        assertThrows(RegistryException.class, () -> store.grant(Duration.ZERO));
    }
}
