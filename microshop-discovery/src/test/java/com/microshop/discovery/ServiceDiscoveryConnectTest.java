package com.microshop.discovery;

import com.microshop.common.config.RegistryConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 严格/宽松两种连接策略测试
 */
class ServiceDiscoveryConnectTest {

    private RegistryConfig unreachableEtcd() {
        RegistryConfig config = new RegistryConfig();
        config.setEndpoints(List.of("http://127.0.0.1:1"));
        config.setDialTimeout(Duration.ofMillis(500));
        return config;
    }

    @Test
    void testStrictConnectFailsWhenStoreUnreachable() {
        assertThrows(RegistryException.class, () -> ServiceDiscovery.connect(unreachableEtcd()));
    }

    @Test
    void testLenientConnectReturnsEmptyWhenStoreUnreachable() {
        Optional<ServiceDiscovery> discovery = ServiceDiscovery.tryConnect(unreachableEtcd());
        assertTrue(discovery.isEmpty());
    }

    @Test
    void testMemoryStoreConnects() {
        RegistryConfig config = new RegistryConfig();
        config.setStore(RegistryConfig.StoreType.MEMORY);

        try (ServiceDiscovery discovery = ServiceDiscovery.connect(config)) {
            assertTrue(discovery.discover("order-service").isEmpty());
        }
    }
}
