package com.microshop.common.model;

import com.microshop.common.config.InstanceConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServiceInstanceTest {

    @Test
    void testAddress() {
        ServiceInstance instance = new ServiceInstance("order-service", "10.0.0.5", 50052);
        assertEquals("10.0.0.5:50052", instance.address());
    }

    @Test
    void testInvalidInstanceRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ServiceInstance(" ", "10.0.0.5", 50052));
        assertThrows(IllegalArgumentException.class, () -> new ServiceInstance("order-service", "10.0.0.5", 0));
        assertThrows(NullPointerException.class, () -> new ServiceInstance("order-service", null, 50052));
    }

    @Test
    void testInstanceConfigConversion() {
        InstanceConfig config = new InstanceConfig();
        config.setName("user-service");
        config.setPort(50051);

        ServiceInstance instance = config.toServiceInstance();
        assertEquals("user-service", instance.name());
        assertEquals("127.0.0.1:50051", instance.address());
    }
}
