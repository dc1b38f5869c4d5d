package com.microshop.discovery;

import com.microshop.common.model.ServiceInstance;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ServiceRegistrarTest {

    private static final ServiceInstance INSTANCE = new ServiceInstance("order-service", "127.0.0.1", 50052);

    @Mock
    private ServiceDiscovery discovery;

    @Test
    void testStartRegistersAndStopDeregisters() {
        ServiceRegistrar registrar = new ServiceRegistrar(discovery, INSTANCE);

        registrar.start();
        assertTrue(registrar.isRegistered());
        verify(discovery).register(INSTANCE);

        registrar.stop();
        assertFalse(registrar.isRegistered());
        verify(discovery).deregister(INSTANCE);
    }

    @Test
    void testRegistrationFailureIsFatal() {
        doThrow(new RegistryException("store unavailable")).when(discovery).register(INSTANCE);
        ServiceRegistrar registrar = new ServiceRegistrar(discovery, INSTANCE);

        assertThrows(RegistryException.class, registrar::start);
        assertFalse(registrar.isRegistered());

        registrar.stop();
        verify(discovery, never()).deregister(any());
    }
}
