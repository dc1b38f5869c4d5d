package com.microshop.order.grpc;

import com.microshop.common.config.InstanceConfig;
import com.microshop.discovery.ServiceDiscovery;
import com.microshop.discovery.ServiceRegistrar;
import com.microshop.order.config.OrderServiceConfiguration;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.health.v1.HealthCheckRequest;
import io.grpc.health.v1.HealthCheckResponse;
import io.grpc.health.v1.HealthGrpc;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 订单服务 gRPC 服务器与注册测试
 */
@SpringBootTest(classes = {OrderServiceConfiguration.class, OrderGrpcServer.class},
    properties = {
        "microshop.registry.store=memory",
        "microshop.server.name=order-service",
        "microshop.server.host=127.0.0.1",
        "microshop.server.port=0"
    })
class OrderGrpcServerTest {

    @Autowired
    private OrderGrpcServer grpcServer;

    @Autowired
    private ServiceDiscovery serviceDiscovery;

    @Autowired
    private ServiceRegistrar serviceRegistrar;

    @Autowired
    private InstanceConfig instanceConfig;

    private ManagedChannel channel;

    @BeforeEach
    void setUp() {
        channel = ManagedChannelBuilder.forAddress("127.0.0.1", grpcServer.getPort())
            .usePlaintext()
            .build();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void testServerRegistersActualAddress() {
        assertTrue(serviceRegistrar.isRegistered());
        assertEquals(List.of("127.0.0.1:" + grpcServer.getPort()), serviceDiscovery.discover("order-service"));
        assertEquals("order-service", instanceConfig.getName());
    }

    @Test
    void testHealthServiceServing() {
        HealthGrpc.HealthBlockingStub stub = HealthGrpc.newBlockingStub(channel)
            .withDeadlineAfter(5, TimeUnit.SECONDS);

        HealthCheckResponse overall = stub.check(HealthCheckRequest.newBuilder().build());
        HealthCheckResponse service = stub.check(HealthCheckRequest.newBuilder().setService("order-service").build());

        assertEquals(HealthCheckResponse.ServingStatus.SERVING, overall.getStatus());
        assertEquals(HealthCheckResponse.ServingStatus.SERVING, service.getStatus());
    }
}
