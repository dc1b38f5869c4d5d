package com.microshop.gateway;

import com.microshop.gateway.config.GatewayConfig;
import com.microshop.gateway.config.GatewayConfiguration;
import com.microshop.gateway.grpc.ConnectionException;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 网关启动流程测试
 */
class GatewayBootstrapTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(GatewayConfiguration.class, GatewayBootstrap.class)
        .withPropertyValues("microshop.gateway.dial-timeout=2s");

    private Server server;

    @BeforeEach
    void setUp() throws IOException {
        server = ServerBuilder.forPort(0).build().start();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void testUnreachableRegistryFallsBackToStaticAddresses() {
        String target = "127.0.0.1:" + server.getPort();
        contextRunner
            .withPropertyValues(
                "microshop.registry.store=etcd",
                "microshop.registry.endpoints=http://127.0.0.1:1",
                "microshop.registry.dial-timeout=500ms",
                "microshop.gateway.services.user-service=" + target,
                "microshop.gateway.services.order-service=" + target)
            .run(context -> {
                assertThat(context).hasNotFailed();
                GatewayBootstrap bootstrap = context.getBean(GatewayBootstrap.class);
                assertThat(bootstrap.isDiscoveryAvailable()).isFalse();
                assertThat(bootstrap.getConnectionManager().getConnectionCount()).isEqualTo(2);
                assertThat(bootstrap.getConnectionManager().channel("order-service")).isNotNull();
            });
    }

    @Test
    void testEmptyRegistryFallsBackToStaticAddresses() {
        String target = "127.0.0.1:" + server.getPort();
        contextRunner
            .withPropertyValues(
                "microshop.registry.store=memory",
                "microshop.gateway.services.user-service=" + target,
                "microshop.gateway.services.order-service=" + target)
            .run(context -> {
                assertThat(context).hasNotFailed();
                GatewayBootstrap bootstrap = context.getBean(GatewayBootstrap.class);
                assertThat(bootstrap.isDiscoveryAvailable()).isTrue();
                assertThat(bootstrap.getConnectionManager().getConnectionCount()).isEqualTo(2);
            });
    }

    @Test
    void testGatewayConfigBinding() {
        contextRunner
            .withPropertyValues(
                "microshop.registry.store=memory",
                "microshop.gateway.discover-timeout=1s",
                "microshop.gateway.services.user-service=127.0.0.1:" + server.getPort(),
                "microshop.gateway.services.order-service=127.0.0.1:" + server.getPort())
            .run(context -> {
                GatewayConfig config = context.getBean(GatewayConfig.class);
                assertThat(config.getDialTimeout()).isEqualTo(Duration.ofSeconds(2));
                assertThat(config.getDiscoverTimeout()).isEqualTo(Duration.ofSeconds(1));
                assertThat(config.getServices()).containsKeys("user-service", "order-service");
            });
    }

    @Test
    void testStartupFailsWhenServiceUnreachable() {
        contextRunner
            .withPropertyValues(
                "microshop.registry.store=memory",
                "microshop.gateway.dial-timeout=300ms",
                "microshop.gateway.services.user-service=127.0.0.1:1",
                "microshop.gateway.services.order-service=127.0.0.1:1")
            .run(context -> {
                assertThat(context).hasFailed();
                Throwable cause = context.getStartupFailure();
                while (cause != null && !(cause instanceof ConnectionException)) {
                    cause = cause.getCause();
                }
                assertThat(cause).isInstanceOf(ConnectionException.class);
                assertThat(((ConnectionException) cause).getServiceName()).isEqualTo("user-service");
            });
    }
}
