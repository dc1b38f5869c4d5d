package com.microshop.gateway;

import com.microshop.common.config.RegistryConfig;
import com.microshop.discovery.ServiceDiscovery;
import com.microshop.gateway.config.GatewayConfig;
import com.microshop.gateway.grpc.ChannelFactory;
import com.microshop.gateway.grpc.ClientConnectionManager;
import com.microshop.gateway.grpc.ConnectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.concurrent.CountDownLatch;

/**
 * 网关是服务调用方：注册中心不可达时退化为静态地址继续运行
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayBootstrap {

    private final RegistryConfig registryConfig;
    private final GatewayConfig gatewayConfig;
    private final ChannelFactory channelFactory;

    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    private ServiceDiscovery discovery;
    private ClientConnectionManager connectionManager;
    private Thread keepAliveThread;

    @PostConstruct
    public void start() {
        log.info("Starting gateway: services={}", gatewayConfig.getServices().keySet());
        discovery = ServiceDiscovery.tryConnect(registryConfig).orElse(null);

        connectionManager = new ClientConnectionManager(gatewayConfig, discovery, channelFactory);
        try {
            connectionManager.connect();
        } catch (ConnectionException e) {
            log.error("Gateway failed to connect: service={}", e.getServiceName(), e);
            shutdown();
            throw e;
        }

        // gRPC 客户端线程为守护线程，保持进程运行直到上下文关闭
        keepAliveThread = new Thread(this::awaitShutdown, "gateway-keepalive");
        keepAliveThread.start();
        log.info("Gateway started successfully");
    }

    @PreDestroy
    public void shutdown() {
        shutdownLatch.countDown();
        if (connectionManager != null) {
            try {
                connectionManager.close();
            } catch (ConnectionException e) {
                log.warn("Errors while closing service connections", e);
            }
        }
        if (discovery != null) {
            discovery.close();
        }
        log.info("Gateway stopped");
    }

    public ClientConnectionManager getConnectionManager() {
        return connectionManager;
    }

    /**
     * 注册中心是否可用
     */
    public boolean isDiscoveryAvailable() {
        return discovery != null;
    }

    private void awaitShutdown() {
        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
