package com.microshop.order.grpc;

import com.microshop.common.config.InstanceConfig;
import com.microshop.common.exception.MicroshopException;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.protobuf.services.HealthStatusManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 对外暴露标准健康检查服务的 gRPC 服务器
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderGrpcServer {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final InstanceConfig instanceConfig;

    private final HealthStatusManager healthStatusManager = new HealthStatusManager();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private Server server;
    private Thread awaitThread;

    /**
     * 启动服务器
     *
     * @throws MicroshopException 端口绑定失败
     */
    @PostConstruct
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            server = ServerBuilder.forPort(instanceConfig.getPort())
                .addService(healthStatusManager.getHealthService())
                .build()
                .start();
        } catch (IOException e) {
            running.set(false);
            throw new MicroshopException("failed to start gRPC server on port " + instanceConfig.getPort(), e);
        }
        healthStatusManager.setStatus("", ServingStatus.SERVING);
        healthStatusManager.setStatus(instanceConfig.getName(), ServingStatus.SERVING);

        // gRPC 传输线程为守护线程，需要一个非守护线程等待服务器终止
        awaitThread = new Thread(this::awaitTermination, "order-grpc-await");
        awaitThread.start();
        log.info("gRPC server started: service={}, port={}", instanceConfig.getName(), server.getPort());
    }

    /**
     * 停止服务器
     */
    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping gRPC server: port={}", server.getPort());
        healthStatusManager.enterTerminalState();
        server.shutdown();
        try {
            if (!server.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("gRPC server did not terminate in {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                server.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.shutdownNow();
        }
        log.info("gRPC server stopped");
    }

    /**
     * 实际监听端口，配置端口为 0 时由系统分配
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("gRPC server not started");
        }
        return server.getPort();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void awaitTermination() {
        try {
            server.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
