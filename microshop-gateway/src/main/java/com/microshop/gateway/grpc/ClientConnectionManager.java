package com.microshop.gateway.grpc;

import com.microshop.discovery.ServiceDiscovery;
import com.microshop.gateway.config.GatewayConfig;
import io.grpc.ManagedChannel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 客户端连接管理器
 * <p>
 * 为每个配置的逻辑服务解析地址（注册中心优先，静态地址兜底）并建立就绪的 gRPC 通道。
 * 不做重连：通道断开后由 gRPC 自身的退避机制处理。
 */
@Slf4j
public class ClientConnectionManager implements AutoCloseable {

    private static final long CLOSE_TIMEOUT_SECONDS = 5;

    private final GatewayConfig config;
    private final ServiceDiscovery discovery;
    private final ChannelFactory channelFactory;

    // 服务名 -> 已就绪的通道，保持连接顺序
    private final Map<String, ManagedChannel> channels = new LinkedHashMap<>();

    /**
     * @param discovery 注册中心客户端，不可用时为 null
     */
    public ClientConnectionManager(GatewayConfig config, ServiceDiscovery discovery, ChannelFactory channelFactory) {
        this.config = config;
        this.discovery = discovery;
        this.channelFactory = channelFactory;
    }

    /**
     * 按配置顺序连接全部服务，遇到第一个失败即停止
     *
     * @throws ConnectionException 某个服务的通道未在超时内就绪
     */
    public synchronized void connect() {
        for (Map.Entry<String, String> entry : config.getServices().entrySet()) {
            String serviceName = entry.getKey();
            String target = resolve(serviceName, entry.getValue());

            log.info("Connecting to service: service={}, target={}", serviceName, target);
            ManagedChannel channel;
            try {
                channel = channelFactory.open(target, config.getDialTimeout());
            } catch (RuntimeException e) {
                throw new ConnectionException(serviceName,
                    "failed to connect to " + serviceName + " at " + target, e);
            }
            ManagedChannel previous = channels.put(serviceName, channel);
            if (previous != null) {
                previous.shutdown();
            }
            log.info("Successfully connected to service: service={}", serviceName);
        }
    }

    /**
     * 解析服务地址
     *
     * @param serviceName   逻辑服务名
     * @param defaultTarget 静态兜底地址
     * @return 注册中心返回的第一个地址；无注册中心、查询失败或无结果时返回兜底地址
     */
    public String resolve(String serviceName, String defaultTarget) {
        if (discovery == null) {
            return defaultTarget;
        }
        try {
            List<String> addresses = discovery.discover(serviceName, config.getDiscoverTimeout());
            if (!addresses.isEmpty()) {
                log.info("Discovered service: service={}, address={}", serviceName, addresses.get(0));
                return addresses.get(0);
            }
        } catch (RuntimeException e) {
            log.warn("Service discovery failed: service={}, error={}", serviceName, e.getMessage());
        }
        log.info("Using default address for service: service={}, address={}", serviceName, defaultTarget);
        return defaultTarget;
    }

    /**
     * 获取已连接服务的通道，用于构造 RPC 存根
     *
     * @throws ConnectionException 服务未连接
     */
    public synchronized ManagedChannel channel(String serviceName) {
        ManagedChannel channel = channels.get(serviceName);
        if (channel == null) {
            throw new ConnectionException(serviceName, "service " + serviceName + " is not connected", null);
        }
        return channel;
    }

    public synchronized int getConnectionCount() {
        return channels.size();
    }

    /**
     * 关闭全部通道
     *
     * @throws ConnectionException 汇总全部关闭失败，单个失败不影响其他通道关闭
     */
    @Override
    public synchronized void close() {
        List<Exception> errors = new ArrayList<>();
        for (Map.Entry<String, ManagedChannel> entry : channels.entrySet()) {
            try {
                closeChannel(entry.getKey(), entry.getValue());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                entry.getValue().shutdownNow();
                errors.add(new ConnectionException(entry.getKey(),
                    "interrupted while closing " + entry.getKey(), e));
            } catch (RuntimeException e) {
                errors.add(new ConnectionException(entry.getKey(),
                    entry.getKey() + " connection close error: " + e.getMessage(), e));
            }
        }
        channels.clear();

        if (!errors.isEmpty()) {
            ConnectionException aggregated = new ConnectionException("errors closing connections: " + errors.size());
            errors.forEach(aggregated::addSuppressed);
            throw aggregated;
        }
        log.info("All service connections closed");
    }

    private void closeChannel(String serviceName, ManagedChannel channel) throws InterruptedException {
        log.debug("Closing channel: service={}", serviceName);
        channel.shutdown();
        if (!channel.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            channel.shutdownNow();
            throw new IllegalStateException("channel did not terminate within " + CLOSE_TIMEOUT_SECONDS + "s");
        }
    }
}
