package com.microshop.gateway.grpc;

import io.grpc.ManagedChannel;

import java.time.Duration;

/**
 * 打开到下游服务的 gRPC 通道
 */
public interface ChannelFactory {

    /**
     * 打开通道并等待就绪
     *
     * @param target  拨号地址 host:port
     * @param timeout 等待就绪的超时时间
     * @return 已就绪的通道
     * @throws RuntimeException 超时或通道不可用
     */
    ManagedChannel open(String target, Duration timeout);
}
