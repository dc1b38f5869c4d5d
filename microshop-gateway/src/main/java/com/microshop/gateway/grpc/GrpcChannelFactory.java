package com.microshop.gateway.grpc;

import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 {@link ManagedChannelBuilder} 的通道工厂，建立通道后阻塞等待 READY
 */
@Slf4j
public class GrpcChannelFactory implements ChannelFactory {

    @Override
    public ManagedChannel open(String target, Duration timeout) {
        log.debug("Opening gRPC channel: target={}", target);
        ManagedChannel channel = ManagedChannelBuilder.forTarget(target)
            .usePlaintext() // 在生产环境中应该使用TLS
            .keepAliveTime(30, TimeUnit.SECONDS)
            .keepAliveTimeout(5, TimeUnit.SECONDS)
            .maxInboundMessageSize(4 * 1024 * 1024) // 4MB
            .build();
        try {
            awaitReady(channel, timeout);
            return channel;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.shutdownNow();
            throw new IllegalStateException("interrupted while connecting to " + target, e);
        } catch (TimeoutException | RuntimeException e) {
            channel.shutdownNow();
            throw new IllegalStateException("channel to " + target + " not ready: " + e.getMessage(), e);
        }
    }

    /**
     * 主动触发连接并等待通道进入 READY
     *
     * @throws TimeoutException 超时仍未就绪
     */
    static void awaitReady(ManagedChannel channel, Duration timeout) throws InterruptedException, TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        ConnectivityState state = channel.getState(true);
        while (state != ConnectivityState.READY) {
            if (state == ConnectivityState.SHUTDOWN) {
                throw new IllegalStateException("channel is shut down");
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TimeoutException("timed out after " + timeout.toMillis() + "ms in state " + state);
            }
            CountDownLatch changed = new CountDownLatch(1);
            channel.notifyWhenStateChanged(state, changed::countDown);
            changed.await(remaining, TimeUnit.NANOSECONDS);
            state = channel.getState(true);
        }
    }
}
