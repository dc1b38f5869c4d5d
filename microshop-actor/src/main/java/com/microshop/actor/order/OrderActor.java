package com.microshop.actor.order;

import com.microshop.actor.core.Actor;
import com.microshop.actor.core.ActorContext;
import com.microshop.actor.core.LifecycleSignal;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 无状态订单 Actor
 * 每个请求模拟一段处理耗时后回复，不保留订单数据
 */
@Slf4j
public class OrderActor extends Actor<OrderCommand> {

    private final Duration processingDelay;

    public OrderActor() {
        this(Duration.ofMillis(100));
    }

    public OrderActor(Duration processingDelay) {
        this.processingDelay = processingDelay;
    }

    @Override
    protected Object receive(OrderCommand message, ActorContext<OrderCommand> context) {
        return message.accept(new OrderCommand.Visitor<Object>() {
            @Override
            public Object onCreateOrder(OrderCommand.CreateOrder command) {
                log.info("Creating order: userId={}, itemCount={}", command.userId(), command.items().size());
                simulateProcessing();
                return new OrderResponse(OrderIds.next(), OrderStatus.CREATED, "Order created successfully");
            }

            @Override
            public Object onGetOrderStatus(OrderCommand.GetOrderStatus command) {
                log.info("Getting order status: orderId={}", command.orderId());
                return new OrderStatus(command.orderId(), OrderStatus.PROCESSING);
            }
        });
    }

    @Override
    protected void onSignal(LifecycleSignal signal, ActorContext<OrderCommand> context) {
        switch (signal) {
            case STARTED:
                log.info("Order actor started: name={}", context.name());
                break;
            case STOPPING:
                log.info("Order actor stopping: name={}", context.name());
                break;
            case STOPPED:
                log.info("Order actor stopped: name={}", context.name());
                break;
            default:
                break;
        }
    }

    private void simulateProcessing() {
        if (processingDelay.isZero()) {
            return;
        }
        try {
            Thread.sleep(processingDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("order processing interrupted", e);
        }
    }
}
