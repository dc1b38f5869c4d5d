package com.microshop.actor.order;

import com.microshop.actor.core.Actor;
import com.microshop.actor.core.ActorContext;
import com.microshop.actor.core.LifecycleSignal;
import com.microshop.common.audit.AuditEvent;
import com.microshop.common.audit.AuditSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * 有状态订单存储 Actor
 * <p>
 * 订单表只由本 Actor 在消息处理中读写，其他组件只能通过
 * {@link OrderStoreCommand} 访问；查询不存在的订单时回复 {@code not found} 状态而不是失败。
 */
@Slf4j
public class OrderClusterActor extends Actor<OrderStoreCommand> {

    private final AuditSink auditSink;
    private final Clock clock;

    private final OrderStoreCommand.Visitor<Object> handler = new Handler();

    private Map<String, OrderInfo> orders;

    public OrderClusterActor(AuditSink auditSink) {
        this(auditSink, Clock.systemUTC());
    }

    public OrderClusterActor(AuditSink auditSink, Clock clock) {
        this.auditSink = auditSink;
        this.clock = clock;
    }

    @Override
    protected void onSignal(LifecycleSignal signal, ActorContext<OrderStoreCommand> context) {
        if (signal == LifecycleSignal.STARTED) {
            orders = new HashMap<>();
        } else if (signal == LifecycleSignal.STOPPED) {
            log.info("Order store actor stopped: name={}, orders={}", context.name(), orders.size());
        }
    }

    @Override
    protected Object receive(OrderStoreCommand message, ActorContext<OrderStoreCommand> context) {
        return message.accept(handler);
    }

    private class Handler implements OrderStoreCommand.Visitor<Object> {

        @Override
        public Object onCreate(OrderStoreCommand.CreateOrderCluster command) {
            String orderId = OrderIds.next(clock);
            OrderInfo order = new OrderInfo(orderId, command.userId(), command.items(), OrderStatus.PENDING, clock.instant());
            orders.put(orderId, order);
            log.debug("Order stored: orderId={}, userId={}", orderId, command.userId());

            audit(AuditEvent.of("order.created", orderId, Map.of("userId", String.valueOf(command.userId()))));
            return new OrderResponse(orderId, OrderStatus.PENDING, "");
        }

        @Override
        public Object onGetStatus(OrderStoreCommand.GetOrderStatusCluster command) {
            OrderInfo order = orders.get(command.orderId());
            if (order == null) {
                return new OrderStatus(command.orderId(), OrderStatus.NOT_FOUND);
            }
            return new OrderStatus(order.orderId(), order.status());
        }
    }

    private void audit(AuditEvent event) {
        try {
            auditSink.record(event);
        } catch (RuntimeException e) {
            log.warn("Failed to record audit event: type={}, subject={}", event.type(), event.subject(), e);
        }
    }
}
