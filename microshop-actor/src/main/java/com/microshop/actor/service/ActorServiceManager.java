package com.microshop.actor.service;

import com.microshop.actor.core.ActorRef;
import com.microshop.actor.core.ActorSystem;
import com.microshop.actor.core.ActorSystemConfig;
import com.microshop.actor.core.AskTimeoutException;
import com.microshop.actor.notification.NotificationActor;
import com.microshop.actor.notification.NotificationCommand;
import com.microshop.actor.order.OrderActor;
import com.microshop.actor.order.OrderClusterActor;
import com.microshop.actor.order.OrderCommand;
import com.microshop.actor.order.OrderItem;
import com.microshop.actor.order.OrderResponse;
import com.microshop.actor.order.OrderStoreCommand;
import com.microshop.common.audit.AuditSink;
import com.microshop.common.exception.MicroshopException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 启动订单相关 Actor，并在应用就绪后发送一次示例请求
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActorServiceManager {

    public static final String ORDER_ACTOR = "order-actor";
    public static final String NOTIFICATION_ACTOR = "notification-actor";
    public static final String ORDER_STORE_ACTOR = "order-cluster-actor";

    private static final long DEMO_DELAY_SECONDS = 2;

    private final ActorSystem actorSystem;
    private final ActorSystemConfig actorSystemConfig;
    private final AuditSink auditSink;

    private ActorRef<OrderCommand> orderActor;
    private ActorRef<NotificationCommand> notificationActor;
    private ActorRef<OrderStoreCommand> orderStoreActor;

    private ScheduledExecutorService scheduler;

    @PostConstruct
    public void initialize() {
        orderActor = actorSystem.spawn(OrderActor::new, ORDER_ACTOR);
        notificationActor = actorSystem.spawn(NotificationActor::new, NOTIFICATION_ACTOR);
        orderStoreActor = actorSystem.spawn(() -> new OrderClusterActor(auditSink), ORDER_STORE_ACTOR);

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "actor-service-demo");
            thread.setDaemon(true);
            return thread;
        });
        log.info("Local actors started: orderActor={}, notificationActor={}, orderStoreActor={}",
            orderActor.name(), notificationActor.name(), orderStoreActor.name());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        scheduler.schedule(this::sendDemoOrder, DEMO_DELAY_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * 示例：向订单 Actor 请求创建订单并记录结果
     */
    void sendDemoOrder() {
        OrderCommand.CreateOrder request = new OrderCommand.CreateOrder("user-123",
            List.of(new OrderItem("prod-1", "Product 1", 2, 99.99)));
        try {
            OrderResponse response = actorSystem.ask(orderActor, request, actorSystemConfig.getRequestTimeout()).result();
            log.info("Order created: orderId={}, status={}", response.orderId(), response.status());
        } catch (AskTimeoutException e) {
            log.error("Order actor did not reply in time: timeout={}ms", e.getTimeout().toMillis());
        } catch (MicroshopException e) {
            log.error("Failed to get response from order actor", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    public ActorRef<OrderCommand> getOrderActor() {
        return orderActor;
    }

    public ActorRef<NotificationCommand> getNotificationActor() {
        return notificationActor;
    }

    public ActorRef<OrderStoreCommand> getOrderStoreActor() {
        return orderStoreActor;
    }
}
