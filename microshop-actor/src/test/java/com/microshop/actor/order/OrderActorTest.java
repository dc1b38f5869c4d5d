package com.microshop.actor.order;

import com.microshop.actor.core.ActorRef;
import com.microshop.actor.core.ActorSystem;
import com.microshop.actor.core.ActorSystemConfig;
import com.microshop.actor.core.AskTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderActorTest {

    private ActorSystem system;

    @BeforeEach
    void setUp() {
        ActorSystemConfig config = new ActorSystemConfig();
        config.setName("order-test");
        config.setDispatcherThreads(2);
        system = new ActorSystem(config);
    }

    @AfterEach
    void tearDown() {
        system.shutdown();
    }

    @Test
    void testCreateOrderReplyAfterProcessingDelay() {
        ActorRef<OrderCommand> ref = system.spawn(OrderActor::new, "order-actor");

        OrderResponse response = system.ask(ref,
            new OrderCommand.CreateOrder("user-123", List.of(new OrderItem("prod-1", "Product 1", 2, 99.99))),
            Duration.ofSeconds(5)).result();

        assertEquals(OrderStatus.CREATED, response.status());
        assertEquals("Order created successfully", response.message());
        assertTrue(response.orderId().startsWith("ORD-"));
    }

    @Test
    void testOrderStatusIsProcessing() {
        ActorRef<OrderCommand> ref = system.spawn(() -> new OrderActor(Duration.ZERO), "order-actor");

        OrderStatus status = system.ask(ref, new OrderCommand.GetOrderStatus("ORD-1"), Duration.ofSeconds(5)).result();

        assertEquals(new OrderStatus("ORD-1", OrderStatus.PROCESSING), status);
    }

    @Test
    void testSlowOrderTimesOut() {
        ActorRef<OrderCommand> ref = system.spawn(() -> new OrderActor(Duration.ofMillis(500)), "order-actor");

        assertThrows(AskTimeoutException.class, () -> system.ask(ref,
            new OrderCommand.CreateOrder("user-1", List.of()), Duration.ofMillis(50)).result());
    }
}
