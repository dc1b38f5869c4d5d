package com.microshop.actor.service;

import com.microshop.actor.config.ActorServiceConfiguration;
import com.microshop.actor.core.ActorSystem;
import com.microshop.actor.core.ActorSystemConfig;
import com.microshop.actor.order.OrderResponse;
import com.microshop.actor.order.OrderStatus;
import com.microshop.actor.order.OrderStoreCommand;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Actor 服务装配测试
 */
@SpringBootTest(classes = {ActorServiceConfiguration.class, ActorServiceManager.class},
    properties = {
        "microshop.actor.name=actor-service-test",
        "microshop.actor.dispatcher-threads=3",
        "microshop.actor.request-timeout=3s"
    })
class ActorServiceManagerTest {

    @Autowired
    private ActorSystemConfig actorSystemConfig;

    @Autowired
    private ActorSystem actorSystem;

    @Autowired
    private ActorServiceManager manager;

    @Test
    void testConfigurationBinding() {
        assertEquals("actor-service-test", actorSystemConfig.getName());
        assertEquals(3, actorSystemConfig.getDispatcherThreads());
        assertEquals(Duration.ofSeconds(3), actorSystemConfig.getRequestTimeout());
        assertEquals(20, actorSystemConfig.getThroughput());
    }

    @Test
    void testActorsSpawnedOnStartup() {
        assertTrue(actorSystem.lookup(ActorServiceManager.ORDER_ACTOR).isPresent());
        assertTrue(actorSystem.lookup(ActorServiceManager.NOTIFICATION_ACTOR).isPresent());
        assertTrue(actorSystem.lookup(ActorServiceManager.ORDER_STORE_ACTOR).isPresent());
    }

    @Test
    void testOrderStoreReachableThroughManager() {
        OrderResponse created = actorSystem.ask(manager.getOrderStoreActor(),
            new OrderStoreCommand.CreateOrderCluster("u1", List.of())).result();

        OrderStatus status = actorSystem.ask(manager.getOrderStoreActor(),
            new OrderStoreCommand.GetOrderStatusCluster(created.orderId())).result();
        assertEquals(OrderStatus.PENDING, status.status());
    }

    @Test
    void testDemoOrderDoesNotThrow() {
        assertDoesNotThrow(manager::sendDemoOrder);
    }
}
