package com.microshop.actor.notification;

import com.microshop.actor.core.ActorRef;
import com.microshop.actor.core.ActorSystem;
import com.microshop.actor.core.ActorSystemConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class NotificationActorTest {

    private final ActorSystem system = new ActorSystem(new ActorSystemConfig());

    @AfterEach
    void tearDown() {
        system.shutdown();
    }

    @Test
    void testSendNotification() {
        ActorRef<NotificationCommand> ref = system.spawn(NotificationActor::new, "notification-actor");

        NotificationResponse response = system.ask(ref,
            new NotificationCommand.SendNotification("user@example.com", "email", "Your order shipped"),
            Duration.ofSeconds(5)).result();

        assertTrue(response.success());
        assertEquals("Notification sent successfully", response.message());
    }
}
