package com.microshop.actor.notification;

import com.microshop.actor.core.Actor;
import com.microshop.actor.core.ActorContext;
import com.microshop.actor.core.LifecycleSignal;
import lombok.extern.slf4j.Slf4j;

/**
 * 通知 Actor
 */
@Slf4j
public class NotificationActor extends Actor<NotificationCommand> {

    @Override
    protected Object receive(NotificationCommand message, ActorContext<NotificationCommand> context) {
        return message.accept(command -> {
            log.info("Sending notification: recipient={}, type={}, message={}",
                command.recipient(), command.type(), command.message());
            return new NotificationResponse(true, "Notification sent successfully");
        });
    }

    @Override
    protected void onSignal(LifecycleSignal signal, ActorContext<NotificationCommand> context) {
        if (signal == LifecycleSignal.STARTED) {
            log.info("Notification actor started: name={}", context.name());
        }
    }
}
