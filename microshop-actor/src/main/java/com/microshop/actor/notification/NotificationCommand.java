package com.microshop.actor.notification;

import com.microshop.actor.core.Request;

/**
 * {@link NotificationActor} 接受的消息
 */
public sealed interface NotificationCommand permits NotificationCommand.SendNotification {

    <T> T accept(Visitor<T> visitor);

    interface Visitor<T> {

        T onSendNotification(SendNotification command);
    }

    /**
     * 发送通知，type 取值 email / sms / push
     */
    record SendNotification(String recipient, String type, String message)
        implements NotificationCommand, Request<NotificationResponse> {

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.onSendNotification(this);
        }
    }
}
