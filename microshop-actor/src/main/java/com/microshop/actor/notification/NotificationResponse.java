package com.microshop.actor.notification;

/**
 * 通知发送结果
 */
public record NotificationResponse(boolean success, String message) {
}
