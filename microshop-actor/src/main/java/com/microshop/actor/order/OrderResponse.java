package com.microshop.actor.order;

/**
 * 创建订单的回复
 */
public record OrderResponse(String orderId, String status, String message) {
}
