package com.microshop.actor.order;

/**
 * 订单项
 */
public record OrderItem(String productId, String productName, int quantity, double price) {
}
