package com.microshop.actor.order;

import java.time.Instant;
import java.util.List;

/**
 * {@link OrderClusterActor} 持有的订单记录
 */
public record OrderInfo(String orderId, String userId, List<OrderItem> items, String status, Instant createdAt) {
}
