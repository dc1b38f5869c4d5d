package com.microshop.actor.order;

/**
 * 订单状态查询的回复
 */
public record OrderStatus(String orderId, String status) {

    public static final String PENDING = "pending";
    public static final String PROCESSING = "processing";
    public static final String CREATED = "created";
    public static final String NOT_FOUND = "not found";
}
