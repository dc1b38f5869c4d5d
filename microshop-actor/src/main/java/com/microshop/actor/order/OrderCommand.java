package com.microshop.actor.order;

import com.microshop.actor.core.Request;

import java.util.List;

/**
 * {@link OrderActor} 接受的消息
 */
public sealed interface OrderCommand permits OrderCommand.CreateOrder, OrderCommand.GetOrderStatus {

    <T> T accept(Visitor<T> visitor);

    /**
     * 按消息类型分派的处理器，新增消息类型时必须同时扩展此接口
     */
    interface Visitor<T> {

        T onCreateOrder(CreateOrder command);

        T onGetOrderStatus(GetOrderStatus command);
    }

    /**
     * 创建订单
     */
    record CreateOrder(String userId, List<OrderItem> items) implements OrderCommand, Request<OrderResponse> {

        public CreateOrder {
            items = items == null ? List.of() : List.copyOf(items);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.onCreateOrder(this);
        }
    }

    /**
     * 查询订单状态
     */
    record GetOrderStatus(String orderId) implements OrderCommand, Request<OrderStatus> {

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.onGetOrderStatus(this);
        }
    }
}
