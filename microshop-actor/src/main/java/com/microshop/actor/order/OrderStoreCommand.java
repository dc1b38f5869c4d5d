package com.microshop.actor.order;

import com.microshop.actor.core.Request;

import java.util.List;

/**
 * {@link OrderClusterActor} 接受的消息
 */
public sealed interface OrderStoreCommand
    permits OrderStoreCommand.CreateOrderCluster, OrderStoreCommand.GetOrderStatusCluster {

    <T> T accept(Visitor<T> visitor);

    interface Visitor<T> {

        T onCreate(CreateOrderCluster command);

        T onGetStatus(GetOrderStatusCluster command);
    }

    /**
     * 创建并保存订单
     */
    record CreateOrderCluster(String userId, List<OrderItem> items)
        implements OrderStoreCommand, Request<OrderResponse> {

        public CreateOrderCluster {
            items = items == null ? List.of() : List.copyOf(items);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.onCreate(this);
        }
    }

    /**
     * 查询已保存订单的状态
     */
    record GetOrderStatusCluster(String orderId) implements OrderStoreCommand, Request<OrderStatus> {

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.onGetStatus(this);
        }
    }
}
