package com.microshop.actor.core;

/**
 * 经由邮箱投递的生命周期信号
 * STARTED 在任何用户消息之前恰好投递一次；STOPPING、STOPPED 在关闭时按序各投递一次
 */
public enum LifecycleSignal {
    STARTED,
    STOPPING,
    STOPPED
}
