package com.microshop.actor.core;

/**
 * 邮箱生命周期状态，单调推进，进入 STOPPED 后不再变化
 */
public enum MailboxState {

    /**
     * 已创建，STARTED 信号尚未处理
     */
    STARTING,

    /**
     * 正常处理消息
     */
    RUNNING,

    /**
     * 已请求停止，不再接受新消息
     */
    STOPPING,

    /**
     * 已停止
     */
    STOPPED;

    public boolean isAcceptingMessages() {
        return this == STARTING || this == RUNNING;
    }
}
