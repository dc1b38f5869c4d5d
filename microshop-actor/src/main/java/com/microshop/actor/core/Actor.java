package com.microshop.actor.core;

/**
 * 顺序处理消息的独立单元
 * <p>
 * 同一个 Actor 同时只处理一条消息，处理完成后才接收下一条，按入队顺序（FIFO）处理。
 * Actor 的私有状态只能由自身在 {@link #receive} 和 {@link #onSignal} 中访问，
 * 其他组件只能通过消息交互，因此状态访问不需要加锁。
 * <p>
 * 回复约定：对请求消息，{@link #receive} 的返回值就是该请求唯一的回复，
 * 返回 {@code null} 视为违反约定，请求以 {@link ActorFailureException} 失败；
 * 对即发即弃消息，返回值被忽略。
 *
 * @param <M> 消息协议类型
 */
public abstract class Actor<M> {

    /**
     * 处理一条消息
     *
     * @param message 消息
     * @param context 上下文
     * @return 请求的回复，即发即弃消息可返回任意值
     * @throws Exception 处理失败
     */
    protected abstract Object receive(M message, ActorContext<M> context) throws Exception;

    /**
     * 处理生命周期信号
     *
     * @param signal  信号
     * @param context 上下文
     */
    protected void onSignal(LifecycleSignal signal, ActorContext<M> context) {
    }
}
