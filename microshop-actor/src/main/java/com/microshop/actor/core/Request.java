package com.microshop.actor.core;

/**
 * 请求消息标记接口
 * 实现类通过 {@link ActorSystem#ask} 发送，处理器的返回值即为唯一的回复
 *
 * @param <R> 回复类型
 */
public interface Request<R> {
}
