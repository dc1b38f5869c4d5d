package com.microshop.actor.core;

import lombok.Data;

import java.time.Duration;

/**
 * Actor 系统配置
 */
@Data
public class ActorSystemConfig {

    /**
     * 系统名称，用于线程命名与日志
     */
    private String name = "microshop";

    /**
     * 分发线程数
     */
    private int dispatcherThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    /**
     * 每次调度单个邮箱最多处理的消息数
     */
    private int throughput = 20;

    /**
     * 默认请求超时
     */
    private Duration requestTimeout = Duration.ofSeconds(5);

    /**
     * 关闭时等待 Actor 停止的时间
     */
    private Duration shutdownTimeout = Duration.ofSeconds(10);
}
