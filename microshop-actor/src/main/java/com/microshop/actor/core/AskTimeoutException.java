package com.microshop.actor.core;

import com.microshop.common.exception.MicroshopException;

import java.time.Duration;

/**
 * 请求在超时内未收到回复
 * 超时只取消调用方的等待，不撤回已投递的请求
 */
public class AskTimeoutException extends MicroshopException {

    private static final long serialVersionUID = 1L;

    private final String actorName;
    private final Duration timeout;

    public AskTimeoutException(String actorName, Duration timeout) {
        super("request to actor " + actorName + " timed out after " + timeout.toMillis() + "ms");
        this.actorName = actorName;
        this.timeout = timeout;
    }

    public String getActorName() {
        return actorName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
