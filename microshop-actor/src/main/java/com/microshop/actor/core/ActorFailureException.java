package com.microshop.actor.core;

import com.microshop.common.exception.MicroshopException;

/**
 * Actor 处理请求失败
 * 与 {@link AskTimeoutException} 区分：前者表示请求被拒绝，后者表示响应过慢
 */
public class ActorFailureException extends MicroshopException {

    private static final long serialVersionUID = 1L;

    private final String actorName;

    public ActorFailureException(String actorName, Throwable cause) {
        super("actor " + actorName + " failed: " + cause.getMessage(), cause);
        this.actorName = actorName;
    }

    public ActorFailureException(String actorName, String reason) {
        super("actor " + actorName + " failed: " + reason);
        this.actorName = actorName;
    }

    public String getActorName() {
        return actorName;
    }
}
