package com.microshop.actor.core;

import com.microshop.common.exception.MicroshopException;

/**
 * 目标 Actor 已开始停止，消息无法投递
 */
public class DeadLetterException extends MicroshopException {

    private static final long serialVersionUID = 1L;

    private final String actorName;

    public DeadLetterException(String actorName, Object message) {
        super("actor " + actorName + " is stopped, dead letter: " + message.getClass().getSimpleName());
        this.actorName = actorName;
    }

    public String getActorName() {
        return actorName;
    }
}
