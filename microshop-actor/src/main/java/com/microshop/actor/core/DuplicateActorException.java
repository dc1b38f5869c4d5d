package com.microshop.actor.core;

import com.microshop.common.exception.MicroshopException;

/**
 * 名称已被存活的 Actor 占用
 */
public class DuplicateActorException extends MicroshopException {

    private static final long serialVersionUID = 1L;

    public DuplicateActorException(String actorName) {
        super("actor name already in use: " + actorName);
    }
}
