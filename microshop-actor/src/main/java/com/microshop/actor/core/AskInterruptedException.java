package com.microshop.actor.core;

import com.microshop.common.exception.MicroshopException;

/**
 * 调用方在等待回复时被中断
 * 只说明调用方放弃等待，不代表 Actor 拒绝了请求；线程中断标记会被保留
 */
public class AskInterruptedException extends MicroshopException {

    private static final long serialVersionUID = 1L;

    private final String actorName;

    public AskInterruptedException(String actorName, InterruptedException cause) {
        super("interrupted while waiting for reply from actor " + actorName, cause);
        this.actorName = actorName;
    }

    public String getActorName() {
        return actorName;
    }
}
