package com.microshop.actor.core;

import java.util.concurrent.CompletableFuture;

/**
 * Actor 地址
 * 名称在 Actor 存活期间进程内唯一
 *
 * @param <M> 消息协议类型
 */
public final class ActorRef<M> {

    private final String name;
    private final Mailbox<M> mailbox;

    ActorRef(String name, Mailbox<M> mailbox) {
        this.name = name;
        this.mailbox = mailbox;
    }

    public String name() {
        return name;
    }

    public MailboxState state() {
        return mailbox.getState();
    }

    public boolean isTerminated() {
        return mailbox.getState() == MailboxState.STOPPED;
    }

    boolean deliver(M message, CompletableFuture<Object> reply) {
        return mailbox.offer(message, reply);
    }

    Mailbox<M> mailbox() {
        return mailbox;
    }

    @Override
    public String toString() {
        return "ActorRef[" + name + "]";
    }
}
