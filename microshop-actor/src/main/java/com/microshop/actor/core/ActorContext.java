package com.microshop.actor.core;

/**
 * Actor 运行上下文
 *
 * @param <M> 消息协议类型
 */
public final class ActorContext<M> {

    private final ActorSystem system;
    private ActorRef<M> self;

    ActorContext(ActorSystem system) {
        this.system = system;
    }

    void bind(ActorRef<M> self) {
        this.self = self;
    }

    public ActorRef<M> self() {
        return self;
    }

    public ActorSystem system() {
        return system;
    }

    public String name() {
        return self.name();
    }
}
