package com.microshop.actor.core;

import lombok.extern.slf4j.Slf4j;

import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Actor 私有收件箱
 * <p>
 * 邮箱同一时刻最多被调度到一个分发线程上，从而保证单个 Actor 内部严格顺序处理。
 * 每次调度最多处理 {@code throughput} 条消息，然后让出线程。
 */
@Slf4j
final class Mailbox<M> implements Runnable {

    private final String name;
    private final Actor<M> actor;
    private final ActorContext<M> context;
    private final Executor dispatcher;
    private final ActorSystem system;
    private final int throughput;

    private final Queue<Envelope<M>> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private final Object stateLock = new Object();

    private volatile MailboxState state = MailboxState.STARTING;

    Mailbox(String name, Actor<M> actor, ActorContext<M> context, Executor dispatcher,
            ActorSystem system, int throughput) {
        this.name = name;
        this.actor = actor;
        this.context = context;
        this.dispatcher = dispatcher;
        this.system = system;
        this.throughput = throughput;
        // STARTED 先于任何用户消息入队
        queue.add(new Envelope.Signal<>(LifecycleSignal.STARTED));
    }

    void start() {
        schedule();
    }

    /**
     * 投递用户消息
     *
     * @param message 消息
     * @param reply   请求的回复通道，即发即弃消息为 null
     * @return 邮箱已开始停止时返回 false
     */
    boolean offer(M message, CompletableFuture<Object> reply) {
        synchronized (stateLock) {
            if (!state.isAcceptingMessages()) {
                return false;
            }
            queue.add(new Envelope.Deliver<>(message, reply));
        }
        schedule();
        return true;
    }

    /**
     * 请求优雅停止：已入队消息处理完后依次投递 STOPPING、STOPPED
     *
     * @return 停止完成的通知
     */
    CompletableFuture<Void> stop() {
        boolean enqueued = false;
        synchronized (stateLock) {
            if (state.isAcceptingMessages()) {
                state = MailboxState.STOPPING;
                queue.add(new Envelope.Signal<>(LifecycleSignal.STOPPING));
                queue.add(new Envelope.Signal<>(LifecycleSignal.STOPPED));
                enqueued = true;
            }
        }
        if (enqueued) {
            log.debug("Actor stop requested: name={}", name);
            schedule();
        }
        return terminated;
    }

    MailboxState getState() {
        return state;
    }

    CompletableFuture<Void> terminationFuture() {
        return terminated;
    }

    String getName() {
        return name;
    }

    @Override
    public void run() {
        try {
            for (int i = 0; i < throughput; i++) {
                Envelope<M> envelope = queue.poll();
                if (envelope == null) {
                    break;
                }
                process(envelope);
            }
        } finally {
            scheduled.set(false);
            if (!queue.isEmpty() && state != MailboxState.STOPPED) {
                schedule();
            }
        }
    }

    private void schedule() {
        if (scheduled.compareAndSet(false, true)) {
            try {
                dispatcher.execute(this);
            } catch (RejectedExecutionException e) {
                scheduled.set(false);
                log.error("Dispatcher rejected mailbox: name={}", name, e);
            }
        }
    }

    private void process(Envelope<M> envelope) {
        if (envelope instanceof Envelope.Signal<M> signal) {
            processSignal(signal.signal());
        } else if (envelope instanceof Envelope.Deliver<M> deliver) {
            processMessage(deliver.message(), deliver.reply());
        }
    }

    private void processSignal(LifecycleSignal signal) {
        if (signal == LifecycleSignal.STARTED) {
            synchronized (stateLock) {
                if (state == MailboxState.STARTING) {
                    state = MailboxState.RUNNING;
                }
            }
        }

        try {
            actor.onSignal(signal, context);
        } catch (Throwable e) {
            log.error("Actor failed handling signal: name={}, signal={}", name, signal, e);
            rethrowIfFatal(e);
        } finally {
            if (signal == LifecycleSignal.STOPPED) {
                state = MailboxState.STOPPED;
                system.onTerminated(this);
                terminated.complete(null);
                log.debug("Actor stopped: name={}", name);
            }
        }
    }

    private void processMessage(M message, CompletableFuture<Object> reply) {
        Object result;
        try {
            result = actor.receive(message, context);
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (reply != null) {
                reply.completeExceptionally(new ActorFailureException(name, e));
            } else {
                // 即发即弃消息失败后继续处理下一条
                log.error("Actor failed processing message: name={}, message={}",
                    name, message.getClass().getSimpleName(), e);
            }
            system.recordProcessed();
            rethrowIfFatal(e);
            return;
        }
        system.recordProcessed();

        if (reply == null) {
            return;
        }
        if (result == null) {
            reply.completeExceptionally(new ActorFailureException(name,
                "no reply produced for " + message.getClass().getSimpleName()));
        } else if (!reply.complete(result)) {
            log.debug("Discarding late reply: name={}, message={}", name, message.getClass().getSimpleName());
        }
    }

    /**
     * 虚拟机级错误在完成回复后继续抛出，其余错误只影响当前消息
     */
    private void rethrowIfFatal(Throwable e) {
        if (e instanceof VirtualMachineError) {
            log.error("Fatal error in actor: name={}", name, e);
            throw (VirtualMachineError) e;
        }
    }

    /**
     * 邮箱内部信封
     */
    private sealed interface Envelope<M> permits Envelope.Signal, Envelope.Deliver {

        record Signal<M>(LifecycleSignal signal) implements Envelope<M> {
        }

        record Deliver<M>(M message, CompletableFuture<Object> reply) implements Envelope<M> {
        }
    }
}
