package com.microshop.actor.core;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Actor 系统
 * <p>
 * 持有全部已创建的 Actor，为每个 Actor 分配稳定名称，并负责点对点消息与请求/回复的路由。
 * 由调用方显式创建并在退出时调用 {@link #shutdown()}。
 */
@Slf4j
public class ActorSystem implements AutoCloseable {

    private final ActorSystemConfig config;
    private final ExecutorService dispatcher;

    // 名称 -> 存活的 Actor
    private final ConcurrentMap<String, ActorRef<?>> actors = new ConcurrentHashMap<>();
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    private final Counter processedCounter;
    private final Counter deadLetterCounter;
    private final Counter askTimeoutCounter;

    public ActorSystem(ActorSystemConfig config) {
        this(config, new SimpleMeterRegistry());
    }

    public ActorSystem(ActorSystemConfig config, MeterRegistry meterRegistry) {
        this.config = config;
        AtomicInteger threadIndex = new AtomicInteger();
        this.dispatcher = Executors.newFixedThreadPool(config.getDispatcherThreads(), r -> {
            // 非守护线程：存活的 Actor 系统保持进程运行，直到 shutdown
            return new Thread(r, config.getName() + "-dispatcher-" + threadIndex.incrementAndGet());
        });
        this.processedCounter = Counter.builder("actor.messages.processed")
            .description("Number of user messages processed by actors")
            .tag("system", config.getName())
            .register(meterRegistry);
        this.deadLetterCounter = Counter.builder("actor.deadletters")
            .description("Number of messages sent to stopped actors")
            .tag("system", config.getName())
            .register(meterRegistry);
        this.askTimeoutCounter = Counter.builder("actor.ask.timeouts")
            .description("Number of requests that timed out before a reply")
            .tag("system", config.getName())
            .register(meterRegistry);
        log.info("Actor system started: name={}, dispatcherThreads={}", config.getName(), config.getDispatcherThreads());
    }

    /**
     * 创建 Actor
     *
     * @param producer Actor 实例工厂
     * @param name     名称，存活期间唯一
     * @return Actor 地址
     * @throws DuplicateActorException 名称已被存活的 Actor 占用
     */
    public <M> ActorRef<M> spawn(Supplier<? extends Actor<M>> producer, String name) {
        Objects.requireNonNull(name, "name");
        if (terminated.get()) {
            throw new IllegalStateException("actor system " + config.getName() + " is terminated");
        }
        if (actors.containsKey(name)) {
            throw new DuplicateActorException(name);
        }

        ActorContext<M> context = new ActorContext<>(this);
        Mailbox<M> mailbox = new Mailbox<>(name, producer.get(), context, dispatcher, this, config.getThroughput());
        ActorRef<M> ref = new ActorRef<>(name, mailbox);
        context.bind(ref);

        if (actors.putIfAbsent(name, ref) != null) {
            throw new DuplicateActorException(name);
        }
        // 与 shutdown 并发时：已登记的 Actor 要么被 shutdown 看到并停止，要么在这里撤销
        if (terminated.get()) {
            actors.remove(name, ref);
            throw new IllegalStateException("actor system " + config.getName() + " is terminated");
        }
        mailbox.start();
        log.info("Actor spawned: name={}", name);
        return ref;
    }

    /**
     * 投递即发即弃消息，不阻塞发送方
     *
     * @throws DeadLetterException 目标已开始停止
     */
    public <M> void tell(ActorRef<M> ref, M message) {
        Objects.requireNonNull(message, "message");
        if (!ref.deliver(message, null)) {
            throw deadLetter(ref, message);
        }
    }

    /**
     * 使用默认超时发送请求
     */
    public <Q extends Request<R>, R> ResponseFuture<R> ask(ActorRef<? super Q> ref, Q request) {
        return ask(ref, request, config.getRequestTimeout());
    }

    /**
     * 发送请求并返回回复句柄
     * 超时后迟到的回复被丢弃
     *
     * @param ref     目标 Actor
     * @param request 请求消息
     * @param timeout 等待回复的超时时间
     * @return 回复句柄
     * @throws DeadLetterException 目标已开始停止
     */
    @SuppressWarnings("unchecked")
    public <Q extends Request<R>, R> ResponseFuture<R> ask(ActorRef<? super Q> ref, Q request, Duration timeout) {
        Objects.requireNonNull(request, "request");
        CompletableFuture<Object> reply = new CompletableFuture<>();
        if (!ref.deliver(request, reply)) {
            throw deadLetter(ref, request);
        }

        CompletableFuture<R> result = new CompletableFuture<>();
        reply.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).whenComplete((value, error) -> {
            if (error == null) {
                result.complete((R) value);
            } else if (error instanceof TimeoutException) {
                askTimeoutCounter.increment();
                log.debug("Request timed out: actor={}, request={}", ref.name(), request.getClass().getSimpleName());
                result.completeExceptionally(new AskTimeoutException(ref.name(), timeout));
            } else {
                result.completeExceptionally(error);
            }
        });
        return new ResponseFuture<>(ref.name(), timeout, result);
    }

    /**
     * 请求优雅停止：正在处理的消息完成后，依次投递 STOPPING 和 STOPPED
     *
     * @return 停止完成的通知
     */
    public CompletableFuture<Void> stop(ActorRef<?> ref) {
        return ref.mailbox().stop();
    }

    /**
     * 按名称查找存活的 Actor
     */
    public Optional<ActorRef<?>> lookup(String name) {
        return Optional.ofNullable(actors.get(name));
    }

    public int getActorCount() {
        return actors.size();
    }

    public String getName() {
        return config.getName();
    }

    public double getDeadLetterCount() {
        return deadLetterCounter.count();
    }

    /**
     * 停止全部 Actor 并关闭分发线程池
     */
    public void shutdown() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down actor system: name={}, actors={}", config.getName(), actors.size());

        List<CompletableFuture<Void>> stopping = new ArrayList<>();
        for (ActorRef<?> ref : actors.values()) {
            stopping.add(stop(ref));
        }
        Duration timeout = config.getShutdownTimeout();
        try {
            CompletableFuture.allOf(stopping.toArray(new CompletableFuture[0]))
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Actors did not stop cleanly within {}ms: remaining={}", timeout.toMillis(), actors.keySet(), e);
        }

        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Dispatcher did not terminate in time, forcing shutdown");
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
        log.info("Actor system terminated: name={}", config.getName());
    }

    @Override
    public void close() {
        shutdown();
    }

    void onTerminated(Mailbox<?> mailbox) {
        actors.computeIfPresent(mailbox.getName(), (name, ref) -> ref.mailbox() == mailbox ? null : ref);
    }

    void recordProcessed() {
        processedCounter.increment();
    }

    private DeadLetterException deadLetter(ActorRef<?> ref, Object message) {
        deadLetterCounter.increment();
        log.warn("Dead letter: actor={}, message={}", ref.name(), message.getClass().getSimpleName());
        return new DeadLetterException(ref.name(), message);
    }
}
