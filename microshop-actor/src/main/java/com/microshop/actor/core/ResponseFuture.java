package com.microshop.actor.core;

import com.microshop.common.exception.MicroshopException;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 请求的回复句柄
 * 以唯一回复完成，或在超时后以 {@link AskTimeoutException} 失败
 *
 * @param <R> 回复类型
 */
public final class ResponseFuture<R> {

    private final String actorName;
    private final Duration timeout;
    private final CompletableFuture<R> future;

    ResponseFuture(String actorName, Duration timeout, CompletableFuture<R> future) {
        this.actorName = actorName;
        this.timeout = timeout;
        this.future = future;
    }

    /**
     * 阻塞等待回复
     *
     * @return 回复
     * @throws AskTimeoutException   超时未回复
     * @throws ActorFailureException Actor 处理失败
     * @throws AskInterruptedException 调用线程在等待期间被中断，请求可能仍在处理
     */
    public R result() {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AskInterruptedException(actorName, e);
        } catch (ExecutionException e) {
            throw translate(e.getCause());
        }
    }

    /**
     * 非阻塞查询回复
     *
     * @return 已成功完成时返回回复
     */
    public Optional<R> poll() {
        if (!future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.ofNullable(future.join());
    }

    public boolean isDone() {
        return future.isDone();
    }

    public Duration getTimeout() {
        return timeout;
    }

    public CompletableFuture<R> toCompletableFuture() {
        return future.copy();
    }

    private RuntimeException translate(Throwable cause) {
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof MicroshopException microshopException) {
            return microshopException;
        }
        return new ActorFailureException(actorName, cause);
    }
}
