package com.minichat.gateway.ws;

import io.netty.channel.Channel;
import io.netty.channel.EventLoop;
import io.netty.util.Attribute;
import io.netty.util.AttributeKey;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 单连接入站帧的串行队列：挂在 channel 上的一条 future 链，前一帧处理完才开始下一帧。
 *
 * <p>任务本身在 channel 的 eventLoop 上启动，阻塞部分由任务自己切到 DB 线程池。
 * 前一个任务失败不会阻断后续任务；调用方拿到的 future 仍带着自己的异常。</p>
 */
public final class WsInboundQueue {

    static final String QUEUE_FULL = "ws_inbound_queue_full";

    private static final AttributeKey<AtomicReference<CompletableFuture<Void>>> ATTR_TAIL =
            AttributeKey.valueOf("chat:ws:inbound:tail");

    private static final AttributeKey<AtomicInteger> ATTR_PENDING =
            AttributeKey.valueOf("chat:ws:inbound:pending");

    private WsInboundQueue() {
    }

    /**
     * 排队数达到 maxPending 时直接失败（{@link RejectedExecutionException}），不入队。
     */
    public static CompletableFuture<Void> tryEnqueue(Channel channel,
                                                     Supplier<? extends CompletionStage<?>> task,
                                                     int maxPending) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(task, "task");
        AtomicInteger pending = attr(channel, ATTR_PENDING, AtomicInteger::new);
        if (pending.get() >= Math.max(1, maxPending)) {
            return CompletableFuture.failedFuture(new RejectedExecutionException(QUEUE_FULL));
        }
        return enqueue(channel, task);
    }

    public static CompletableFuture<Void> enqueue(Channel channel, Supplier<? extends CompletionStage<?>> task) {
        AtomicReference<CompletableFuture<Void>> tail =
                attr(channel, ATTR_TAIL, () -> new AtomicReference<>(CompletableFuture.completedFuture(null)));
        AtomicInteger pending = attr(channel, ATTR_PENDING, AtomicInteger::new);

        pending.incrementAndGet();
        CompletableFuture<Void> result = new CompletableFuture<>();
        CompletableFuture<Void> settled = result.handle((v, e) -> null);
        CompletableFuture<Void> prev = tail.getAndSet(settled);

        prev.whenComplete((v, e) -> startOn(channel.eventLoop(), task, result, pending));
        return result;
    }

    public static int pending(Channel channel) {
        AtomicInteger pending = channel.attr(ATTR_PENDING).get();
        return pending == null ? 0 : pending.get();
    }

    private static void startOn(EventLoop loop, Supplier<? extends CompletionStage<?>> task,
                                CompletableFuture<Void> result, AtomicInteger pending) {
        if (loop.inEventLoop()) {
            run(task, result, pending);
            return;
        }
        try {
            loop.execute(() -> run(task, result, pending));
        } catch (RejectedExecutionException e) {
            finish(result, pending, e);
        }
    }

    private static void run(Supplier<? extends CompletionStage<?>> task, CompletableFuture<Void> result, AtomicInteger pending) {
        CompletionStage<?> stage;
        try {
            stage = task.get();
        } catch (Throwable t) {
            finish(result, pending, t);
            return;
        }
        if (stage == null) {
            finish(result, pending, null);
            return;
        }
        stage.whenComplete((v, e) -> finish(result, pending, e));
    }

    /**
     * 先减计数再完成 future：调用方看到完成时，排队数已经回落。
     */
    private static void finish(CompletableFuture<Void> result, AtomicInteger pending, Throwable e) {
        pending.decrementAndGet();
        if (e != null) {
            result.completeExceptionally(e);
        } else {
            result.complete(null);
        }
    }

    private static <T> T attr(Channel channel, AttributeKey<T> key, Supplier<T> init) {
        Attribute<T> attr = channel.attr(key);
        T existing = attr.get();
        if (existing != null) {
            return existing;
        }
        T created = init.get();
        T raced = attr.setIfAbsent(created);
        return raced == null ? created : raced;
    }
}
