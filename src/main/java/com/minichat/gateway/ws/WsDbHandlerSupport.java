package com.minichat.gateway.ws;

import com.minichat.config.ChatDbExecutorProperties;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * WS 帧处理器的公共部分：业务调用一律放到 DB 线程池，并带上超时。
 */
abstract class WsDbHandlerSupport {

    private final Executor dbExecutor;
    private final long taskTimeoutMs;

    protected WsDbHandlerSupport(Executor dbExecutor, ChatDbExecutorProperties dbProps) {
        this.dbExecutor = dbExecutor;
        this.taskTimeoutMs = dbProps.taskTimeoutEffective().toMillis();
    }

    protected <T> CompletableFuture<T> onDb(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, dbExecutor).orTimeout(taskTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
