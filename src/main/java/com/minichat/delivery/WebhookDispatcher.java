package com.minichat.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minichat.domain.dto.MessageView;
import com.minichat.domain.entity.UserEntity;
import com.minichat.gateway.config.WebhookProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * webhook 投递：POST 消息视图 JSON 到用户登记的地址，失败按指数退避重试。
 *
 * <p>所有失败（非 2xx、超时、网络错误）都可重试；重试用尽只记 WARN，结果为 false，不抛异常。</p>
 */
@Slf4j
@Component
public class WebhookDispatcher implements SmartLifecycle {

    private final WebhookProperties props;
    private final ObjectMapper objectMapper;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ExecutorService ioExecutor;
    private volatile HttpClient httpClient;

    public WebhookDispatcher(WebhookProperties props, ObjectMapper objectMapper) {
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger seq = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(props.ioThreadsEffective(), r -> {
            Thread t = new Thread(r, "chat-webhook-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.ioExecutor = executor;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(props.timeoutEffective())
                .executor(executor)
                .build();
        log.info("webhook dispatcher started: timeout={}, maxRetries={}, backoffBase={}",
                props.timeoutEffective(), props.maxRetriesEffective(), props.backoffBaseEffective());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        this.httpClient = null;
        ExecutorService executor = this.ioExecutor;
        this.ioExecutor = null;
        if (executor != null) {
            executor.shutdownNow();
        }
        log.info("webhook dispatcher stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * 投递给单个用户。没有 webhook 地址或 dispatcher 已停止时直接返回 false。
     */
    public CompletableFuture<Boolean> deliver(UserEntity target, MessageView view) {
        if (target == null || !target.hasWebhook() || view == null) {
            return CompletableFuture.completedFuture(false);
        }
        HttpClient client = this.httpClient;
        if (!running.get() || client == null) {
            log.debug("webhook dispatcher not running, skip: username={}", target.getUsername());
            return CompletableFuture.completedFuture(false);
        }

        HttpRequest request;
        try {
            byte[] body = objectMapper.writeValueAsBytes(view);
            request = HttpRequest.newBuilder(URI.create(target.getWebhookUrl().trim()))
                    .timeout(props.timeoutEffective())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("webhook request build failed: username={}, url={}, err={}",
                    target.getUsername(), target.getWebhookUrl(), e.toString());
            return CompletableFuture.completedFuture(false);
        }
        return attempt(client, request, target.getUsername(), view.getId(), 0);
    }

    /**
     * 并发投递给多个用户，排除 excludeUsername（通常是发送方）与 viewer。单个目标失败互不影响。
     */
    public CompletableFuture<Void> broadcast(MessageView view, Collection<UserEntity> targets, String excludeUsername) {
        if (targets == null || targets.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        List<CompletableFuture<Boolean>> all = new ArrayList<>();
        for (UserEntity u : targets) {
            if (u == null || u.isViewer() || !u.hasWebhook()) {
                continue;
            }
            if (excludeUsername != null && excludeUsername.equals(u.getUsername())) {
                continue;
            }
            all.add(deliver(u, view).exceptionally(e -> false));
        }
        return CompletableFuture.allOf(all.toArray(new CompletableFuture[0]));
    }

    /**
     * 第 attemptIndex 次失败后的等待时间：base * 2^attemptIndex。
     */
    Duration backoffDelay(int attemptIndex) {
        return props.backoffBaseEffective().multipliedBy(1L << Math.max(0, attemptIndex));
    }

    private CompletableFuture<Boolean> attempt(HttpClient client, HttpRequest request,
                                               String username, Long messageId, int attemptIndex) {
        if (!running.get()) {
            return CompletableFuture.completedFuture(false);
        }
        CompletableFuture<HttpResponse<Void>> send;
        try {
            send = client.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        } catch (Exception e) {
            send = CompletableFuture.failedFuture(e);
        }
        return send.handle((resp, err) -> {
            if (err == null && resp.statusCode() >= 200 && resp.statusCode() < 300) {
                if (attemptIndex > 0) {
                    log.info("webhook delivered after retry: username={}, messageId={}, attempts={}",
                            username, messageId, attemptIndex + 1);
                }
                return CompletableFuture.completedFuture(true);
            }
            String failure = err != null ? unwrap(err).toString() : "status=" + resp.statusCode();
            int max = props.maxRetriesEffective();
            if (attemptIndex + 1 >= max) {
                log.warn("webhook delivery failed: username={}, messageId={}, attempts={}, last={}",
                        username, messageId, max, failure);
                return CompletableFuture.completedFuture(false);
            }
            Duration delay = backoffDelay(attemptIndex);
            log.debug("webhook attempt failed, retrying: username={}, messageId={}, attempt={}, delayMs={}, err={}",
                    username, messageId, attemptIndex + 1, delay.toMillis(), failure);
            return CompletableFuture
                    .runAsync(() -> {
                    }, CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS))
                    .thenCompose(ignored -> attempt(client, request, username, messageId, attemptIndex + 1));
        }).thenCompose(f -> f);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
