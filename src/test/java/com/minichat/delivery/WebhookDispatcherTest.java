package com.minichat.delivery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minichat.domain.dto.MessageView;
import com.minichat.domain.entity.UserEntity;
import com.minichat.domain.enums.Role;
import com.minichat.gateway.config.WebhookProperties;
import com.minichat.support.TestUsers;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookDispatcherTest {

    private HttpServer server;
    private WebhookDispatcher dispatcher;
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private final AtomicInteger hits = new AtomicInteger();
    private final ConcurrentLinkedQueue<String> bodies = new ConcurrentLinkedQueue<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hook", exchange -> {
            hits.incrementAndGet();
            bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            int status = failuresLeft.getAndDecrement() > 0 ? 500 : 200;
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        });
        server.start();

        dispatcher = new WebhookDispatcher(
                new WebhookProperties(Duration.ofSeconds(2), 3, Duration.ofMillis(10), 2), new ObjectMapper());
        dispatcher.start();
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
        server.stop(0);
    }

    @Test
    void successfulPostCarriesMessageJson() throws Exception {
        boolean ok = dispatcher.deliver(target("bob"), view()).get(5, TimeUnit.SECONDS);

        assertThat(ok).isTrue();
        assertThat(hits.get()).isEqualTo(1);
        assertThat(bodies.peek()).contains("\"from_username\":\"alice\"").contains("\"content\":\"hi\"");
    }

    @Test
    void retriesUntilSuccess() throws Exception {
        failuresLeft.set(2);

        boolean ok = dispatcher.deliver(target("bob"), view()).get(5, TimeUnit.SECONDS);

        assertThat(ok).isTrue();
        assertThat(hits.get()).isEqualTo(3);
    }

    @Test
    void givesUpAfterMaxAttempts() throws Exception {
        failuresLeft.set(100);

        boolean ok = dispatcher.deliver(target("bob"), view()).get(5, TimeUnit.SECONDS);

        assertThat(ok).isFalse();
        assertThat(hits.get()).isEqualTo(3);
    }

    @Test
    void unreachableEndpointResolvesFalse() throws Exception {
        UserEntity u = TestUsers.withWebhook(TestUsers.member("bob"), "http://127.0.0.1:1/hook");

        assertThat(dispatcher.deliver(u, view()).get(5, TimeUnit.SECONDS)).isFalse();
    }

    @Test
    void targetWithoutWebhookIsSkipped() throws Exception {
        assertThat(dispatcher.deliver(TestUsers.member("bob"), view()).get(1, TimeUnit.SECONDS)).isFalse();
        assertThat(hits.get()).isZero();
    }

    @Test
    void stoppedDispatcherDeliversNothing() throws Exception {
        dispatcher.stop();

        assertThat(dispatcher.deliver(target("bob"), view()).get(1, TimeUnit.SECONDS)).isFalse();
        assertThat(hits.get()).isZero();
    }

    @Test
    void broadcastSkipsViewersAndExcludedSender() throws Exception {
        UserEntity viewer = TestUsers.withWebhook(TestUsers.user("watcher", Role.VIEWER), url());

        dispatcher.broadcast(view(), List.of(target("alice"), target("bob"), target("carol"), viewer), "alice")
                .get(5, TimeUnit.SECONDS);

        assertThat(hits.get()).isEqualTo(2);
    }

    @Test
    void backoffDoublesPerAttempt() {
        assertThat(dispatcher.backoffDelay(0)).isEqualTo(Duration.ofMillis(10));
        assertThat(dispatcher.backoffDelay(1)).isEqualTo(Duration.ofMillis(20));
        assertThat(dispatcher.backoffDelay(2)).isEqualTo(Duration.ofMillis(40));
    }

    private UserEntity target(String username) {
        return TestUsers.withWebhook(TestUsers.member(username), url());
    }

    private String url() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/hook";
    }

    private static MessageView view() {
        return MessageView.builder()
                .id(7L)
                .fromUsername("alice")
                .content("hi")
                .messageType("room")
                .timestamp("2024-05-01T10:00:00Z")
                .build();
    }
}
