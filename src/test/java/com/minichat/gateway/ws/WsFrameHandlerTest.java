package com.minichat.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minichat.common.error.AuthenticationException;
import com.minichat.domain.entity.UserEntity;
import com.minichat.gateway.session.ClientConnection;
import com.minichat.gateway.session.ConnectionRegistry;
import com.minichat.gateway.session.LivenessMonitor;
import com.minichat.support.TestUsers;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.EmptyHttpHeaders;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsFrameHandlerTest {

    private ConnectionRegistry registry;
    private LivenessMonitor livenessMonitor;
    private WsFrameDispatcher dispatcher;
    private EmbeddedChannel ch;

    @BeforeEach
    void setUp() {
        registry = mock(ConnectionRegistry.class);
        livenessMonitor = mock(LivenessMonitor.class);
        dispatcher = mock(WsFrameDispatcher.class);
        ObjectMapper objectMapper = new ObjectMapper();
        ch = new EmbeddedChannel(new WsFrameHandler(objectMapper, registry, livenessMonitor, dispatcher,
                new WsWriter(objectMapper), 8));
    }

    @Test
    void handshakeWithoutIdentityClosesWithPolicyViolation() {
        ch.pipeline().fireUserEventTriggered(handshakeComplete());

        CloseWebSocketFrame close = ch.readOutbound();
        assertThat(close).isNotNull();
        assertThat(close.statusCode()).isEqualTo(1008);
        assertThat(close.reasonText()).isEqualTo(AuthenticationException.DEFAULT_MESSAGE);
        close.release();
        assertThat(ch.isOpen()).isFalse();
        verify(registry, never()).connect(any(), any());
    }

    @Test
    void handshakeWithIdentityRegistersConnection() {
        UserEntity alice = TestUsers.member("alice");
        ch.attr(WsHandshakeAuthHandler.ATTR_IDENTITY).set(alice);

        ch.pipeline().fireUserEventTriggered(handshakeComplete());

        verify(registry).connect(alice, ch);
        assertThat(ch.isOpen()).isTrue();
    }

    @Test
    void textFrameRecordsActivityAndDispatches() {
        ClientConnection conn = new ClientConnection(TestUsers.member("alice"), ch, Instant.now());
        when(registry.find(ch)).thenReturn(conn);
        when(dispatcher.dispatch(eq(conn), any())).thenReturn(CompletableFuture.completedFuture(null));

        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"get_users\",\"unknown_field\":1}"));

        verify(livenessMonitor).recordActivity(conn);
        verify(dispatcher).dispatch(eq(conn), argThat(f -> "get_users".equals(f.getType())));
    }

    @Test
    void invalidJsonAnswersWithError() {
        ClientConnection conn = new ClientConnection(TestUsers.member("alice"), ch, Instant.now());
        when(registry.find(ch)).thenReturn(conn);

        ch.writeInbound(new TextWebSocketFrame("{not json"));

        TextWebSocketFrame out = ch.readOutbound();
        assertThat(out.text()).contains("\"error\":\"Invalid JSON\"");
        out.release();
        verify(livenessMonitor).recordActivity(conn);
        verify(dispatcher, never()).dispatch(any(), any());
    }

    @Test
    void frameOnUnregisteredChannelIsRejected() {
        ch.writeInbound(new TextWebSocketFrame("{\"type\":\"get_users\"}"));

        CloseWebSocketFrame close = ch.readOutbound();
        assertThat(close.statusCode()).isEqualTo(1008);
        close.release();
        assertThat(ch.isOpen()).isFalse();
    }

    @Test
    void channelCloseDisconnectsThatConnection() {
        ClientConnection conn = new ClientConnection(TestUsers.member("alice"), ch, Instant.now());
        when(registry.find(ch)).thenReturn(conn);

        ch.close();

        verify(registry).disconnect(conn);
    }

    private static WebSocketServerProtocolHandler.HandshakeComplete handshakeComplete() {
        return new WebSocketServerProtocolHandler.HandshakeComplete("/ws", EmptyHttpHeaders.INSTANCE, null);
    }
}
