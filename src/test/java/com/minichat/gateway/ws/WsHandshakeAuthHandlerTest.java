package com.minichat.gateway.ws;

import com.minichat.auth.ApiKeyAuthenticator;
import com.minichat.domain.entity.UserEntity;
import com.minichat.support.TestUsers;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsHandshakeAuthHandlerTest {

    @Test
    void extractApiKey_prefersQueryParameter() {
        FullHttpRequest req = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/ws?api_key=from-query");
        req.headers().set("X-API-Key", "from-header");
        assertThat(WsHandshakeAuthHandler.extractApiKey(req)).isEqualTo("from-query");
        req.release();
    }

    @Test
    void extractApiKey_fallsBackToHeader() {
        FullHttpRequest req = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/ws");
        req.headers().set("X-API-Key", "from-header");
        assertThat(WsHandshakeAuthHandler.extractApiKey(req)).isEqualTo("from-header");
        req.release();

        FullHttpRequest none = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/ws?api_key=");
        assertThat(WsHandshakeAuthHandler.extractApiKey(none)).isNull();
        none.release();
    }

    @Test
    void validKeyBindsIdentityAndForwardsRequest() {
        ApiKeyAuthenticator authenticator = mock(ApiKeyAuthenticator.class);
        UserEntity alice = TestUsers.member("alice");
        when(authenticator.resolve("k1")).thenReturn(Optional.of(alice));
        EmbeddedChannel ch = new EmbeddedChannel(new WsHandshakeAuthHandler("/ws", authenticator, Runnable::run));

        ch.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/ws?api_key=k1"));

        FullHttpRequest forwarded = ch.readInbound();
        assertThat(forwarded).isNotNull();
        assertThat(forwarded.uri()).isEqualTo("/ws?api_key=k1");
        forwarded.release();
        assertThat(ch.attr(WsHandshakeAuthHandler.ATTR_IDENTITY).get()).isSameAs(alice);
    }

    @Test
    void invalidKeyStillForwardsWithoutIdentity() {
        ApiKeyAuthenticator authenticator = mock(ApiKeyAuthenticator.class);
        when(authenticator.resolve("bad")).thenReturn(Optional.empty());
        EmbeddedChannel ch = new EmbeddedChannel(new WsHandshakeAuthHandler("/ws", authenticator, Runnable::run));

        ch.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/ws?api_key=bad"));

        FullHttpRequest forwarded = ch.readInbound();
        assertThat(forwarded).isNotNull();
        forwarded.release();
        assertThat(ch.attr(WsHandshakeAuthHandler.ATTR_IDENTITY).get()).isNull();
    }

    @Test
    void otherPathsAreNotAuthenticated() {
        ApiKeyAuthenticator authenticator = mock(ApiKeyAuthenticator.class);
        EmbeddedChannel ch = new EmbeddedChannel(new WsHandshakeAuthHandler("/ws", authenticator, Runnable::run));

        ch.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/favicon.ico"));

        FullHttpRequest forwarded = ch.readInbound();
        assertThat(forwarded).isNotNull();
        forwarded.release();
        verify(authenticator, never()).resolve(org.mockito.ArgumentMatchers.any());
    }
}
