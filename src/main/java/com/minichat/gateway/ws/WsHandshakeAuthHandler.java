package com.minichat.gateway.ws;

import com.minichat.auth.ApiKeyAuthenticator;
import com.minichat.domain.entity.UserEntity;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * WebSocket 握手阶段（HTTP Upgrade）鉴权：
 * <ul>
 *   <li>从 query 参数 api_key 或请求头 X-API-Key 取 api key</li>
 *   <li>查库在 DB 线程池完成，结果回到 eventLoop 后再放行握手请求</li>
 *   <li>鉴权通过把用户绑定到 channel；失败也放行握手，由 {@link WsFrameHandler} 在握手完成后以 1008 关闭</li>
 * </ul>
 */
@Slf4j
public class WsHandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    public static final AttributeKey<UserEntity> ATTR_IDENTITY = AttributeKey.valueOf("chat:identity");

    static final String QUERY_PARAM = "api_key";
    static final String HEADER = "X-API-Key";

    private final String wsPath;
    private final ApiKeyAuthenticator authenticator;
    private final Executor dbExecutor;

    public WsHandshakeAuthHandler(String wsPath, ApiKeyAuthenticator authenticator, Executor dbExecutor) {
        this.wsPath = wsPath;
        this.authenticator = authenticator;
        this.dbExecutor = dbExecutor;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        if (uri == null || !uri.startsWith(wsPath) || ctx.channel().attr(ATTR_IDENTITY).get() != null) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        String apiKey = extractApiKey(req);
        FullHttpRequest retained = req.retain();
        CompletableFuture<Optional<UserEntity>> lookup;
        try {
            lookup = CompletableFuture.supplyAsync(() -> authenticator.resolve(apiKey), dbExecutor);
        } catch (RejectedExecutionException e) {
            lookup = CompletableFuture.failedFuture(e);
        }
        lookup.whenComplete((user, e) -> {
            Runnable proceed = () -> {
                if (e != null) {
                    log.warn("ws handshake auth lookup failed: remote={}, err={}", ctx.channel().remoteAddress(), e.toString());
                } else {
                    user.ifPresent(u -> ctx.channel().attr(ATTR_IDENTITY).set(u));
                }
                ctx.fireChannelRead(retained);
            };
            if (ctx.executor().inEventLoop()) {
                proceed.run();
            } else {
                ctx.executor().execute(proceed);
            }
        });
    }

    static String extractApiKey(FullHttpRequest req) {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        List<String> values = decoder.parameters().get(QUERY_PARAM);
        if (values != null && !values.isEmpty() && values.get(0) != null && !values.get(0).isBlank()) {
            return values.get(0).trim();
        }
        String header = req.headers().get(HEADER);
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        return null;
    }
}
