package com.minichat.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minichat.common.error.AuthenticationException;
import com.minichat.domain.entity.UserEntity;
import com.minichat.gateway.session.ClientConnection;
import com.minichat.gateway.session.ConnectionRegistry;
import com.minichat.gateway.session.LivenessMonitor;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * 每条连接一个实例，挂在 WebSocketServerProtocolHandler 之后。
 *
 * <ul>
 *   <li>握手完成：有身份则登记连接，没有则以 1008 关闭</li>
 *   <li>文本帧：记录活跃 → 解析 JSON → 进入本连接的串行队列</li>
 *   <li>断开：只移除这一条连接</li>
 * </ul>
 */
@Slf4j
public class WsFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    static final String INVALID_JSON = "Invalid JSON";

    private final ObjectMapper objectMapper;
    private final ConnectionRegistry connectionRegistry;
    private final LivenessMonitor livenessMonitor;
    private final WsFrameDispatcher dispatcher;
    private final WsWriter wsWriter;
    private final int maxInboundPending;

    public WsFrameHandler(ObjectMapper objectMapper,
                          ConnectionRegistry connectionRegistry,
                          LivenessMonitor livenessMonitor,
                          WsFrameDispatcher dispatcher,
                          WsWriter wsWriter,
                          int maxInboundPending) {
        this.objectMapper = objectMapper;
        this.connectionRegistry = connectionRegistry;
        this.livenessMonitor = livenessMonitor;
        this.dispatcher = dispatcher;
        this.wsWriter = wsWriter;
        this.maxInboundPending = maxInboundPending;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        Channel ch = ctx.channel();
        ClientConnection conn = connectionRegistry.find(ch);
        if (conn == null) {
            closePolicyViolation(ctx);
            return;
        }
        livenessMonitor.recordActivity(conn);

        WsInboundFrame in;
        try {
            in = objectMapper.readValue(frame.text(), WsInboundFrame.class);
        } catch (Exception e) {
            log.debug("bad ws json: key={}, err={}", conn.key(), e.toString());
            in = null;
        }
        if (in == null) {
            wsWriter.writeError(ch, INVALID_JSON);
            return;
        }

        WsInboundFrame accepted = in;
        WsInboundQueue.tryEnqueue(ch, () -> dispatcher.dispatch(conn, accepted), maxInboundPending)
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof RejectedExecutionException) {
                        log.warn("ws inbound queue full: key={}, pending={}", conn.key(), WsInboundQueue.pending(ch));
                        wsWriter.writeError(ch, WsFrameDispatcher.BUSY_ERROR);
                    }
                    return null;
                });
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            UserEntity identity = ctx.channel().attr(WsHandshakeAuthHandler.ATTR_IDENTITY).get();
            if (identity == null) {
                log.info("ws auth rejected: remote={}", ctx.channel().remoteAddress());
                closePolicyViolation(ctx);
                return;
            }
            connectionRegistry.connect(identity, ctx.channel());
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        ClientConnection conn = connectionRegistry.find(ctx.channel());
        if (conn != null) {
            connectionRegistry.disconnect(conn);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("ws channel error: remote={}, err={}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }

    private static void closePolicyViolation(ChannelHandlerContext ctx) {
        ctx.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.POLICY_VIOLATION, AuthenticationException.DEFAULT_MESSAGE))
                .addListener(ChannelFutureListener.CLOSE);
    }
}
