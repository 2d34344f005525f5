package com.minichat.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minichat.auth.ApiKeyAuthenticator;
import com.minichat.gateway.config.GatewayProperties;
import com.minichat.gateway.session.ConnectionRegistry;
import com.minichat.gateway.session.LivenessMonitor;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
@ConditionalOnProperty(prefix = "chat.gateway.ws", name = "enabled", havingValue = "true", matchIfMissing = true)
public class NettyWsServer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(NettyWsServer.class);

    private final GatewayProperties props;
    private final ObjectMapper objectMapper;
    private final ApiKeyAuthenticator authenticator;
    private final ConnectionRegistry connectionRegistry;
    private final LivenessMonitor livenessMonitor;
    private final WsFrameDispatcher dispatcher;
    private final WsWriter wsWriter;
    private final Executor dbExecutor;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel serverChannel;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public NettyWsServer(GatewayProperties props,
                         ObjectMapper objectMapper,
                         ApiKeyAuthenticator authenticator,
                         ConnectionRegistry connectionRegistry,
                         LivenessMonitor livenessMonitor,
                         WsFrameDispatcher dispatcher,
                         WsWriter wsWriter,
                         @Qualifier("chatDbExecutor") Executor dbExecutor) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.authenticator = authenticator;
        this.connectionRegistry = connectionRegistry;
        this.livenessMonitor = livenessMonitor;
        this.dispatcher = dispatcher;
        this.wsWriter = wsWriter;
        this.dbExecutor = dbExecutor;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        String path = props.pathEffective();
        log.info("Starting Netty WS gateway on {}:{}{}", props.hostEffective(), props.portEffective(), path);

        boss = new NioEventLoopGroup(1);
        worker = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(boss, worker)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();

                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(props.maxFrameBytesEffective()));

                        // 握手请求先鉴权，结果挂在 channel 上，握手完成后由 WsFrameHandler 决定登记还是关闭
                        p.addLast(new WsHandshakeAuthHandler(path, authenticator, dbExecutor));

                        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                                .websocketPath(path)
                                .checkStartsWith(true)
                                .allowExtensions(true)
                                .maxFramePayloadLength(props.maxFrameBytesEffective())
                                .build();
                        p.addLast(new WebSocketServerProtocolHandler(wsConfig));

                        p.addLast(new WsFrameHandler(objectMapper, connectionRegistry, livenessMonitor,
                                dispatcher, wsWriter, props.maxInboundPendingEffective()));
                    }
                });

        try {
            serverChannel = b.bind(props.hostEffective(), props.portEffective()).syncUninterruptibly().channel();
            log.info("Netty WS gateway started, listening on {}", serverChannel.localAddress());
        } catch (Exception e) {
            log.error("Failed to start Netty WS gateway on {}:{}{}", props.hostEffective(), props.portEffective(), path, e);
            stop();
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping Netty WS gateway...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (worker != null) {
            worker.shutdownGracefully();
        }
        if (boss != null) {
            boss.shutdownGracefully();
        }
        log.info("Netty WS gateway stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * 晚于 LivenessMonitor 启动，早于它停止。
     */
    @Override
    public int getPhase() {
        return Integer.MIN_VALUE + 100;
    }
}
