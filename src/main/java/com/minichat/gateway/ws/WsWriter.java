package com.minichat.gateway.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.channels.ClosedChannelException;

/**
 * WS 文本协议统一写出器：序列化在调用方线程完成，写出交给 channel 自己的 eventLoop。
 *
 * <p>返回的 future 失败即表示这条连接写不进去，由调用方决定是否断开。</p>
 */
@Component
@RequiredArgsConstructor
public class WsWriter {

    private final ObjectMapper objectMapper;

    public ChannelFuture write(Channel ch, WsFrame frame) {
        if (ch == null) {
            throw new IllegalArgumentException("channel is null");
        }
        if (!ch.isActive()) {
            return ch.newFailedFuture(new ClosedChannelException());
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            return ch.newFailedFuture(new IllegalStateException("ws encode failed", e));
        }
        return ch.writeAndFlush(new TextWebSocketFrame(json));
    }

    public ChannelFuture writeError(Channel ch, String error) {
        return write(ch, WsFrame.error(error));
    }
}
