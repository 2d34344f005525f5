package com.minichat.gateway.ws;

import com.minichat.config.ChatDbExecutorProperties;
import com.minichat.domain.service.ChatService;
import com.minichat.gateway.session.ClientConnection;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * message / delete_message。发送成功只回 message_sent，投递由 DeliveryRouter 异步完成。
 */
@Component
public class WsMessageHandler extends WsDbHandlerSupport {

    private final ChatService chatService;

    public WsMessageHandler(ChatService chatService,
                            @Qualifier("chatDbExecutor") Executor dbExecutor,
                            ChatDbExecutorProperties dbProps) {
        super(dbExecutor, dbProps);
        this.chatService = chatService;
    }

    public CompletableFuture<WsFrame> send(ClientConnection conn, WsInboundFrame in) {
        return onDb(() -> WsFrame.messageSent(
                chatService.send(conn.getIdentity(), in.getContent(), in.getToUsername())));
    }

    public CompletableFuture<WsFrame> delete(ClientConnection conn, WsInboundFrame in) {
        return onDb(() -> {
            Long messageId = ChatService.parseMessageId(in.getMessageId());
            chatService.deleteMessage(conn.getIdentity(), messageId);
            WsFrame out = WsFrame.of("message_deleted");
            out.setMessageId(messageId);
            out.setStatus("success");
            return out;
        });
    }
}
