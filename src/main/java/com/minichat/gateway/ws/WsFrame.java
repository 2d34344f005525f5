package com.minichat.gateway.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.minichat.domain.dto.MessageView;
import com.minichat.domain.dto.Pagination;
import com.minichat.domain.dto.UnreadCount;
import com.minichat.domain.dto.UserProfile;
import lombok.Data;

import java.util.List;

/**
 * 服务端下发的 WS 帧。字段按需填充，null 不输出。
 *
 * <p>type 取值：ping / message / message_sent / read_receipt / error，以及各查询的同名响应
 * （messages / direct_messages / unread_count ...）。</p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WsFrame {

    private String type;

    /** sent / success / marked_read */
    private String status;

    private String error;

    /** ping 帧的 ISO-8601 时间。 */
    private String timestamp;

    private MessageView message;

    private List<MessageView> messages;

    private Pagination pagination;

    private Long messageId;

    private String readBy;

    private Integer markedAsRead;

    private Integer count;

    private String fromUsername;

    private Long unreadRoomMessages;

    private Long unreadDirectMessages;

    private Long totalUnread;

    private List<UserProfile> users;

    private UserProfile user;

    public static WsFrame of(String type) {
        WsFrame f = new WsFrame();
        f.type = type;
        return f;
    }

    public static WsFrame ping(String timestamp) {
        WsFrame f = of("ping");
        f.timestamp = timestamp;
        return f;
    }

    public static WsFrame error(String error) {
        WsFrame f = of("error");
        f.error = error;
        return f;
    }

    /** 推给收件人的新消息。 */
    public static WsFrame message(MessageView view) {
        WsFrame f = of("message");
        f.message = view;
        return f;
    }

    /** 回给发送方的落库确认。 */
    public static WsFrame messageSent(MessageView view) {
        WsFrame f = of("message_sent");
        f.status = "sent";
        f.message = view;
        return f;
    }

    public static WsFrame readReceipt(Long messageId, String readBy) {
        WsFrame f = of("read_receipt");
        f.messageId = messageId;
        f.readBy = readBy;
        return f;
    }

    public static WsFrame unreadCount(UnreadCount c) {
        WsFrame f = of("unread_count");
        f.unreadRoomMessages = c.unreadRoom();
        f.unreadDirectMessages = c.unreadDirect();
        f.totalUnread = c.total();
        return f;
    }
}
