package com.minichat.domain.service;

import com.minichat.common.error.NotFoundException;
import com.minichat.common.error.PermissionDeniedException;
import com.minichat.common.error.StorageException;
import com.minichat.common.error.ValidationException;
import com.minichat.common.time.Timestamps;
import com.minichat.delivery.DeliveryRouter;
import com.minichat.domain.dto.MessagePage;
import com.minichat.domain.dto.MessageView;
import com.minichat.domain.dto.Pagination;
import com.minichat.domain.dto.UnreadCount;
import com.minichat.domain.dto.UserProfile;
import com.minichat.domain.entity.MessageEntity;
import com.minichat.domain.entity.UserEntity;
import com.minichat.domain.enums.DirectScope;
import com.minichat.domain.enums.MessageType;
import com.minichat.domain.enums.Permission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 聊天业务入口：WS 帧处理和 REST 接口都走这里。
 *
 * <p>发送流程：校验 → 权限 → 落库 → 异步投递。落库失败直接抛给调用方；投递失败只记日志，
 * 已落库的消息不会回滚，仍可通过历史查询拿到。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    public static final int MAX_CONTENT_LENGTH = 10_000;

    private final MessageService messageService;
    private final ReadReceiptService readReceiptService;
    private final UserService userService;
    private final MessageViewAssembler viewAssembler;
    private final DeliveryRouter deliveryRouter;
    private final Clock clock;

    public MessageView send(UserEntity sender, String content, String toUsername) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("Missing content field");
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            throw new ValidationException("Message content exceeds " + MAX_CONTENT_LENGTH + " characters");
        }
        String to = (toUsername == null || toUsername.isBlank()) ? null : toUsername.trim();

        UserEntity recipient = null;
        if (to == null) {
            require(sender, Permission.SEND_ROOM_MESSAGE, "send room messages");
        } else {
            require(sender, Permission.SEND_DIRECT_MESSAGE, "send direct messages");
            recipient = userService.findByUsername(to);
            if (recipient == null) {
                throw new ValidationException("User " + to + " not found");
            }
            if (recipient.isViewer()) {
                throw new ValidationException("Cannot send messages to viewer user " + to);
            }
            if (recipient.isBot()) {
                throw new ValidationException("Cannot send direct messages to bot user " + to);
            }
        }

        MessageEntity m = new MessageEntity();
        m.setFromUsername(sender.getUsername());
        m.setToUsername(to);
        m.setContent(content);
        m.setMessageType(to == null ? MessageType.ROOM : MessageType.DIRECT);
        m.setCreatedAt(Timestamps.nowUtc(clock));
        try {
            messageService.append(m);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to store message", e);
        }

        MessageView view = viewAssembler.toView(m, sender, recipient);
        try {
            deliveryRouter.dispatch(view, sender, recipient);
        } catch (Exception e) {
            // 消息已落库，投递调度失败不影响发送结果
            log.warn("dispatch scheduling failed: messageId={}, err={}", m.getId(), e.toString());
        }
        return view;
    }

    /**
     * 标记已读；新建回执且读者不是作者时，给作者推一条 read_receipt。
     */
    public boolean markRead(UserEntity reader, Long messageId) {
        require(reader, Permission.READ_MESSAGES, "read messages");
        MessageEntity m = messageId == null ? null : messageService.getById(messageId);
        if (m == null) {
            throw new NotFoundException("Message " + messageId + " not found");
        }
        boolean created = readReceiptService.markRead(messageId, reader.getUsername());
        if (created && !reader.getUsername().equals(m.getFromUsername())) {
            deliveryRouter.notifyReadReceipt(m.getFromUsername(), messageId, reader.getUsername());
        }
        return created;
    }

    public int markAllRead(UserEntity reader) {
        require(reader, Permission.READ_MESSAGES, "read messages");
        return readReceiptService.markAllRead(reader.getUsername(), DirectScope.of(reader));
    }

    public int markRoomRead(UserEntity reader) {
        require(reader, Permission.READ_MESSAGES, "read messages");
        return readReceiptService.markRoomRead(reader.getUsername());
    }

    public int markDirectRead(UserEntity reader, String fromUsername) {
        require(reader, Permission.READ_MESSAGES, "read messages");
        if (fromUsername == null || fromUsername.isBlank()) {
            throw new ValidationException("Missing from_username field");
        }
        return readReceiptService.markDirectRead(reader.getUsername(), fromUsername.trim());
    }

    public UnreadCount unreadCount(UserEntity reader) {
        require(reader, Permission.READ_MESSAGES, "read messages");
        return readReceiptService.unreadCount(reader.getUsername(), DirectScope.of(reader));
    }

    public MessagePage roomHistory(UserEntity reader, Integer limit, Integer offset, String since) {
        require(reader, Permission.READ_MESSAGES, "read messages");
        LocalDateTime sinceAt = Timestamps.parseSince(since);
        int l = Pagination.clampLimit(limit);
        int o = Pagination.clampOffset(offset);
        List<MessageView> views = viewAssembler.toViews(messageService.roomHistory(l, o, sinceAt));
        long total = messageService.countRoom(sinceAt);
        return new MessagePage(views, Pagination.of(total, o, l, views.size()));
    }

    public MessagePage directHistory(UserEntity reader, Integer limit, Integer offset, String since) {
        require(reader, Permission.READ_MESSAGES, "read messages");
        LocalDateTime sinceAt = Timestamps.parseSince(since);
        int l = Pagination.clampLimit(limit);
        int o = Pagination.clampOffset(offset);
        DirectScope scope = DirectScope.of(reader);
        List<MessageView> views = viewAssembler.toViews(
                messageService.directHistory(reader.getUsername(), scope, l, o, sinceAt));
        long total = messageService.countDirect(reader.getUsername(), scope, sinceAt);
        return new MessagePage(views, Pagination.of(total, o, l, views.size()));
    }

    public List<MessageView> unreadRoomMessages(UserEntity reader, Integer limit, Integer offset) {
        require(reader, Permission.READ_MESSAGES, "read messages");
        return viewAssembler.toViews(readReceiptService.unreadRoomMessages(
                reader.getUsername(), Pagination.clampLimit(limit), Pagination.clampOffset(offset)));
    }

    public List<MessageView> unreadDirectMessages(UserEntity reader, Integer limit, Integer offset) {
        require(reader, Permission.READ_MESSAGES, "read messages");
        return viewAssembler.toViews(readReceiptService.unreadDirectMessages(
                reader.getUsername(), DirectScope.of(reader), Pagination.clampLimit(limit), Pagination.clampOffset(offset)));
    }

    public void deleteMessage(UserEntity actor, Long messageId) {
        require(actor, Permission.DELETE_ANY_MESSAGE, "delete messages");
        if (!messageService.deleteMessage(messageId)) {
            throw new NotFoundException("Message " + messageId + " not found");
        }
        log.info("message deleted: messageId={}, by={}", messageId, actor.getUsername());
    }

    public List<UserProfile> listUsers(UserEntity reader) {
        require(reader, Permission.READ_USERS, "read users");
        return userService.listChatUsers().stream().map(UserProfile::of).toList();
    }

    /**
     * 在线用户名由网关提供；查不到资料的（例如刚被删除）直接跳过。
     */
    public List<UserProfile> onlineUsers(UserEntity reader, List<String> onlineUsernames) {
        require(reader, Permission.READ_USERS, "read users");
        List<UserProfile> out = new ArrayList<>();
        for (String username : onlineUsernames) {
            UserEntity u = userService.findByUsername(username);
            if (u != null) {
                out.add(UserProfile.of(u));
            }
        }
        return out;
    }

    public UserProfile userProfile(UserEntity reader, String username) {
        require(reader, Permission.READ_USERS, "read users");
        if (username == null || username.isBlank()) {
            throw new ValidationException("Missing username field");
        }
        UserEntity user = userService.findByUsername(username.trim());
        if (user == null) {
            throw new NotFoundException("User " + username + " not found");
        }
        return UserProfile.of(user);
    }

    /**
     * message_id 在协议里是字符串；格式不对按参数错误处理。
     */
    public static Long parseMessageId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Missing message_id field");
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid message id: " + raw);
        }
    }

    private static void require(UserEntity user, Permission permission, String action) {
        if (user == null || !user.hasPermission(permission)) {
            String role = (user == null || user.getRole() == null) ? "unknown" : user.getRole().getValue();
            throw new PermissionDeniedException(permission,
                    "Your role '" + role + "' does not have permission to " + action
                            + " (requires " + permission.getValue() + ")");
        }
    }
}
