package com.minichat.domain.service;

import com.minichat.common.time.Timestamps;
import com.minichat.domain.dto.MessageView;
import com.minichat.domain.entity.MessageEntity;
import com.minichat.domain.entity.UserEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * MessageEntity → MessageView，顺带补上双方的展示信息。用户资料走 UserService 的本地缓存。
 */
@Component
@RequiredArgsConstructor
public class MessageViewAssembler {

    private final UserService userService;

    public MessageView toView(MessageEntity m) {
        UserEntity sender = userService.findProfile(m.getFromUsername());
        UserEntity recipient = m.getToUsername() == null ? null : userService.findProfile(m.getToUsername());
        return toView(m, sender, recipient);
    }

    public MessageView toView(MessageEntity m, UserEntity sender, UserEntity recipient) {
        MessageView.MessageViewBuilder b = MessageView.builder()
                .id(m.getId())
                .fromUsername(m.getFromUsername())
                .toUsername(m.getToUsername())
                .content(m.getContent())
                .messageType(m.getMessageType() == null ? null : m.getMessageType().getValue())
                .timestamp(Timestamps.format(m.getCreatedAt()));
        if (sender != null) {
            b.fromUserLogo(sender.getLogo())
                    .fromUserEmoji(sender.getEmoji())
                    .fromUserBot(sender.isBot());
        }
        if (recipient != null) {
            b.toUserLogo(recipient.getLogo())
                    .toUserEmoji(recipient.getEmoji())
                    .toUserBot(recipient.isBot());
        }
        return b.build();
    }

    public List<MessageView> toViews(List<MessageEntity> messages) {
        List<MessageView> out = new ArrayList<>(messages.size());
        for (MessageEntity m : messages) {
            out.add(toView(m));
        }
        return out;
    }
}
