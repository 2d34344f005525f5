package com.minichat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 消息类型（对应表字段：t_message.message_type）。
 *
 * <p>room：to_username 为空，广播给房间；direct：私信；system：服务端生成的提示。</p>
 */
@Getter
@RequiredArgsConstructor
public enum MessageType {

    ROOM("room"),

    DIRECT("direct"),

    SYSTEM("system");

    @EnumValue
    @JsonValue
    private final String value;
}
