package com.minichat.domain.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 消息对外视图：WS 推送、webhook body、pub/sub 镜像、REST 返回都用这一份。
 *
 * <p>带上发送方/接收方的展示信息（logo、emoji、是否 bot），客户端不需要再查一次用户。</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageView {

    private Long id;

    private String fromUsername;

    private String toUsername;

    private String content;

    /** room / direct / system */
    private String messageType;

    /** ISO-8601，UTC */
    private String timestamp;

    private String fromUserLogo;

    private String fromUserEmoji;

    private Boolean fromUserBot;

    private String toUserLogo;

    private String toUserEmoji;

    private Boolean toUserBot;
}
