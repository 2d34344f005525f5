package com.minichat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.minichat.domain.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_message")
public class MessageEntity {

    /** 雪花 id，对外输出为字符串。 */
    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String fromUsername;

    /** 私信接收方；房间消息为 null。 */
    private String toUsername;

    private String content;

    /** 消息类型：见 {@link MessageType}。 */
    private MessageType messageType;

    /** UTC，毫秒精度；历史查询按 (createdAt, id) 升序。 */
    private LocalDateTime createdAt;

    public boolean isRoom() {
        return toUsername == null;
    }
}
