package com.minichat.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.minichat.domain.entity.MessageEntity;
import com.minichat.domain.enums.DirectScope;

import java.time.LocalDateTime;
import java.util.List;

public interface MessageService extends IService<MessageEntity> {

    /**
     * 落库并按保留上限裁剪最老的消息（同一事务）。返回带 id 的实体。
     */
    MessageEntity append(MessageEntity message);

    /**
     * 房间消息，按 (createdAt, id) 升序；since 不为空时只取之后的。
     */
    List<MessageEntity> roomHistory(int limit, int offset, LocalDateTime since);

    long countRoom(LocalDateTime since);

    List<MessageEntity> directHistory(String username, DirectScope scope, int limit, int offset, LocalDateTime since);

    long countDirect(String username, DirectScope scope, LocalDateTime since);

    /** 连同已读回执一起删除；不存在返回 false。 */
    boolean deleteMessage(Long id);
}
