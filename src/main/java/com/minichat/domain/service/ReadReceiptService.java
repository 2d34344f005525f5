package com.minichat.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.minichat.domain.dto.UnreadCount;
import com.minichat.domain.entity.MessageEntity;
import com.minichat.domain.entity.ReadReceiptEntity;
import com.minichat.domain.enums.DirectScope;

import java.util.List;

/**
 * 已读回执与未读统计。所有“标记已读”都是幂等的：已存在的回执不会重复插入。
 */
public interface ReadReceiptService extends IService<ReadReceiptEntity> {

    /**
     * @return true 表示新建了回执；false 表示之前已读
     * @throws com.minichat.common.error.NotFoundException 消息不存在
     */
    boolean markRead(Long messageId, String username);

    /** 房间 + 可见范围内的私信全部标记已读，返回新标记的条数。 */
    int markAllRead(String username, DirectScope scope);

    int markRoomRead(String username);

    /** 只标记 fromUsername 发给 username 的私信。 */
    int markDirectRead(String username, String fromUsername);

    UnreadCount unreadCount(String username, DirectScope scope);

    List<MessageEntity> unreadRoomMessages(String username, int limit, int offset);

    List<MessageEntity> unreadDirectMessages(String username, DirectScope scope, int limit, int offset);
}
