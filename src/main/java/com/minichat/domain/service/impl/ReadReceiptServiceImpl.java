package com.minichat.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.minichat.common.error.NotFoundException;
import com.minichat.common.time.Timestamps;
import com.minichat.domain.dto.UnreadCount;
import com.minichat.domain.entity.MessageEntity;
import com.minichat.domain.entity.ReadReceiptEntity;
import com.minichat.domain.enums.DirectScope;
import com.minichat.domain.mapper.MessageMapper;
import com.minichat.domain.mapper.ReadReceiptMapper;
import com.minichat.domain.service.ReadReceiptService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReadReceiptServiceImpl extends ServiceImpl<ReadReceiptMapper, ReadReceiptEntity> implements ReadReceiptService {

    private final MessageMapper messageMapper;
    private final Clock clock;

    @Override
    public boolean markRead(Long messageId, String username) {
        if (messageId == null || messageMapper.selectById(messageId) == null) {
            throw new NotFoundException("Message " + messageId + " not found");
        }
        boolean exists = baseMapper.exists(new LambdaQueryWrapper<ReadReceiptEntity>()
                .eq(ReadReceiptEntity::getMessageId, messageId)
                .eq(ReadReceiptEntity::getUsername, username));
        if (exists) {
            return false;
        }
        return insertIfAbsent(messageId, username, Timestamps.nowUtc(clock));
    }

    @Override
    @Transactional
    public int markAllRead(String username, DirectScope scope) {
        Set<Long> ids = new LinkedHashSet<>(baseMapper.selectUnreadRoomIds(username));
        ids.addAll(baseMapper.selectUnreadDirectIds(username, scope == DirectScope.ALL, null));
        return insertAll(ids, username);
    }

    @Override
    @Transactional
    public int markRoomRead(String username) {
        return insertAll(baseMapper.selectUnreadRoomIds(username), username);
    }

    @Override
    @Transactional
    public int markDirectRead(String username, String fromUsername) {
        return insertAll(baseMapper.selectUnreadDirectIds(username, false, fromUsername), username);
    }

    @Override
    public UnreadCount unreadCount(String username, DirectScope scope) {
        long room = baseMapper.countUnreadRoom(username);
        long direct = baseMapper.countUnreadDirect(username, scope == DirectScope.ALL);
        return UnreadCount.of(room, direct);
    }

    @Override
    public List<MessageEntity> unreadRoomMessages(String username, int limit, int offset) {
        return baseMapper.selectUnreadRoom(username, limit, offset);
    }

    @Override
    public List<MessageEntity> unreadDirectMessages(String username, DirectScope scope, int limit, int offset) {
        return baseMapper.selectUnreadDirect(username, scope == DirectScope.ALL, limit, offset);
    }

    private int insertAll(Iterable<Long> messageIds, String username) {
        LocalDateTime now = Timestamps.nowUtc(clock);
        int created = 0;
        for (Long id : messageIds) {
            if (insertIfAbsent(id, username, now)) {
                created++;
            }
        }
        return created;
    }

    /**
     * 并发下两个请求可能同时判定“未读”，主键冲突说明别人已经插入了，按已读处理。
     */
    private boolean insertIfAbsent(Long messageId, String username, LocalDateTime readAt) {
        try {
            return baseMapper.insert(new ReadReceiptEntity(messageId, username, readAt)) > 0;
        } catch (DuplicateKeyException e) {
            log.debug("read receipt already exists: messageId={}, username={}", messageId, username);
            return false;
        }
    }
}
