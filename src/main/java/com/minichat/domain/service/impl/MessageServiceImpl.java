package com.minichat.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.minichat.common.time.Timestamps;
import com.minichat.domain.config.ChatStoreProperties;
import com.minichat.domain.entity.MessageEntity;
import com.minichat.domain.entity.ReadReceiptEntity;
import com.minichat.domain.enums.DirectScope;
import com.minichat.domain.mapper.MessageMapper;
import com.minichat.domain.mapper.ReadReceiptMapper;
import com.minichat.domain.service.MessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MessageServiceImpl extends ServiceImpl<MessageMapper, MessageEntity> implements MessageService {

    private final ReadReceiptMapper readReceiptMapper;
    private final ChatStoreProperties storeProps;
    private final Clock clock;

    @Override
    @Transactional
    public MessageEntity append(MessageEntity message) {
        if (message.getCreatedAt() == null) {
            message.setCreatedAt(Timestamps.nowUtc(clock));
        }
        save(message);

        long total = count();
        int limit = storeProps.historyLimitEffective();
        if (total > limit) {
            List<Long> oldest = baseMapper.selectOldestIds(total - limit);
            if (!oldest.isEmpty()) {
                readReceiptMapper.delete(new LambdaQueryWrapper<ReadReceiptEntity>()
                        .in(ReadReceiptEntity::getMessageId, oldest));
                removeByIds(oldest);
                log.debug("message retention pruned: count={}, limit={}", oldest.size(), limit);
            }
        }
        return message;
    }

    @Override
    public List<MessageEntity> roomHistory(int limit, int offset, LocalDateTime since) {
        return list(roomQuery(since)
                .orderByAsc(MessageEntity::getCreatedAt)
                .orderByAsc(MessageEntity::getId)
                .last(limitClause(limit, offset)));
    }

    @Override
    public long countRoom(LocalDateTime since) {
        return count(roomQuery(since));
    }

    @Override
    public List<MessageEntity> directHistory(String username, DirectScope scope, int limit, int offset, LocalDateTime since) {
        return list(directQuery(username, scope, since)
                .orderByAsc(MessageEntity::getCreatedAt)
                .orderByAsc(MessageEntity::getId)
                .last(limitClause(limit, offset)));
    }

    @Override
    public long countDirect(String username, DirectScope scope, LocalDateTime since) {
        return count(directQuery(username, scope, since));
    }

    @Override
    @Transactional
    public boolean deleteMessage(Long id) {
        if (id == null) {
            return false;
        }
        readReceiptMapper.delete(new LambdaQueryWrapper<ReadReceiptEntity>()
                .eq(ReadReceiptEntity::getMessageId, id));
        return removeById(id);
    }

    private static LambdaQueryWrapper<MessageEntity> roomQuery(LocalDateTime since) {
        return new LambdaQueryWrapper<MessageEntity>()
                .isNull(MessageEntity::getToUsername)
                .gt(since != null, MessageEntity::getCreatedAt, since);
    }

    private static LambdaQueryWrapper<MessageEntity> directQuery(String username, DirectScope scope, LocalDateTime since) {
        LambdaQueryWrapper<MessageEntity> w = new LambdaQueryWrapper<MessageEntity>()
                .isNotNull(MessageEntity::getToUsername)
                .gt(since != null, MessageEntity::getCreatedAt, since);
        if (scope != DirectScope.ALL) {
            w.and(q -> q.eq(MessageEntity::getToUsername, username)
                    .or()
                    .eq(MessageEntity::getFromUsername, username));
        }
        return w;
    }

    private static String limitClause(int limit, int offset) {
        return "limit " + Math.max(1, limit) + " offset " + Math.max(0, offset);
    }
}
