package com.minichat.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.minichat.domain.entity.UserEntity;
import com.minichat.domain.enums.Role;
import com.minichat.domain.mapper.UserMapper;
import com.minichat.domain.service.UserService;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * 历史、推送组装消息视图时每条消息都要查双方展示信息，这里用 Caffeine 做一层短 TTL 的本地缓存。
 *
 * <p>缓存只服务展示：未命中的用户名不入缓存，发送校验等权威判断一律查库，
 * 查库结果顺带刷新缓存。</p>
 */
@Service
public class UserServiceImpl extends ServiceImpl<UserMapper, UserEntity> implements UserService {

    private final Cache<String, UserEntity> byUsername = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(Duration.ofSeconds(30))
            .build();

    @Override
    public UserEntity findByUsername(String username) {
        if (username == null || username.isBlank()) {
            return null;
        }
        UserEntity u = selectByUsername(username);
        if (u == null) {
            byUsername.invalidate(username);
            return null;
        }
        byUsername.put(username, u.toBuilder().build());
        return u;
    }

    @Override
    public UserEntity findProfile(String username) {
        if (username == null || username.isBlank()) {
            return null;
        }
        // loader 返回 null 时 Caffeine 不存条目
        UserEntity cached = byUsername.get(username, this::selectByUsername);
        return cached == null ? null : cached.toBuilder().build();
    }

    @Override
    public UserEntity findByApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return null;
        }
        return getOne(new LambdaQueryWrapper<UserEntity>()
                .eq(UserEntity::getApiKey, apiKey)
                .last("limit 1"));
    }

    @Override
    public List<UserEntity> listChatUsers() {
        return list(new LambdaQueryWrapper<UserEntity>()
                .ne(UserEntity::getRole, Role.VIEWER.getValue())
                .orderByAsc(UserEntity::getUsername));
    }

    @Override
    public void invalidate(String username) {
        if (username != null) {
            byUsername.invalidate(username);
        }
    }

    @Override
    public void invalidateAll() {
        byUsername.invalidateAll();
    }

    private UserEntity selectByUsername(String username) {
        return getOne(new LambdaQueryWrapper<UserEntity>()
                .eq(UserEntity::getUsername, username)
                .last("limit 1"));
    }
}
