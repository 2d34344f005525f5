package com.minichat.domain.enums;

import com.minichat.domain.entity.UserEntity;

/**
 * 查询私信时的可见范围：viewer 看全站私信，其余角色只看与自己相关的。
 *
 * <p>历史、未读列表、未读计数、全部已读都用同一个范围，保证“全部已读之后未读为 0”。</p>
 */
public enum DirectScope {

    OWN,

    ALL;

    public static DirectScope of(UserEntity user) {
        return user != null && user.isViewer() ? ALL : OWN;
    }
}
