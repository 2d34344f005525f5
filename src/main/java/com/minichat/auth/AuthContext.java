package com.minichat.auth;

import com.minichat.common.error.AuthenticationException;
import com.minichat.domain.entity.UserEntity;

/**
 * 请求级别的“当前用户”上下文，由 {@link ApiKeyInterceptor} 写入。
 *
 * <p>ThreadLocal 必须在请求结束时清理，否则线程复用时会串号；清理在 ApiKeyInterceptor#afterCompletion。</p>
 */
public final class AuthContext {

    private static final ThreadLocal<UserEntity> CURRENT = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void set(UserEntity user) {
        CURRENT.set(user);
    }

    public static UserEntity get() {
        return CURRENT.get();
    }

    /**
     * 拦截器之外的路径（例如漏配）拿不到用户时按未鉴权处理。
     */
    public static UserEntity require() {
        UserEntity user = CURRENT.get();
        if (user == null) {
            throw new AuthenticationException();
        }
        return user;
    }

    public static void clear() {
        CURRENT.remove();
    }
}
