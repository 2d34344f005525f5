package com.minichat.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minichat.common.api.ApiCodes;
import com.minichat.common.api.Result;
import com.minichat.common.error.AuthenticationException;
import com.minichat.domain.entity.UserEntity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Optional;

/**
 * REST 鉴权：要求 X-API-Key 头，查到用户后放进 {@link AuthContext}。
 *
 * <p>缺失或无效统一返回 401 + Result JSON。</p>
 */
@Component
public class ApiKeyInterceptor implements HandlerInterceptor {

    public static final String HEADER = "X-API-Key";

    private static final Logger log = LoggerFactory.getLogger(ApiKeyInterceptor.class);

    private final ApiKeyAuthenticator authenticator;
    private final ObjectMapper objectMapper;

    public ApiKeyInterceptor(ApiKeyAuthenticator authenticator, ObjectMapper objectMapper) {
        this.authenticator = authenticator;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        Optional<UserEntity> user = authenticator.resolve(request.getHeader(HEADER));
        if (user.isEmpty()) {
            writeUnauthorized(request, response);
            return false;
        }
        AuthContext.set(user.get());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }

    private void writeUnauthorized(HttpServletRequest request, HttpServletResponse response) {
        response.setStatus(401);
        response.setCharacterEncoding("UTF-8");
        response.setContentType("application/json;charset=UTF-8");
        try {
            String json = objectMapper.writeValueAsString(
                    Result.fail(ApiCodes.UNAUTHORIZED, AuthenticationException.DEFAULT_MESSAGE));
            response.getWriter().write(json);
        } catch (Exception writeErr) {
            log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
        }
    }
}
