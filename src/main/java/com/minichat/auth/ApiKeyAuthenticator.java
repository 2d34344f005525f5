package com.minichat.auth;

import com.minichat.common.error.AuthenticationException;
import com.minichat.domain.entity.UserEntity;
import com.minichat.domain.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * api key 鉴权，REST 与 WS 握手共用。
 */
@Component
@RequiredArgsConstructor
public class ApiKeyAuthenticator {

    private final UserService userService;

    public Optional<UserEntity> resolve(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(userService.findByApiKey(apiKey.trim()));
    }

    public UserEntity authenticate(String apiKey) {
        return resolve(apiKey).orElseThrow(AuthenticationException::new);
    }
}
