package com.minichat.common.error;

import com.minichat.common.api.ApiCodes;

/** 缺少或无效的 api key。 */
public class AuthenticationException extends ChatException {

    public static final String DEFAULT_MESSAGE = "Invalid or missing authentication credentials";

    public AuthenticationException() {
        this(DEFAULT_MESSAGE);
    }

    public AuthenticationException(String message) {
        super(message, ApiCodes.UNAUTHORIZED, 401);
    }
}
