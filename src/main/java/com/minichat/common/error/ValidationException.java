package com.minichat.common.error;

import com.minichat.common.api.ApiCodes;

/** 参数缺失、格式错误、目标用户不可达等在落库前就能发现的问题。 */
public class ValidationException extends ChatException {

    public ValidationException(String message) {
        super(message, ApiCodes.BAD_REQUEST, 400);
    }
}
