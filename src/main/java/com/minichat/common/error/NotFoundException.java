package com.minichat.common.error;

import com.minichat.common.api.ApiCodes;

public class NotFoundException extends ChatException {

    public NotFoundException(String message) {
        super(message, ApiCodes.NOT_FOUND, 404);
    }
}
