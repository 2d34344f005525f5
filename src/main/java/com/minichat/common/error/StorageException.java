package com.minichat.common.error;

import com.minichat.common.api.ApiCodes;

/**
 * 持久化失败（连接、约束冲突等）。同步抛给调用方，此时不会发生任何投递。
 */
public class StorageException extends ChatException {

    public StorageException(String message, Throwable cause) {
        super(message, ApiCodes.INTERNAL_ERROR, 500, cause);
    }
}
