package com.minichat.common.error;

import com.minichat.common.api.ApiCodes;
import com.minichat.domain.enums.Permission;

/**
 * 角色缺少所需权限。在落库之前抛出，不会产生消息记录。
 */
public class PermissionDeniedException extends ChatException {

    private final Permission permission;

    public PermissionDeniedException(Permission permission, String message) {
        super(message, ApiCodes.FORBIDDEN, 403);
        this.permission = permission;
    }

    public Permission getPermission() {
        return permission;
    }
}
