package com.minichat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.minichat.domain.enums.Permission;
import com.minichat.domain.enums.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 用户身份。注册、资料修改不在本服务内，这里只读。
 *
 * <p>role 是唯一的事实来源；isAdmin/isViewer/isBot 只是派生出来的只读判断，不落库。</p>
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder(toBuilder = true)
@Data
@TableName("t_user")
public class UserEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String username;

    @JsonIgnore
    private String apiKey;

    /** 角色：见 {@link Role}（数据库存小写字符串）。 */
    private Role role;

    /** 可选：消息回调地址。 */
    private String webhookUrl;

    private String logo;

    private String emoji;

    /** bot 的创建者 username；普通用户为空。 */
    private String createdBy;

    private LocalDateTime createdAt;

    @JsonIgnore
    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    @JsonIgnore
    public boolean isViewer() {
        return role == Role.VIEWER;
    }

    @JsonIgnore
    public boolean isBot() {
        return role == Role.BOT;
    }

    public boolean hasPermission(Permission permission) {
        return role != null && role.hasPermission(permission);
    }

    @JsonIgnore
    public boolean hasWebhook() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
