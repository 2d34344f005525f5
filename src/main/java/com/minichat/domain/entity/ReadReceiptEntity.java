package com.minichat.domain.entity;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 已读回执，主键 (message_id, username)。每个用户对每条消息最多一行。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@TableName("t_read_receipt")
public class ReadReceiptEntity {

    private Long messageId;

    private String username;

    private LocalDateTime readAt;
}
