package com.minichat.delivery;

import com.minichat.domain.dto.MessageView;
import com.minichat.domain.entity.UserEntity;

/**
 * 外部 pub/sub 镜像。每条消息只发布一次，失败不影响其它投递通道。
 *
 * <p>返回值表示是否真正发出；降级跳过时返回 false。</p>
 */
public interface PubSubMirror {

    boolean publishRoomMessage(MessageView view, UserEntity sender);

    boolean publishDirectMessage(MessageView view, UserEntity sender, UserEntity recipient);
}
