package com.minichat.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.minichat.domain.entity.UserEntity;

import java.util.List;

public interface UserService extends IService<UserEntity> {

    /**
     * 直接查库，注册、资料修改由外部写入，这里必须看到最新一行。发送校验、资料查询走这个。
     * 不存在返回 null。
     */
    UserEntity findByUsername(String username);

    /**
     * 只用于展示信息（logo、emoji、是否 bot）的短 TTL 缓存读取。不存在不缓存；返回副本，调用方可随意修改。
     */
    UserEntity findProfile(String username);

    /** 不缓存：api key 只在握手/请求鉴权时查一次。 */
    UserEntity findByApiKey(String apiKey);

    /** 可参与聊天的用户（排除 viewer）。 */
    List<UserEntity> listChatUsers();

    void invalidate(String username);

    void invalidateAll();
}
