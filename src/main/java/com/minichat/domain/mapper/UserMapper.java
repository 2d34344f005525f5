package com.minichat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.minichat.domain.entity.UserEntity;

public interface UserMapper extends BaseMapper<UserEntity> {
}
