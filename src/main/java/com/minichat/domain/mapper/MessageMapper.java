package com.minichat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.minichat.domain.entity.MessageEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface MessageMapper extends BaseMapper<MessageEntity> {

    /**
     * 保留上限裁剪用：最老的 n 条消息 id。
     */
    @Select("""
            select id
            from t_message
            order by created_at asc, id asc
            limit #{n}
            """)
    List<Long> selectOldestIds(@Param("n") long n);
}
