package com.minichat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.minichat.domain.entity.MessageEntity;
import com.minichat.domain.entity.ReadReceiptEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * 未读 = 没有该用户回执、且不是该用户自己发的消息。
 *
 * <p>私信范围：viewAll=false 时只看发给自己的；viewAll=true（viewer）看全站私信。</p>
 */
public interface ReadReceiptMapper extends BaseMapper<ReadReceiptEntity> {

    @Select("""
            select m.*
            from t_message m
            where m.to_username is null
              and m.from_username != #{username}
              and not exists (
                select 1 from t_read_receipt r
                where r.message_id = m.id and r.username = #{username}
              )
            order by m.created_at asc, m.id asc
            limit #{limit} offset #{offset}
            """)
    List<MessageEntity> selectUnreadRoom(@Param("username") String username,
                                         @Param("limit") int limit,
                                         @Param("offset") int offset);

    @Select("""
            select count(*)
            from t_message m
            where m.to_username is null
              and m.from_username != #{username}
              and not exists (
                select 1 from t_read_receipt r
                where r.message_id = m.id and r.username = #{username}
              )
            """)
    long countUnreadRoom(@Param("username") String username);

    @Select("""
            select m.id
            from t_message m
            where m.to_username is null
              and m.from_username != #{username}
              and not exists (
                select 1 from t_read_receipt r
                where r.message_id = m.id and r.username = #{username}
              )
            """)
    List<Long> selectUnreadRoomIds(@Param("username") String username);

    @Select("""
            <script>
            select m.*
            from t_message m
            where m.to_username is not null
              and m.from_username != #{username}
              <if test="!viewAll">and m.to_username = #{username}</if>
              and not exists (
                select 1 from t_read_receipt r
                where r.message_id = m.id and r.username = #{username}
              )
            order by m.created_at asc, m.id asc
            limit #{limit} offset #{offset}
            </script>
            """)
    List<MessageEntity> selectUnreadDirect(@Param("username") String username,
                                           @Param("viewAll") boolean viewAll,
                                           @Param("limit") int limit,
                                           @Param("offset") int offset);

    @Select("""
            <script>
            select count(*)
            from t_message m
            where m.to_username is not null
              and m.from_username != #{username}
              <if test="!viewAll">and m.to_username = #{username}</if>
              and not exists (
                select 1 from t_read_receipt r
                where r.message_id = m.id and r.username = #{username}
              )
            </script>
            """)
    long countUnreadDirect(@Param("username") String username, @Param("viewAll") boolean viewAll);

    /**
     * fromUsername 不为空时只取该发送方发给自己的私信（mark_direct_read）。
     */
    @Select("""
            <script>
            select m.id
            from t_message m
            where m.to_username is not null
              and m.from_username != #{username}
              <choose>
                <when test="fromUsername != null">and m.from_username = #{fromUsername} and m.to_username = #{username}</when>
                <when test="!viewAll">and m.to_username = #{username}</when>
              </choose>
              and not exists (
                select 1 from t_read_receipt r
                where r.message_id = m.id and r.username = #{username}
              )
            </script>
            """)
    List<Long> selectUnreadDirectIds(@Param("username") String username,
                                     @Param("viewAll") boolean viewAll,
                                     @Param("fromUsername") String fromUsername);
}
