package com.minichat.gateway.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 客户端上行帧。按 type 路由，缺省 type 视为 message（兼容旧客户端）。
 *
 * <p>身份只认握手时绑定的连接，帧里不接受 from 之类的身份字段。</p>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WsInboundFrame {

    public static final String DEFAULT_TYPE = "message";

    private String type;

    private String content;

    private String toUsername;

    /** 雪花 id 按字符串传输；数字也能接收。 */
    private String messageId;

    private String fromUsername;

    private String username;

    private Integer limit;

    private Integer offset;

    private String since;

    public String typeOrDefault() {
        return type == null || type.isBlank() ? DEFAULT_TYPE : type.trim();
    }
}
