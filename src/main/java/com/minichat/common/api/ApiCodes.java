package com.minichat.common.api;

/**
 * 统一错误码定义。
 *
 * <p>与 HTTP 状态码一一对应的最小集合：400xx 参数/校验，401xx 鉴权，403xx 权限，404xx 不存在，500xx 服务端。</p>
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 业务校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 未提供 api key / api key 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** 角色缺少所需权限 */
    public static final int FORBIDDEN = 40300;

    /** 资源不存在（消息、用户、路径） */
    public static final int NOT_FOUND = 40400;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;
}
