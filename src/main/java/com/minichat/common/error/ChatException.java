package com.minichat.common.error;

/**
 * 业务异常基类：携带业务码与 HTTP 状态码，由 GlobalExceptionHandler / WS 错误帧统一翻译。
 *
 * <p>message 会原样回给调用方，所以要写成可以直接展示的句子。</p>
 */
public abstract class ChatException extends RuntimeException {

    private final int code;
    private final int httpStatus;

    protected ChatException(String message, int code, int httpStatus) {
        super(message);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    protected ChatException(String message, int code, int httpStatus, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public int getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
