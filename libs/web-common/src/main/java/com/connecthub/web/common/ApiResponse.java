package com.connecthub.web.common;

import java.io.Serializable;

/**
 * 统一 REST 响应信封。
 * <p>
 * 状态码沿用 HTTP 语义：200 成功，400 参数错误，404 对局不存在，409 对局状态冲突，500 服务端错误。
 *
 * @param code    响应状态码
 * @param message 提示信息（失败时为可直接展示的原因）
 * @param data    响应数据，失败时为 null
 * @param <T>     数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;
    public static final int SERVER_ERROR = 500;

    /** 成功响应（带数据） */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(OK, "success", data);
    }

    /** 通用失败响应 */
    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return error(BAD_REQUEST, message);
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return error(NOT_FOUND, message);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return error(CONFLICT, message);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return error(SERVER_ERROR, message);
    }

    /** 是否成功（code == 200） */
    public boolean isSuccess() {
        return code == OK;
    }
}
