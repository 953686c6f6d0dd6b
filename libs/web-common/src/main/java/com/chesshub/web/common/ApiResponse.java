package com.chesshub.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param code    响应状态码（与 HTTP 状态码保持一致：200/400/401/404/409/500）
 * @param message 响应消息
 * @param data    响应数据，失败时为 null
 * @param <T>     响应数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static final String OK = "success";

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, OK, data);
    }

    /**
     * 成功响应（带消息和数据）
     */
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(200, message, data);
    }

    /**
     * 失败响应（自定义状态码）
     */
    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    /** 400：参数错误 */
    public static <T> ApiResponse<T> badRequest(String message) {
        return error(400, message);
    }

    /** 401：账号或密码错误 */
    public static <T> ApiResponse<T> unauthorized(String message) {
        return error(401, message);
    }

    /** 404：资源不存在（房间、用户） */
    public static <T> ApiResponse<T> notFound(String message) {
        return error(404, message);
    }

    /** 409：业务状态冲突（如用户名已被占用） */
    public static <T> ApiResponse<T> conflict(String message) {
        return error(409, message);
    }
}
