package com.duohub.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式（HTTP 接口与 Feign 下游共用）
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(
    /**
     * 响应状态码
     * 200: 成功
     * 400: 参数错误（含非法走子载荷）
     * 404: 会话不存在
     * 409: 状态冲突（不是你的回合 / 会话已结束 / 已过期）
     * 503: 下游不可用（走兜底）
     */
    int code,

    /**
     * 响应消息；业务错误时为错误码（如 NOT_YOUR_TURN）
     */
    String message,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

    public static final int OK = 200;

    /**
     * 成功响应（无数据）
     */
    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(OK, "success", null);
    }

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(OK, "success", data);
    }

    /**
     * 成功响应（带消息和数据）
     */
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(OK, message, data);
    }

    /**
     * 失败响应
     */
    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null);
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return new ApiResponse<>(404, message, null);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, message, null);
    }

    public static <T> ApiResponse<T> unavailable(String message) {
        return new ApiResponse<>(503, message, null);
    }

    /**
     * 下游返回是否可用：code=200 且 data 非空
     */
    public boolean hasData() {
        return code == OK && data != null;
    }
}
