package com.livedesk.support.common.api;

public record ApiResponse<T>(boolean ok, T data, String error) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> error(String error) {
        return new ApiResponse<>(false, null, error);
    }

    public static <T> ApiResponse<T> error(String error, T data) {
        return new ApiResponse<>(false, data, error);
    }
}
