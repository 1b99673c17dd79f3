package com.syncrecovery.api.rest;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for every response body: {@code {success, data}} or {@code {success, error}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, ApiError error) {

    public record ApiError(String code, String message) {}

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static ApiResponse<Void> error(String code, String message) {
        return new ApiResponse<>(false, null, new ApiError(code, message));
    }
}
