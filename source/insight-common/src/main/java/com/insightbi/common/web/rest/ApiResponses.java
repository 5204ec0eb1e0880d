package com.insightbi.common.web.rest;

import java.util.Objects;

public final class ApiResponses {

    private ApiResponses() {}

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(ResultStatus.SUCCESS, ResultStatus.SUCCESS.getDefaultMessage(), null, data);
    }

    public static <T> ApiResponse<T> created(T data) {
        return new ApiResponse<>(ResultStatus.CREATED, ResultStatus.CREATED.getDefaultMessage(), null, data);
    }

    public static <T> ApiResponse<T> failure(ResultStatus status, String code, String message) {
        return failure(status, code, message, null);
    }

    /**
     * @param message falls back to the status' default message when blank
     * @throws IllegalArgumentException when {@code status} is a success status
     */
    public static <T> ApiResponse<T> failure(ResultStatus status, String code, String message, T data) {
        Objects.requireNonNull(status, "status");
        if (status.isSuccess()) {
            throw new IllegalArgumentException("Not a failure status: " + status);
        }
        String text = message == null || message.isBlank() ? status.getDefaultMessage() : message;
        return new ApiResponse<>(status, text, code, data);
    }
}
