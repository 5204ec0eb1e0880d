package com.insightbi.common.web.rest;

/**
 * 接口结果状态，{@code code} 同时用作 HTTP 状态码。
 */
public enum ResultStatus {
    SUCCESS(200, "OK"),
    CREATED(201, "Created"),
    INVALID(400, "Invalid request"),
    DENIED(403, "Access denied"),
    NOT_FOUND(404, "Not found"),
    UNPROCESSABLE(422, "Request cannot be processed");

    private final int code;
    private final String defaultMessage;

    ResultStatus(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public int getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public boolean isSuccess() {
        return code < 300;
    }
}
