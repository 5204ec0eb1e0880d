package com.insightbi.common.web.rest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Response envelope of the platform REST APIs. {@code code} is only present on failures and {@code data} only when
 * there is a payload. Instances are built through {@link ApiResponses}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "status", "message", "code", "data" })
public final class ApiResponse<T> {

    private final ResultStatus result;
    private final String message;
    // insight-rls-000N on failures
    private final String code;
    private final T data;

    ApiResponse(ResultStatus result, String message, String code, T data) {
        this.result = result;
        this.message = message;
        this.code = code;
        this.data = data;
    }

    public int getStatus() {
        return result.getCode();
    }

    public String getMessage() {
        return message;
    }

    public String getCode() {
        return code;
    }

    public T getData() {
        return data;
    }

    @JsonIgnore
    public ResultStatus getResult() {
        return result;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return result.isSuccess();
    }
}
