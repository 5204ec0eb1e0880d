package com.insightbi.platform.service.rls;

/**
 * 行级安全处理链路中的异常基类，携带机器可读的错误码，调用方必须将其视为“拒绝访问”。
 */
public class RowLevelSecurityException extends RuntimeException {

    private final String code;

    public RowLevelSecurityException(String code, String message) {
        super(message);
        this.code = code;
    }

    public RowLevelSecurityException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
