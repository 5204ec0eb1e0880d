package com.insightbi.platform.service.rls;

import com.insightbi.common.security.policy.RlsErrorCodes;

/**
 * 策略在创建或更新时校验失败（缺少租户、缺少谓词模板等）。
 */
public class RlsValidationException extends RowLevelSecurityException {

    public RlsValidationException(String message) {
        super(RlsErrorCodes.POLICY_INVALID, message);
    }
}
