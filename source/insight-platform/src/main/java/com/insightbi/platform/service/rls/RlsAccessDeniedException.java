package com.insightbi.platform.service.rls;

import com.insightbi.common.security.policy.RlsErrorCodes;
import java.util.UUID;

/**
 * 调用方不属于请求路径中的租户，不能查看或修改该租户的策略。
 */
public class RlsAccessDeniedException extends RowLevelSecurityException {

    public RlsAccessDeniedException(UUID tenantId) {
        super(RlsErrorCodes.TENANT_ACCESS_DENIED, "Caller is not a member of tenant " + tenantId);
    }
}
