package com.insightbi.platform.service.rls;

import com.insightbi.common.security.policy.RlsErrorCodes;
import java.util.UUID;

/**
 * 找不到策略，或无法为用户在租户内解析出上下文。后者必须按“拒绝”处理，而不是“不施加策略”。
 */
public class RlsNotFoundException extends RowLevelSecurityException {

    public enum Kind {
        POLICY,
        CONTEXT
    }

    private final Kind kind;

    private RlsNotFoundException(Kind kind, String code, String message) {
        super(code, message);
        this.kind = kind;
    }

    public static RlsNotFoundException policy(UUID policyId) {
        return new RlsNotFoundException(Kind.POLICY, RlsErrorCodes.POLICY_NOT_FOUND, "RLS policy not found: " + policyId);
    }

    public static RlsNotFoundException context(UUID userId, UUID tenantId, String reason) {
        return new RlsNotFoundException(
            Kind.CONTEXT,
            RlsErrorCodes.CONTEXT_NOT_FOUND,
            "No user context for user " + userId + " in tenant " + tenantId + ": " + reason
        );
    }

    public Kind getKind() {
        return kind;
    }
}
