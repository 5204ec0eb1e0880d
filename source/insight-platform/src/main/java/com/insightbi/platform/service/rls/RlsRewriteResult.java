package com.insightbi.platform.service.rls;

import java.util.List;
import java.util.UUID;

/**
 * Rewritten query plus the policies applied to it, outermost layer first.
 */
public record RlsRewriteResult(String query, List<UUID> appliedPolicyIds) {
    public RlsRewriteResult {
        appliedPolicyIds = appliedPolicyIds == null ? List.of() : List.copyOf(appliedPolicyIds);
    }

    public boolean filtered() {
        return !appliedPolicyIds.isEmpty();
    }
}
