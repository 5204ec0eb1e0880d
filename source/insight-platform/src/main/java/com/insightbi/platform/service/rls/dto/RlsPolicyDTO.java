package com.insightbi.platform.service.rls.dto;

import com.insightbi.platform.domain.rls.RlsPolicy;
import com.insightbi.platform.domain.rls.RlsPolicyLevel;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable snapshot of a policy; readers never see a half-applied update.
 */
public record RlsPolicyDTO(
    UUID id,
    UUID tenantId,
    String name,
    String description,
    RlsPolicyLevel level,
    UUID targetId,
    List<UUID> datasetScope,
    String predicateTemplate,
    List<String> contextKeys,
    int priority,
    boolean active,
    Map<String, Object> performanceHint,
    String createdBy,
    Instant createdAt,
    Instant updatedAt
) {
    public RlsPolicyDTO {
        datasetScope = datasetScope == null ? List.of() : List.copyOf(datasetScope);
        contextKeys = contextKeys == null ? List.of() : List.copyOf(contextKeys);
        performanceHint = performanceHint == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(performanceHint));
    }

    public static RlsPolicyDTO from(RlsPolicy policy) {
        return new RlsPolicyDTO(
            policy.getId(),
            policy.getTenantId(),
            policy.getName(),
            policy.getDescription(),
            policy.getLevel(),
            policy.getTargetId(),
            policy.getDatasetScope(),
            policy.getPredicateTemplate(),
            policy.getContextKeys(),
            policy.getPriority(),
            policy.isActive(),
            policy.getPerformanceHint(),
            policy.getCreatedBy(),
            policy.getCreatedDate(),
            policy.getLastModifiedDate()
        );
    }

    /** True when the policy restricts every dataset query of its tenant. */
    public boolean universalScope() {
        return datasetScope.isEmpty();
    }
}
