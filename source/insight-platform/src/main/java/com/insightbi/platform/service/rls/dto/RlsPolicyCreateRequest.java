package com.insightbi.platform.service.rls.dto;

import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Fields of a new policy. {@code tenantId} and {@code predicateTemplate} are required; {@code priority} defaults to 0,
 * {@code active} to true and {@code level} to {@code TENANT}.
 */
public record RlsPolicyCreateRequest(
    UUID tenantId,
    @Size(max = 200) String name,
    @Size(max = 1024) String description,
    String level,
    UUID targetId,
    List<UUID> datasetScope,
    String predicateTemplate,
    List<String> contextKeys,
    Integer priority,
    Boolean active,
    Map<String, Object> performanceHint
) {
    public RlsPolicyCreateRequest withTenantId(UUID value) {
        return new RlsPolicyCreateRequest(
            value,
            name,
            description,
            level,
            targetId,
            datasetScope,
            predicateTemplate,
            contextKeys,
            priority,
            active,
            performanceHint
        );
    }
}
