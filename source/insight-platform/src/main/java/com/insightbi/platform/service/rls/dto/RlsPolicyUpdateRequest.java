package com.insightbi.platform.service.rls.dto;

import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Partial update; {@code null} fields keep their current value.
 */
public record RlsPolicyUpdateRequest(
    @Size(max = 200) String name,
    @Size(max = 1024) String description,
    List<UUID> datasetScope,
    String predicateTemplate,
    List<String> contextKeys,
    Integer priority,
    Boolean active,
    Map<String, Object> performanceHint
) {}
