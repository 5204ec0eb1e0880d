package com.insightbi.platform.web.rest.dto;

import java.util.List;
import java.util.UUID;

public record RlsPreviewResponse(String query, List<UUID> appliedPolicyIds, boolean filtered) {}
