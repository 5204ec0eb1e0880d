package com.insightbi.platform.web.rest.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;

public record RlsPreviewRequest(@NotBlank String baseQuery, @NotNull UUID userId, List<UUID> datasetIds) {}
