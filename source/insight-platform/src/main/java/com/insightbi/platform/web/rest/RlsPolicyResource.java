package com.insightbi.platform.web.rest;

import com.insightbi.common.security.AuthoritiesConstants;
import com.insightbi.common.security.SecurityUtils;
import com.insightbi.common.security.policy.RlsErrorCodes;
import com.insightbi.common.web.rest.ApiResponse;
import com.insightbi.common.web.rest.ApiResponses;
import com.insightbi.common.web.rest.ResultStatus;
import com.insightbi.platform.domain.rls.RlsPolicyLevel;
import com.insightbi.platform.service.audit.AuditService;
import com.insightbi.platform.service.rls.RlsAccessDeniedException;
import com.insightbi.platform.service.rls.RlsEngine;
import com.insightbi.platform.service.rls.RlsNotFoundException;
import com.insightbi.platform.service.rls.RlsPolicyService;
import com.insightbi.platform.service.rls.RlsRewriteResult;
import com.insightbi.platform.service.rls.RlsSubstitutionException;
import com.insightbi.platform.service.rls.RlsValidationException;
import com.insightbi.platform.service.rls.TenantAccessGuard;
import com.insightbi.platform.service.rls.dto.RlsPolicyCreateRequest;
import com.insightbi.platform.service.rls.dto.RlsPolicyDTO;
import com.insightbi.platform.service.rls.dto.RlsPolicyUpdateRequest;
import com.insightbi.platform.web.rest.dto.RlsPreviewRequest;
import com.insightbi.platform.web.rest.dto.RlsPreviewResponse;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

/**
 * Row-level security policy administration: CRUD and rewrite preview per workspace.
 * <p>
 * Besides the role check, every call requires the caller to belong to the workspace in the path
 * (see {@link TenantAccessGuard}).
 */
@RestController
@RequestMapping("/api/workspaces/{tenantId}/rls-policies")
@PreAuthorize("hasAnyAuthority('" + AuthoritiesConstants.ADMIN + "','" + AuthoritiesConstants.RLS_ADMIN + "')")
public class RlsPolicyResource {

    private final RlsPolicyService policyService;
    private final RlsEngine rlsEngine;
    private final AuditService audit;
    private final TenantAccessGuard tenantAccessGuard;

    public RlsPolicyResource(RlsPolicyService policyService, RlsEngine rlsEngine, AuditService audit, TenantAccessGuard tenantAccessGuard) {
        this.policyService = policyService;
        this.rlsEngine = rlsEngine;
        this.audit = audit;
        this.tenantAccessGuard = tenantAccessGuard;
    }

    /**
     * GET /api/workspaces/{tenantId}/rls-policies?level=...&activeOnly=...
     */
    @GetMapping
    public ApiResponse<List<RlsPolicyDTO>> list(
        @PathVariable UUID tenantId,
        @RequestParam(required = false) String level,
        @RequestParam(defaultValue = "false") boolean activeOnly
    ) {
        tenantAccessGuard.requireMember(tenantId);
        RlsPolicyLevel levelFilter = null;
        if (StringUtils.hasText(level)) {
            levelFilter = RlsPolicyLevel.normalize(level);
            if (levelFilter == null) {
                throw new RlsValidationException("Unknown policy level: " + level);
            }
        }
        List<RlsPolicyDTO> policies = policyService.listForTenant(tenantId, levelFilter, activeOnly);
        audit.audit("READ", "rls.policy", tenantId.toString());
        return ApiResponses.ok(policies);
    }

    @GetMapping("/{id}")
    public ApiResponse<RlsPolicyDTO> get(@PathVariable UUID tenantId, @PathVariable UUID id) {
        RlsPolicyDTO policy = requireInTenant(tenantId, id);
        audit.audit("READ", "rls.policy", id.toString());
        return ApiResponses.ok(policy);
    }

    @PostMapping
    public ResponseEntity<ApiResponse<RlsPolicyDTO>> create(@PathVariable UUID tenantId, @Valid @RequestBody RlsPolicyCreateRequest request) {
        tenantAccessGuard.requireMember(tenantId);
        RlsPolicyDTO created = policyService.create(request.withTenantId(tenantId), currentActor());
        audit.audit("CREATE", "rls.policy", created.id().toString());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponses.created(created));
    }

    @PutMapping("/{id}")
    public ApiResponse<RlsPolicyDTO> update(
        @PathVariable UUID tenantId,
        @PathVariable UUID id,
        @Valid @RequestBody RlsPolicyUpdateRequest request
    ) {
        requireInTenant(tenantId, id);
        RlsPolicyDTO updated = policyService.update(id, request, currentActor());
        audit.audit("UPDATE", "rls.policy", id.toString());
        return ApiResponses.ok(updated);
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Map<String, Object>> delete(@PathVariable UUID tenantId, @PathVariable UUID id) {
        requireInTenant(tenantId, id);
        if (!policyService.delete(id)) {
            throw RlsNotFoundException.policy(id);
        }
        audit.audit("DELETE", "rls.policy", id.toString());
        return ApiResponses.ok(Map.of("id", id, "deleted", true));
    }

    /**
     * POST /api/workspaces/{tenantId}/rls-policies/preview
     * Shows the query a user would run after row-level security; the query is not executed.
     */
    @PostMapping("/preview")
    public ApiResponse<RlsPreviewResponse> preview(@PathVariable UUID tenantId, @Valid @RequestBody RlsPreviewRequest request) {
        tenantAccessGuard.requireMember(tenantId);
        List<UUID> datasetIds = request.datasetIds() != null ? request.datasetIds() : List.of();
        RlsRewriteResult result = rlsEngine.rewrite(request.baseQuery(), request.userId(), tenantId, datasetIds);
        audit.audit("PREVIEW", "rls.policy", tenantId + ":user=" + request.userId());
        return ApiResponses.ok(new RlsPreviewResponse(result.query(), result.appliedPolicyIds(), result.filtered()));
    }

    @ExceptionHandler(RlsValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(RlsValidationException ex) {
        return failure(ResultStatus.INVALID, ex.getCode(), ex.getMessage(), null);
    }

    @ExceptionHandler(RlsAccessDeniedException.class)
    public ResponseEntity<ApiResponse<Void>> handleAccessDenied(RlsAccessDeniedException ex) {
        return failure(ResultStatus.DENIED, ex.getCode(), ex.getMessage(), null);
    }

    @ExceptionHandler(RlsNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(RlsNotFoundException ex) {
        return failure(ResultStatus.NOT_FOUND, ex.getCode(), ex.getMessage(), null);
    }

    @ExceptionHandler(RlsSubstitutionException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleSubstitution(RlsSubstitutionException ex) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("policyId", ex.getPolicyId());
        detail.put("keys", ex.getKeys());
        return failure(ResultStatus.UNPROCESSABLE, ex.getCode(), ex.getMessage(), detail);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex
            .getBindingResult()
            .getFieldErrors()
            .stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .findFirst()
            .orElse("Invalid request body");
        return failure(ResultStatus.INVALID, RlsErrorCodes.POLICY_INVALID, message, null);
    }

    private static <T> ResponseEntity<ApiResponse<T>> failure(ResultStatus status, String code, String message, T data) {
        return ResponseEntity.status(status.getCode()).body(ApiResponses.failure(status, code, message, data));
    }

    private RlsPolicyDTO requireInTenant(UUID tenantId, UUID id) {
        tenantAccessGuard.requireMember(tenantId);
        // policies of other tenants are reported as missing
        return policyService
            .get(id)
            .filter(policy -> tenantId.equals(policy.tenantId()))
            .orElseThrow(() -> RlsNotFoundException.policy(id));
    }

    private String currentActor() {
        return SecurityUtils.getCurrentUserLogin().orElse("system");
    }
}
