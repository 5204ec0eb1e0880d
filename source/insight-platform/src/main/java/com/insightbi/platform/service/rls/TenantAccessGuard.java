package com.insightbi.platform.service.rls;

import com.insightbi.common.security.AuthoritiesConstants;
import com.insightbi.common.security.SecurityUtils;
import com.insightbi.platform.service.rls.context.RoleAssignmentProvider;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 租户隔离检查：平台管理员（{@code ROLE_ADMIN}）可以管理任意租户的策略，
 * 其他调用方（如 {@code ROLE_RLS_ADMIN}）必须在目标租户内持有有效角色。
 * 调用方身份取自 JWT 的 subject，即 {@code users.id}。
 */
@Service
public class TenantAccessGuard {

    private static final Logger LOG = LoggerFactory.getLogger(TenantAccessGuard.class);

    private final RoleAssignmentProvider roleAssignmentProvider;

    public TenantAccessGuard(RoleAssignmentProvider roleAssignmentProvider) {
        this.roleAssignmentProvider = roleAssignmentProvider;
    }

    /**
     * @throws RlsAccessDeniedException when the current caller has no active membership in the tenant
     */
    public void requireMember(UUID tenantId) {
        if (SecurityUtils.hasCurrentUserAnyOfAuthorities(AuthoritiesConstants.ADMIN)) {
            return;
        }
        Optional<UUID> callerId = currentUserId();
        if (callerId.isEmpty()) {
            LOG.warn("Tenant {} access refused: caller has no user id", tenantId);
            throw new RlsAccessDeniedException(tenantId);
        }
        List<String> roles = roleAssignmentProvider.getRoles(callerId.get(), tenantId);
        if (roles == null || roles.isEmpty()) {
            LOG.warn("Tenant {} access refused: user {} is not a member", tenantId, callerId.get());
            throw new RlsAccessDeniedException(tenantId);
        }
    }

    private Optional<UUID> currentUserId() {
        Optional<String> subject = SecurityUtils.getCurrentUserId();
        if (subject.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(subject.get()));
        } catch (IllegalArgumentException e) {
            LOG.debug("JWT subject '{}' is not a user id", subject.get());
            return Optional.empty();
        }
    }
}
