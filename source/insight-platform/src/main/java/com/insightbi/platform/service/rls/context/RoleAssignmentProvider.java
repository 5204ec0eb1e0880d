package com.insightbi.platform.service.rls.context;

import java.util.List;
import java.util.UUID;

/**
 * Source of a user's role assignments inside a tenant.
 */
public interface RoleAssignmentProvider {
    /**
     * @return names of the roles the user actively holds in the tenant; empty when the user is not a member
     */
    List<String> getRoles(UUID userId, UUID tenantId);

    /**
     * @return group memberships of the user in the tenant
     */
    default List<String> getGroups(UUID userId, UUID tenantId) {
        return List.of();
    }
}
