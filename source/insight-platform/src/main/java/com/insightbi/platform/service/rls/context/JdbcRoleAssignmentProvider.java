package com.insightbi.platform.service.rls.context;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Reads active role assignments from the workspace membership tables.
 */
@Component
public class JdbcRoleAssignmentProvider implements RoleAssignmentProvider {

    private static final String ACTIVE_ROLES_SQL =
        "SELECT DISTINCT r.name FROM user_roles ura " +
        "JOIN roles r ON ura.role_id = r.id " +
        "WHERE ura.user_id = :userId AND ura.workspace_id = :tenantId AND ura.is_active = TRUE " +
        "ORDER BY r.name";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcRoleAssignmentProvider(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<String> getRoles(UUID userId, UUID tenantId) {
        return jdbcTemplate.queryForList(ACTIVE_ROLES_SQL, Map.of("userId", userId, "tenantId", tenantId), String.class);
    }
}
