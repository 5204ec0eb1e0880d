package com.insightbi.platform.service.rls.context;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Attribute bag describing one user inside one tenant at resolution time. Never persisted with a policy.
 * <p>
 * The bag always holds {@code user_id}, {@code tenant_id}, {@code workspace_id}, {@code roles} and {@code groups};
 * profile attributes are added next to them and cannot override them.
 */
public final class UserContext {

    public static final String USER_ID = "user_id";
    public static final String TENANT_ID = "tenant_id";
    public static final String WORKSPACE_ID = "workspace_id";
    public static final String ROLES = "roles";
    public static final String GROUPS = "groups";

    public static final Set<String> RESERVED_KEYS = Set.of(USER_ID, TENANT_ID, WORKSPACE_ID, ROLES, GROUPS);

    private final UUID userId;
    private final UUID tenantId;
    private final List<String> roles;
    private final List<String> groups;
    private final Map<String, Object> attributes;

    private UserContext(UUID userId, UUID tenantId, List<String> roles, List<String> groups, Map<String, Object> attributes) {
        this.userId = userId;
        this.tenantId = tenantId;
        this.roles = roles;
        this.groups = groups;
        this.attributes = attributes;
    }

    /**
     * @param profile flat profile attributes; null values are dropped and reserved keys are ignored
     */
    public static UserContext of(UUID userId, UUID tenantId, Collection<String> roles, Collection<String> groups, Map<String, ?> profile) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(tenantId, "tenantId");
        List<String> roleList = distinct(roles);
        List<String> groupList = distinct(groups);

        Map<String, Object> bag = new LinkedHashMap<>();
        bag.put(USER_ID, userId.toString());
        bag.put(TENANT_ID, tenantId.toString());
        bag.put(WORKSPACE_ID, tenantId.toString());
        bag.put(ROLES, roleList);
        bag.put(GROUPS, groupList);
        if (profile != null) {
            profile.forEach((key, value) -> {
                if (key != null && value != null && !RESERVED_KEYS.contains(key)) {
                    bag.put(key, value);
                }
            });
        }
        return new UserContext(userId, tenantId, roleList, groupList, Collections.unmodifiableMap(bag));
    }

    private static List<String> distinct(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                unique.add(value);
            }
        }
        return List.copyOf(unique);
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public List<String> getRoles() {
        return roles;
    }

    public List<String> getGroups() {
        return groups;
    }

    public boolean contains(String key) {
        return attributes.containsKey(key);
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    /** Read-only view of every attribute, built-ins first. */
    public Map<String, Object> asMap() {
        return attributes;
    }

    @Override
    public String toString() {
        // values stay out of logs
        return "UserContext{userId=" + userId + ", tenantId=" + tenantId + ", keys=" + attributes.keySet() + "}";
    }
}
