package com.insightbi.platform.service.rls.context;

import com.insightbi.platform.service.rls.RlsNotFoundException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 解析用户在租户内的上下文：角色、分组以及扁平化后的个人资料属性。
 * <p>
 * 用户在租户内没有有效成员关系时抛出 {@link RlsNotFoundException}，调用方必须拒绝查询。
 * 缺失的资料属性不会被填充默认值。
 */
@Service
public class UserContextResolver {

    private static final Logger LOG = LoggerFactory.getLogger(UserContextResolver.class);

    private final RoleAssignmentProvider roleAssignmentProvider;
    private final UserProfileProvider userProfileProvider;

    public UserContextResolver(RoleAssignmentProvider roleAssignmentProvider, UserProfileProvider userProfileProvider) {
        this.roleAssignmentProvider = roleAssignmentProvider;
        this.userProfileProvider = userProfileProvider;
    }

    public UserContext resolve(UUID userId, UUID tenantId) {
        if (userId == null || tenantId == null) {
            throw RlsNotFoundException.context(userId, tenantId, "user and tenant are required");
        }
        List<String> roles = roleAssignmentProvider.getRoles(userId, tenantId);
        if (roles == null || roles.isEmpty()) {
            throw RlsNotFoundException.context(userId, tenantId, "no active membership");
        }
        Map<String, Object> profile = userProfileProvider
            .getProfile(userId)
            .orElseThrow(() -> RlsNotFoundException.context(userId, tenantId, "user profile missing"));
        List<String> groups = roleAssignmentProvider.getGroups(userId, tenantId);

        Map<String, Object> flat = flatten(profile);
        for (String reserved : UserContext.RESERVED_KEYS) {
            if (flat.containsKey(reserved)) {
                LOG.warn("Profile attribute '{}' of user {} collides with a built-in context attribute and is ignored", reserved, userId);
            }
        }
        UserContext context = UserContext.of(userId, tenantId, roles, groups, flat);
        LOG.debug("Resolved {}", context);
        return context;
    }

    /**
     * Flattens nested profile objects into dotted keys; sequences of values become lists, nulls are dropped.
     * When a literal dotted key and a nested path produce the same key, the first one in document order is kept.
     */
    static Map<String, Object> flatten(Map<String, ?> profile) {
        Map<String, Object> flat = new LinkedHashMap<>();
        if (profile != null) {
            flattenInto("", profile, flat);
        }
        return flat;
    }

    private static void flattenInto(String prefix, Map<?, ?> source, Map<String, Object> target) {
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            String key = prefix + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                flattenInto(key + ".", nested, target);
            } else if (value instanceof Collection<?> collection) {
                putFirst(target, key, collection.stream().filter(Objects::nonNull).toList());
            } else if (value.getClass().isArray()) {
                int len = Array.getLength(value);
                List<Object> items = new ArrayList<>(len);
                for (int i = 0; i < len; i++) {
                    Object element = Array.get(value, i);
                    if (element != null) {
                        items.add(element);
                    }
                }
                putFirst(target, key, List.copyOf(items));
            } else {
                putFirst(target, key, value);
            }
        }
    }

    private static void putFirst(Map<String, Object> target, String key, Object value) {
        if (target.containsKey(key)) {
            LOG.warn("Profile attribute '{}' is defined more than once after flattening; keeping the first value", key);
            return;
        }
        target.put(key, value);
    }
}
