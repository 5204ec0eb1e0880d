package com.insightbi.platform.service.rls.context;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Source of user profile documents.
 */
public interface UserProfileProvider {
    /**
     * @return the profile attributes, possibly nested, or empty when the user does not exist
     */
    Optional<Map<String, Object>> getProfile(UUID userId);
}
