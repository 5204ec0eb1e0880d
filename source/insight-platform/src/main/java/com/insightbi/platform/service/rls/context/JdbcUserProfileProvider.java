package com.insightbi.platform.service.rls.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Loads the {@code profile_data} JSON document of a user.
 */
@Component
public class JdbcUserProfileProvider implements UserProfileProvider {

    private static final String PROFILE_SQL = "SELECT profile_data FROM users WHERE id = :userId";
    private static final TypeReference<LinkedHashMap<String, Object>> PROFILE_TYPE = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcUserProfileProvider(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Map<String, Object>> getProfile(UUID userId) {
        List<String> rows = jdbcTemplate.query(PROFILE_SQL, Map.of("userId", userId), (rs, rowNum) -> {
            String json = rs.getString(1);
            return json == null ? "" : json;
        });
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parse(userId, rows.get(0)));
    }

    Map<String, Object> parse(UUID userId, String json) {
        if (!StringUtils.hasText(json)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> profile = objectMapper.readValue(json, PROFILE_TYPE);
            return profile != null ? profile : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed profile_data for user " + userId, e);
        }
    }
}
