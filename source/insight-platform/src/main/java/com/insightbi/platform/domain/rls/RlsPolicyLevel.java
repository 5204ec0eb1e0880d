package com.insightbi.platform.domain.rls;

import java.util.Locale;

/**
 * Granularity a row-level security policy is written for. Informational today; kept on every policy so that
 * cache invalidation can later be targeted per level.
 */
public enum RlsPolicyLevel {
    TENANT("workspace"),
    GROUP(null),
    USER(null),
    DASHBOARD(null),
    CHART(null),
    VIEW("webview");

    private final String legacyName;

    RlsPolicyLevel(String legacyName) {
        this.legacyName = legacyName;
    }

    /**
     * Parses a level name, accepting the legacy {@code workspace}/{@code webview} spellings.
     *
     * @return the level, or {@code null} when the value is blank or unknown
     */
    public static RlsPolicyLevel normalize(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return null;
        }
        for (RlsPolicyLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
            if (level.legacyName != null && level.legacyName.equalsIgnoreCase(normalized)) {
                return level;
            }
        }
        return null;
    }
}
