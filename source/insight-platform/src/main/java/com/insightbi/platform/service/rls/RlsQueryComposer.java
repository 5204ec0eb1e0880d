package com.insightbi.platform.service.rls;

import com.insightbi.platform.config.RlsProperties;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 将基础查询逐层包裹为派生表，每层追加一条策略谓词。
 * <p>
 * 谓词按优先级从高到低传入，第一条位于最外层；每层的右括号另起一行。别名按传入顺序编号（{@code rls_0} 对应最高优先级），
 * 与基础查询中已出现的标识符冲突时更换前缀。
 */
@Component
public class RlsQueryComposer {

    private static final Logger LOG = LoggerFactory.getLogger(RlsQueryComposer.class);
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[^a-zA-Z0-9_]");

    private final RlsProperties properties;

    public RlsQueryComposer(RlsProperties properties) {
        this.properties = properties;
    }

    public String compose(String baseQuery, List<String> orderedPredicates) {
        if (orderedPredicates == null || orderedPredicates.isEmpty()) {
            return baseQuery;
        }
        String sanitized = stripTrailingSemicolon(baseQuery);
        String prefix = resolvePrefix(sanitized, orderedPredicates.size());
        String composed = sanitized;
        for (int i = orderedPredicates.size() - 1; i >= 0; i--) {
            // the closing paren starts a new line so a trailing line comment cannot swallow it
            composed = "SELECT * FROM (" + composed + "\n) AS " + prefix + "_" + i + " WHERE " + orderedPredicates.get(i);
        }
        return composed;
    }

    private String resolvePrefix(String baseQuery, int levels) {
        String base = normalizePrefix(properties.getAliasPrefix());
        String candidate = base;
        int attempt = 0;
        while (collides(baseQuery, candidate, levels)) {
            attempt++;
            candidate = base + attempt;
        }
        if (attempt > 0) {
            LOG.debug("Alias prefix '{}' collides with base query identifiers, using '{}'", base, candidate);
        }
        return candidate;
    }

    private boolean collides(String baseQuery, String prefix, int levels) {
        if (!StringUtils.hasText(baseQuery)) {
            return false;
        }
        for (int i = 0; i < levels; i++) {
            Pattern word = Pattern.compile("(?<![A-Za-z0-9_])" + Pattern.quote(prefix + "_" + i) + "(?![A-Za-z0-9_])", Pattern.CASE_INSENSITIVE);
            if (word.matcher(baseQuery).find()) {
                return true;
            }
        }
        return false;
    }

    private String normalizePrefix(String prefix) {
        String normalized = StringUtils.hasText(prefix) ? IDENTIFIER_PATTERN.matcher(prefix.trim()).replaceAll("_") : "rls";
        normalized = normalized.toLowerCase(Locale.ROOT);
        if (!Character.isLetter(normalized.charAt(0))) {
            normalized = "rls_" + normalized;
        }
        return normalized;
    }

    private String stripTrailingSemicolon(String sql) {
        String candidate = sql == null ? "" : sql.trim();
        while (candidate.endsWith(";")) {
            candidate = candidate.substring(0, candidate.length() - 1).trim();
        }
        return candidate;
    }
}
