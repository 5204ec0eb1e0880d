package com.insightbi.platform.service.rls;

import com.insightbi.common.security.policy.RlsErrorCodes;
import com.insightbi.platform.config.RlsProperties;
import com.insightbi.platform.service.rls.context.UserContext;
import java.lang.reflect.Array;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * 将策略谓词模板中的占位符替换为转义后的字面量。
 * <ul>
 *     <li>{@code {key}}：标量，替换为单个带引号的字面量；</li>
 *     <li>{@code ${key}}：序列，替换为 {@code ('a','b')} 形式的列表，空序列为 {@code ()}。</li>
 * </ul>
 * 模板只扫描一次，替换结果不会再次被解析，因此属性值中出现的占位符不会被展开。
 */
@Component
public class PredicateTemplateEngine {

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile(
        "\\$\\{([A-Za-z_][A-Za-z0-9_.]*)\\}|\\{([A-Za-z_][A-Za-z0-9_.]*)\\}"
    );

    private final RlsProperties properties;

    public PredicateTemplateEngine(RlsProperties properties) {
        this.properties = properties;
    }

    /**
     * Placeholders of the template in order of appearance.
     */
    public List<Placeholder> parse(String template) {
        List<Placeholder> placeholders = new ArrayList<>();
        if (template == null) {
            return placeholders;
        }
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                placeholders.add(new Placeholder(matcher.group(1), true, matcher.start(), matcher.end()));
            } else {
                placeholders.add(new Placeholder(matcher.group(2), false, matcher.start(), matcher.end()));
            }
        }
        return placeholders;
    }

    /**
     * Distinct attribute names referenced by the template.
     */
    public Set<String> referencedKeys(String template) {
        return parse(template).stream().map(Placeholder::key).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * @throws RlsSubstitutionException when an attribute is absent or its value does not fit the placeholder form
     */
    public String substitute(String template, UserContext context) {
        if (template == null) {
            throw new RlsSubstitutionException(RlsErrorCodes.ATTRIBUTE_MISSING, "Predicate template is missing", List.of());
        }
        List<Placeholder> placeholders = parse(template);
        if (placeholders.isEmpty()) {
            return template;
        }

        Set<String> missing = new LinkedHashSet<>();
        for (Placeholder placeholder : placeholders) {
            if (context == null || !context.contains(placeholder.key())) {
                missing.add(placeholder.key());
            }
        }
        if (!missing.isEmpty()) {
            throw new RlsSubstitutionException(
                RlsErrorCodes.ATTRIBUTE_MISSING,
                "Context attribute(s) missing: " + String.join(", ", missing),
                List.copyOf(missing)
            );
        }

        StringBuilder out = new StringBuilder(template.length() + 32);
        int cursor = 0;
        for (Placeholder placeholder : placeholders) {
            out.append(template, cursor, placeholder.start());
            Object value = context.get(placeholder.key());
            out.append(placeholder.set() ? renderSet(placeholder.key(), value) : renderScalar(placeholder.key(), value));
            cursor = placeholder.end();
        }
        out.append(template, cursor, template.length());
        return out.toString();
    }

    private String renderScalar(String key, Object value) {
        if (value instanceof Collection<?> || (value != null && value.getClass().isArray())) {
            throw new RlsSubstitutionException(
                RlsErrorCodes.ATTRIBUTE_SHAPE_MISMATCH,
                "Attribute '" + key + "' is a sequence; use ${" + key + "}",
                List.of(key)
            );
        }
        return quote(key, value);
    }

    private String renderSet(String key, Object value) {
        List<Object> items = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            items.addAll(collection);
        } else if (value != null && value.getClass().isArray()) {
            int len = Array.getLength(value);
            for (int i = 0; i < len; i++) {
                items.add(Array.get(value, i));
            }
        } else {
            throw new RlsSubstitutionException(
                RlsErrorCodes.ATTRIBUTE_SHAPE_MISMATCH,
                "Attribute '" + key + "' is not a sequence; use {" + key + "}",
                List.of(key)
            );
        }
        List<String> literals = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item instanceof Collection<?> || (item != null && item.getClass().isArray())) {
                throw unsupported(key);
            }
            literals.add(quote(key, item));
        }
        return "(" + String.join(",", literals) + ")";
    }

    private String quote(String key, Object value) {
        if (!isScalar(value)) {
            throw unsupported(key);
        }
        return properties.getLiteralDialect().quote(String.valueOf(value));
    }

    private boolean isScalar(Object value) {
        return (
            value instanceof CharSequence ||
            value instanceof Number ||
            value instanceof Boolean ||
            value instanceof Character ||
            value instanceof UUID ||
            value instanceof Enum<?> ||
            value instanceof TemporalAccessor
        );
    }

    private RlsSubstitutionException unsupported(String key) {
        return new RlsSubstitutionException(
            RlsErrorCodes.ATTRIBUTE_TYPE_UNSUPPORTED,
            "Attribute '" + key + "' holds a value that cannot be rendered as a literal",
            List.of(key)
        );
    }

    /**
     * One placeholder occurrence; {@code set} marks the {@code ${key}} form.
     */
    public record Placeholder(String key, boolean set, int start, int end) {}
}
