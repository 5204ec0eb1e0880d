package com.insightbi.platform.service.rls;

import com.insightbi.platform.domain.rls.RlsPolicy;
import com.insightbi.platform.domain.rls.RlsPolicyLevel;
import com.insightbi.platform.repository.rls.RlsPolicyRepository;
import com.insightbi.platform.service.rls.dto.RlsPolicyCreateRequest;
import com.insightbi.platform.service.rls.dto.RlsPolicyDTO;
import com.insightbi.platform.service.rls.dto.RlsPolicyUpdateRequest;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Durable store of row-level security policies.
 */
@Service
@Transactional(readOnly = true)
public class RlsPolicyService {

    private static final Logger LOG = LoggerFactory.getLogger(RlsPolicyService.class);
    private static final String DEFAULT_NAME = "rls-policy";

    private final RlsPolicyRepository policyRepository;
    private final PredicateTemplateEngine templateEngine;
    private final Clock clock;

    public RlsPolicyService(RlsPolicyRepository policyRepository, PredicateTemplateEngine templateEngine, Clock clock) {
        this.policyRepository = policyRepository;
        this.templateEngine = templateEngine;
        this.clock = clock;
    }

    @Transactional
    public RlsPolicyDTO create(RlsPolicyCreateRequest request, String actor) {
        if (request == null || request.tenantId() == null) {
            throw new RlsValidationException("tenantId is required");
        }
        String template = requireTemplate(request.predicateTemplate());
        List<String> contextKeys = normalizeKeys(request.contextKeys());
        validateDeclaredKeys(template, contextKeys);

        RlsPolicy policy = new RlsPolicy();
        policy.setTenantId(request.tenantId());
        policy.setName(resolveName(request.name()));
        policy.setDescription(checkDescription(request.description()));
        policy.setLevel(resolveLevel(request.level()));
        policy.setTargetId(request.targetId());
        policy.setDatasetScope(normalizeScope(request.datasetScope()));
        policy.setPredicateTemplate(template);
        policy.setContextKeys(contextKeys);
        policy.setPriority(request.priority() != null ? request.priority() : 0);
        policy.setActive(request.active() == null || request.active());
        policy.setPerformanceHint(request.performanceHint() != null ? new LinkedHashMap<>(request.performanceHint()) : new LinkedHashMap<>());

        Instant now = clock.instant();
        String author = StringUtils.hasText(actor) ? actor : "system";
        policy.setCreatedBy(author);
        policy.setCreatedDate(now);
        policy.setLastModifiedBy(author);
        policy.setLastModifiedDate(now);

        RlsPolicy saved = policyRepository.save(policy);
        LOG.debug("Created RLS policy {} in tenant {} (priority={}, scope={})", saved.getId(), saved.getTenantId(), saved.getPriority(), saved.getDatasetScope());
        return RlsPolicyDTO.from(saved);
    }

    public Optional<RlsPolicyDTO> get(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return policyRepository.findById(id).map(RlsPolicyDTO::from);
    }

    /**
     * Applies only the supplied fields; {@code updated_at} is refreshed even when nothing else changes.
     */
    @Transactional
    public RlsPolicyDTO update(UUID id, RlsPolicyUpdateRequest request, String actor) {
        RlsPolicy policy = (id == null ? Optional.<RlsPolicy>empty() : policyRepository.findById(id)).orElseThrow(() -> RlsNotFoundException.policy(id));
        RlsPolicyUpdateRequest changes = request != null ? request : new RlsPolicyUpdateRequest(null, null, null, null, null, null, null, null);

        String template = changes.predicateTemplate() != null ? requireTemplate(changes.predicateTemplate()) : policy.getPredicateTemplate();
        List<String> contextKeys = normalizeKeys(changes.contextKeys() != null ? changes.contextKeys() : policy.getContextKeys());
        validateDeclaredKeys(template, contextKeys);

        if (changes.name() != null) {
            policy.setName(resolveName(changes.name()));
        }
        if (changes.description() != null) {
            policy.setDescription(checkDescription(changes.description()));
        }
        if (changes.datasetScope() != null) {
            policy.setDatasetScope(normalizeScope(changes.datasetScope()));
        }
        policy.setPredicateTemplate(template);
        policy.setContextKeys(contextKeys);
        if (changes.priority() != null) {
            policy.setPriority(changes.priority());
        }
        if (changes.active() != null) {
            policy.setActive(changes.active());
        }
        if (changes.performanceHint() != null) {
            policy.setPerformanceHint(new LinkedHashMap<>(changes.performanceHint()));
        }
        policy.setLastModifiedBy(StringUtils.hasText(actor) ? actor : "system");
        policy.setLastModifiedDate(clock.instant());

        RlsPolicy saved = policyRepository.save(policy);
        LOG.debug("Updated RLS policy {} (priority={}, active={})", saved.getId(), saved.getPriority(), saved.isActive());
        return RlsPolicyDTO.from(saved);
    }

    /**
     * Hard delete. Queries composed earlier are plain strings and are not affected.
     *
     * @return false when no policy has the given id
     */
    @Transactional
    public boolean delete(UUID id) {
        if (id == null || !policyRepository.existsById(id)) {
            return false;
        }
        policyRepository.deleteById(id);
        LOG.debug("Deleted RLS policy {}", id);
        return true;
    }

    /**
     * Every policy of the tenant, in selection order.
     */
    public List<RlsPolicyDTO> listForTenant(UUID tenantId) {
        if (tenantId == null) {
            return List.of();
        }
        return policyRepository
            .findByTenantIdOrderByPriorityDescCreatedDateAscIdAsc(tenantId)
            .stream()
            .map(RlsPolicyDTO::from)
            .sorted(RlsPolicySelector.SELECTION_ORDER)
            .toList();
    }

    public List<RlsPolicyDTO> listForTenant(UUID tenantId, RlsPolicyLevel level, boolean activeOnly) {
        return listForTenant(tenantId)
            .stream()
            .filter(policy -> level == null || policy.level() == level)
            .filter(policy -> !activeOnly || policy.active())
            .toList();
    }

    private String requireTemplate(String template) {
        if (!StringUtils.hasText(template)) {
            throw new RlsValidationException("predicateTemplate is required");
        }
        if (template.length() > RlsPolicy.TEMPLATE_MAX_LENGTH) {
            throw new RlsValidationException("predicateTemplate exceeds " + RlsPolicy.TEMPLATE_MAX_LENGTH + " characters");
        }
        return template;
    }

    private String resolveName(String name) {
        if (!StringUtils.hasText(name)) {
            return DEFAULT_NAME;
        }
        String trimmed = name.trim();
        if (trimmed.length() > RlsPolicy.NAME_MAX_LENGTH) {
            throw new RlsValidationException("name exceeds " + RlsPolicy.NAME_MAX_LENGTH + " characters");
        }
        return trimmed;
    }

    private String checkDescription(String description) {
        if (description != null && description.length() > RlsPolicy.DESCRIPTION_MAX_LENGTH) {
            throw new RlsValidationException("description exceeds " + RlsPolicy.DESCRIPTION_MAX_LENGTH + " characters");
        }
        return description;
    }

    private RlsPolicyLevel resolveLevel(String raw) {
        if (!StringUtils.hasText(raw)) {
            return RlsPolicyLevel.TENANT;
        }
        RlsPolicyLevel level = RlsPolicyLevel.normalize(raw);
        if (level == null) {
            throw new RlsValidationException("Unknown policy level: " + raw);
        }
        return level;
    }

    private void validateDeclaredKeys(String template, List<String> contextKeys) {
        if (contextKeys == null || contextKeys.isEmpty()) {
            return;
        }
        Set<String> undeclared = new LinkedHashSet<>(templateEngine.referencedKeys(template));
        undeclared.removeAll(contextKeys);
        if (!undeclared.isEmpty()) {
            throw new RlsValidationException("Template references undeclared context keys: " + String.join(", ", undeclared));
        }
    }

    private List<String> normalizeKeys(List<String> keys) {
        if (keys == null) {
            return new ArrayList<>();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String key : keys) {
            if (StringUtils.hasText(key)) {
                unique.add(key.trim());
            }
        }
        return new ArrayList<>(unique);
    }

    private List<UUID> normalizeScope(List<UUID> scope) {
        if (scope == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(scope.stream().filter(Objects::nonNull).distinct().toList());
    }
}
