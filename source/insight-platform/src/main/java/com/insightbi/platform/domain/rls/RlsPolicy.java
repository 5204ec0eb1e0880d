package com.insightbi.platform.domain.rls;

import com.insightbi.platform.domain.AbstractAuditingEntity;
import com.insightbi.platform.domain.converter.JsonMapConverter;
import com.insightbi.platform.domain.converter.StringListJsonConverter;
import jakarta.persistence.*;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "rls_policy")
public class RlsPolicy extends AbstractAuditingEntity<UUID> implements Serializable {

    public static final int NAME_MAX_LENGTH = 200;
    public static final int DESCRIPTION_MAX_LENGTH = 1024;
    public static final int TEMPLATE_MAX_LENGTH = 4000;

    @Id
    @GeneratedValue
    @Column(name = "id", columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", columnDefinition = "uuid", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "name", length = NAME_MAX_LENGTH, nullable = false)
    private String name;

    @Column(name = "description", length = DESCRIPTION_MAX_LENGTH)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "level", length = 20, nullable = false)
    private RlsPolicyLevel level;

    @Column(name = "target_id", columnDefinition = "uuid")
    private UUID targetId;

    // Empty means the policy applies to every dataset query of the tenant
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "rls_policy_dataset", joinColumns = @JoinColumn(name = "policy_id"))
    @OrderColumn(name = "scope_order")
    @Column(name = "dataset_id", columnDefinition = "uuid", nullable = false)
    private List<UUID> datasetScope = new ArrayList<>();

    @Column(name = "predicate_template", length = TEMPLATE_MAX_LENGTH, nullable = false)
    private String predicateTemplate;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "context_keys", length = 2048)
    private List<String> contextKeys = new ArrayList<>();

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "performance_hint", length = 2048)
    private Map<String, Object> performanceHint = new LinkedHashMap<>();

    @Override
    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public void setTenantId(UUID tenantId) {
        this.tenantId = tenantId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public RlsPolicyLevel getLevel() {
        return level;
    }

    public void setLevel(RlsPolicyLevel level) {
        this.level = level;
    }

    public UUID getTargetId() {
        return targetId;
    }

    public void setTargetId(UUID targetId) {
        this.targetId = targetId;
    }

    public List<UUID> getDatasetScope() {
        return datasetScope;
    }

    public void setDatasetScope(List<UUID> datasetScope) {
        this.datasetScope = datasetScope;
    }

    public String getPredicateTemplate() {
        return predicateTemplate;
    }

    public void setPredicateTemplate(String predicateTemplate) {
        this.predicateTemplate = predicateTemplate;
    }

    public List<String> getContextKeys() {
        return contextKeys;
    }

    public void setContextKeys(List<String> contextKeys) {
        this.contextKeys = contextKeys;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Map<String, Object> getPerformanceHint() {
        return performanceHint;
    }

    public void setPerformanceHint(Map<String, Object> performanceHint) {
        this.performanceHint = performanceHint;
    }
}
