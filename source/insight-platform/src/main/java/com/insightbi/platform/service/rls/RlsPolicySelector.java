package com.insightbi.platform.service.rls;

import com.insightbi.platform.domain.rls.RlsPolicy;
import com.insightbi.platform.repository.rls.RlsPolicyRepository;
import com.insightbi.platform.service.rls.dto.RlsPolicyDTO;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 选出对一次数据集查询生效的策略：同租户、已启用，且数据集范围为空或与请求的数据集有交集。
 * 结果按优先级降序、创建时间升序、ID 升序排列，保证同样的输入得到同样的顺序。
 */
@Service
@Transactional(readOnly = true)
public class RlsPolicySelector {

    private static final Logger LOG = LoggerFactory.getLogger(RlsPolicySelector.class);

    public static final Comparator<RlsPolicyDTO> SELECTION_ORDER = Comparator
        .comparingInt(RlsPolicyDTO::priority)
        .reversed()
        .thenComparing(RlsPolicyDTO::createdAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
        .thenComparing(RlsPolicyDTO::id, Comparator.nullsLast(Comparator.<UUID>naturalOrder()));

    private final RlsPolicyRepository policyRepository;

    public RlsPolicySelector(RlsPolicyRepository policyRepository) {
        this.policyRepository = policyRepository;
    }

    public List<RlsPolicyDTO> selectApplicable(UUID tenantId, Collection<UUID> datasetIds) {
        Objects.requireNonNull(tenantId, "tenantId");
        Set<UUID> requested = new LinkedHashSet<>();
        if (datasetIds != null) {
            datasetIds.stream().filter(Objects::nonNull).forEach(requested::add);
        }
        List<RlsPolicy> candidates = requested.isEmpty()
            ? policyRepository.findUniversal(tenantId)
            : policyRepository.findApplicable(tenantId, requested);

        List<RlsPolicyDTO> selected = candidates
            .stream()
            .map(RlsPolicyDTO::from)
            .filter(policy -> isApplicable(policy, tenantId, requested))
            .distinct()
            .sorted(SELECTION_ORDER)
            .toList();
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                "Tenant {} datasets {}: {} candidate(s), selected {}",
                tenantId,
                requested,
                candidates.size(),
                selected.stream().map(RlsPolicyDTO::id).toList()
            );
        }
        return selected;
    }

    /**
     * Scope rule: an empty scope matches every request, otherwise any overlap with the requested datasets matches.
     */
    static boolean isApplicable(RlsPolicyDTO policy, UUID tenantId, Set<UUID> requested) {
        if (!policy.active() || !tenantId.equals(policy.tenantId())) {
            return false;
        }
        if (policy.universalScope()) {
            return true;
        }
        return policy.datasetScope().stream().anyMatch(requested::contains);
    }
}
