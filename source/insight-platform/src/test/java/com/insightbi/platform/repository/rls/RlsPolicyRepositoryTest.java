package com.insightbi.platform.repository.rls;

import static org.assertj.core.api.Assertions.assertThat;

import com.insightbi.platform.domain.rls.RlsPolicy;
import com.insightbi.platform.domain.rls.RlsPolicyLevel;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

@DataJpaTest
class RlsPolicyRepositoryTest {

    private static final UUID TENANT = UUID.fromString("f0000000-0000-0000-0000-000000000001");
    private static final UUID OTHER_TENANT = UUID.fromString("f0000000-0000-0000-0000-000000000002");
    private static final UUID D1 = UUID.fromString("f1000000-0000-0000-0000-000000000001");
    private static final UUID D2 = UUID.fromString("f1000000-0000-0000-0000-000000000002");
    private static final Instant T0 = Instant.parse("2024-04-01T00:00:00Z");

    @Autowired
    private RlsPolicyRepository policyRepository;

    @Autowired
    private TestEntityManager entityManager;

    private RlsPolicy universal;
    private RlsPolicy scopedD1;
    private RlsPolicy scopedD1D2;
    private RlsPolicy scopedD2;

    @BeforeEach
    void setUp() {
        universal = persist(TENANT, "universal", 100, T0, List.of(), true);
        scopedD1 = persist(TENANT, "d1", 50, T0, List.of(D1), true);
        scopedD1D2 = persist(TENANT, "d1-d2", 50, T0.plusSeconds(1), List.of(D2, D1), true);
        scopedD2 = persist(TENANT, "d2", 10, T0, List.of(D2), true);
        persist(TENANT, "inactive", 500, T0, List.of(), false);
        persist(OTHER_TENANT, "foreign", 500, T0, List.of(D1), true);
        entityManager.flush();
        entityManager.clear();
    }

    private RlsPolicy persist(UUID tenantId, String name, int priority, Instant createdAt, List<UUID> scope, boolean active) {
        RlsPolicy policy = new RlsPolicy();
        policy.setTenantId(tenantId);
        policy.setName(name);
        policy.setLevel(RlsPolicyLevel.TENANT);
        policy.setDatasetScope(new ArrayList<>(scope));
        policy.setPredicateTemplate("owner = {user_id}");
        policy.setContextKeys(new ArrayList<>(List.of("user_id")));
        policy.setPriority(priority);
        policy.setActive(active);
        policy.setPerformanceHint(new LinkedHashMap<>(Map.of("index", "owner")));
        policy.setCreatedBy("test");
        policy.setCreatedDate(createdAt);
        policy.setLastModifiedBy("test");
        policy.setLastModifiedDate(createdAt);
        return entityManager.persist(policy);
    }

    @Test
    void findApplicableShouldMatchUniversalAndIntersectingScopes() {
        List<RlsPolicy> found = policyRepository.findApplicable(TENANT, Set.of(D1));

        assertThat(found).extracting(RlsPolicy::getId).containsExactlyInAnyOrder(universal.getId(), scopedD1.getId(), scopedD1D2.getId());
    }

    @Test
    void findApplicableShouldNotDuplicatePoliciesMatchingSeveralDatasets() {
        List<RlsPolicy> found = policyRepository.findApplicable(TENANT, Set.of(D1, D2));

        assertThat(found)
            .extracting(RlsPolicy::getId)
            .containsExactlyInAnyOrder(universal.getId(), scopedD1.getId(), scopedD1D2.getId(), scopedD2.getId());
    }

    @Test
    void findApplicableForUnknownDatasetShouldOnlyReturnUniversalPolicies() {
        assertThat(policyRepository.findApplicable(TENANT, Set.of(UUID.randomUUID())))
            .extracting(RlsPolicy::getId)
            .containsExactly(universal.getId());
    }

    @Test
    void findUniversalShouldIgnoreInactivePolicies() {
        assertThat(policyRepository.findUniversal(TENANT)).extracting(RlsPolicy::getName).containsExactly("universal");
    }

    @Test
    void tenantListingShouldFollowSelectionOrder() {
        List<RlsPolicy> listed = policyRepository.findByTenantIdOrderByPriorityDescCreatedDateAscIdAsc(TENANT);

        assertThat(listed).extracting(RlsPolicy::getName).startsWith("inactive", "universal").endsWith("d2");
        assertThat(listed).hasSize(5);
    }

    @Test
    void scopeOrderAndJsonColumnsShouldRoundTrip() {
        RlsPolicy loaded = policyRepository.findById(scopedD1D2.getId()).orElseThrow();

        assertThat(loaded.getDatasetScope()).containsExactly(D2, D1);
        assertThat(loaded.getContextKeys()).containsExactly("user_id");
        assertThat(loaded.getPerformanceHint()).containsEntry("index", "owner");
    }
}
