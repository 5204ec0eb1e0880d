package com.insightbi.platform.repository.rls;

import com.insightbi.platform.domain.rls.RlsPolicy;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface RlsPolicyRepository extends JpaRepository<RlsPolicy, UUID> {
    List<RlsPolicy> findByTenantIdOrderByPriorityDescCreatedDateAscIdAsc(UUID tenantId);

    /**
     * Active policies of the tenant whose dataset scope is empty or overlaps the requested datasets.
     */
    @Query(
        "select distinct p from RlsPolicy p left join p.datasetScope d " +
        "where p.tenantId = :tenantId and p.active = true " +
        "and (p.datasetScope is empty or d in :datasetIds)"
    )
    List<RlsPolicy> findApplicable(@Param("tenantId") UUID tenantId, @Param("datasetIds") Collection<UUID> datasetIds);

    /**
     * Active policies of the tenant with an empty dataset scope.
     */
    @Query("select p from RlsPolicy p where p.tenantId = :tenantId and p.active = true and p.datasetScope is empty")
    List<RlsPolicy> findUniversal(@Param("tenantId") UUID tenantId);
}
