package com.insightbi.platform.service.rls;

import com.insightbi.platform.service.rls.context.UserContext;
import com.insightbi.platform.service.rls.context.UserContextResolver;
import com.insightbi.platform.service.rls.dto.RlsPolicyDTO;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 行级安全入口：解析用户上下文、挑选策略、替换谓词并包裹查询。
 * <p>
 * 任一环节失败都会中止整个改写并抛出异常（fail closed），调用方必须拒绝执行该查询，
 * 绝不能退回到未过滤的原始查询。
 */
@Service
public class RlsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RlsEngine.class);

    static final String REWRITES_METRIC = "insight.rls.rewrites";
    static final String LAYERS_METRIC = "insight.rls.layers";

    private final UserContextResolver contextResolver;
    private final RlsPolicySelector policySelector;
    private final PredicateTemplateEngine templateEngine;
    private final RlsQueryComposer queryComposer;
    private final MeterRegistry meterRegistry;
    private final DistributionSummary layers;

    public RlsEngine(
        UserContextResolver contextResolver,
        RlsPolicySelector policySelector,
        PredicateTemplateEngine templateEngine,
        RlsQueryComposer queryComposer,
        MeterRegistry meterRegistry
    ) {
        this.contextResolver = contextResolver;
        this.policySelector = policySelector;
        this.templateEngine = templateEngine;
        this.queryComposer = queryComposer;
        this.meterRegistry = meterRegistry;
        this.layers = DistributionSummary.builder(LAYERS_METRIC).description("RLS layers per rewritten query").register(meterRegistry);
    }

    /**
     * 返回只包含用户有权查看的行的查询；没有适用策略时原样返回 {@code baseQuery}。
     *
     * @throws RlsNotFoundException     无法解析用户在租户内的上下文
     * @throws RlsSubstitutionException 某条策略的模板无法替换（异常中包含该策略 ID）
     */
    public String applyRls(String baseQuery, UUID userId, UUID tenantId, Collection<UUID> datasetIds) {
        return rewrite(baseQuery, userId, tenantId, datasetIds).query();
    }

    public RlsRewriteResult rewrite(String baseQuery, UUID userId, UUID tenantId, Collection<UUID> datasetIds) {
        try {
            UserContext context = contextResolver.resolve(userId, tenantId);
            List<RlsPolicyDTO> policies = policySelector.selectApplicable(tenantId, datasetIds);
            if (policies.isEmpty()) {
                count("unfiltered");
                return new RlsRewriteResult(baseQuery, List.of());
            }

            List<String> predicates = new ArrayList<>(policies.size());
            List<UUID> applied = new ArrayList<>(policies.size());
            for (RlsPolicyDTO policy : policies) {
                try {
                    predicates.add(templateEngine.substitute(policy.predicateTemplate(), context));
                } catch (RlsSubstitutionException ex) {
                    throw ex.forPolicy(policy.id(), policy.name());
                }
                applied.add(policy.id());
            }

            String rewritten = queryComposer.compose(baseQuery, predicates);
            count("filtered");
            layers.record(applied.size());
            LOG.info("Applied {} RLS polic(ies) {} for user {} in tenant {}", applied.size(), applied, userId, tenantId);
            return new RlsRewriteResult(rewritten, applied);
        } catch (RowLevelSecurityException ex) {
            count("denied");
            LOG.warn("RLS denied query for user {} in tenant {}: [{}] {}", userId, tenantId, ex.getCode(), ex.getMessage());
            throw ex;
        }
    }

    private void count(String outcome) {
        meterRegistry.counter(REWRITES_METRIC, "outcome", outcome).increment();
    }
}
