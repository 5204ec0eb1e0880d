package com.insightbi.platform.service.rls;

import static org.assertj.core.api.Assertions.assertThat;

import com.insightbi.platform.config.RlsProperties;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

/**
 * Runs composed queries against the embedded database to check they still parse.
 */
@DataJpaTest
class RlsQueryComposerDatabaseTest {

    @Autowired
    private TestEntityManager entityManager;

    private final RlsQueryComposer composer = new RlsQueryComposer(new RlsProperties());

    private List<?> run(String sql) {
        return entityManager.getEntityManager().createNativeQuery(sql).getResultList();
    }

    @Test
    void baseQueryEndingInLineCommentStillFilters() {
        String base = "SELECT 'finance' AS dept -- monthly report";

        assertThat(run(composer.compose(base, List.of("dept = 'finance'")))).hasSize(1);
        assertThat(run(composer.compose(base, List.of("dept = 'sales'")))).isEmpty();
    }

    @Test
    void layeredPredicatesAllApply() {
        String base = "SELECT 'finance' AS dept, 'EU' AS region";

        assertThat(run(composer.compose(base, List.of("dept = 'finance'", "region = 'EU' -- regional")))).hasSize(1);
        assertThat(run(composer.compose(base, List.of("dept = 'finance'", "region = 'US'")))).isEmpty();
    }
}
