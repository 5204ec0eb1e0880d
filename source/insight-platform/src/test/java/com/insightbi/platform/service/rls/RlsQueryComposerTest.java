package com.insightbi.platform.service.rls;

import static org.assertj.core.api.Assertions.assertThat;

import com.insightbi.platform.config.RlsProperties;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RlsQueryComposerTest {

    private RlsProperties properties;
    private RlsQueryComposer composer;

    @BeforeEach
    void setUp() {
        properties = new RlsProperties();
        composer = new RlsQueryComposer(properties);
    }

    @Test
    void noPredicatesReturnsBaseQueryUnchanged() {
        String base = "SELECT * FROM orders;  ";
        assertThat(composer.compose(base, List.of())).isSameAs(base);
    }

    @Test
    void singlePredicateWrapsOnce() {
        assertThat(composer.compose("SELECT * FROM orders", List.of("dept = 'finance'")))
            .isEqualTo("SELECT * FROM (SELECT * FROM orders\n) AS rls_0 WHERE dept = 'finance'");
    }

    @Test
    void firstPredicateIsOutermostLayer() {
        String composed = composer.compose("SELECT * FROM orders", List.of("p_high", "p_low"));
        assertThat(composed)
            .isEqualTo("SELECT * FROM (SELECT * FROM (SELECT * FROM orders\n) AS rls_1 WHERE p_low\n) AS rls_0 WHERE p_high");
    }

    @Test
    void producesOneDistinctAliasPerPredicate() {
        String composed = composer.compose("SELECT 1", List.of("a", "b", "c", "d"));
        assertThat(composed.split("SELECT \\* FROM \\(", -1)).hasSize(5);
        assertThat(composed).contains("AS rls_0 ", "AS rls_1 ", "AS rls_2 ", "AS rls_3 ");
    }

    @Test
    void trailingSemicolonsAreStrippedBeforeWrapping() {
        assertThat(composer.compose("SELECT id FROM t;;", List.of("x = 1"))).isEqualTo("SELECT * FROM (SELECT id FROM t\n) AS rls_0 WHERE x = 1");
    }

    @Test
    void aliasPrefixChangesWhenBaseQueryUsesIt() {
        String composed = composer.compose("SELECT * FROM (SELECT 1) AS RLS_0", List.of("x = 1"));
        assertThat(composed).isEqualTo("SELECT * FROM (SELECT * FROM (SELECT 1) AS RLS_0\n) AS rls1_0 WHERE x = 1");
    }

    @Test
    void longerIdentifiersDoNotCountAsCollisions() {
        String composed = composer.compose("SELECT rls_00 FROM t", List.of("x = 1"));
        assertThat(composed).endsWith("AS rls_0 WHERE x = 1");
    }

    @Test
    void configuredPrefixIsNormalized() {
        properties.setAliasPrefix("Row-Guard");
        assertThat(composer.compose("SELECT 1", List.of("x = 1"))).isEqualTo("SELECT * FROM (SELECT 1\n) AS row_guard_0 WHERE x = 1");
    }

    @Test
    void trailingLineCommentCannotSwallowClosingParen() {
        String composed = composer.compose("SELECT 'finance' AS dept -- monthly report", List.of("dept = 'finance'"));

        assertThat(composed).isEqualTo("SELECT * FROM (SELECT 'finance' AS dept -- monthly report\n) AS rls_0 WHERE dept = 'finance'");
        assertThat(composed.substring(composed.lastIndexOf('\n') + 1)).startsWith(") AS rls_0 WHERE");
    }

    @Test
    void predicateEndingInLineCommentDoesNotBreakOuterLayer() {
        String composed = composer.compose("SELECT 1", List.of("a = 1", "b = 2 -- legacy rule"));

        assertThat(composed).isEqualTo("SELECT * FROM (SELECT * FROM (SELECT 1\n) AS rls_1 WHERE b = 2 -- legacy rule\n) AS rls_0 WHERE a = 1");
    }
}
