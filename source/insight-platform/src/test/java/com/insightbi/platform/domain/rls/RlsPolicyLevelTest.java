package com.insightbi.platform.domain.rls;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RlsPolicyLevelTest {

    @Test
    void normalizeAcceptsCurrentAndLegacyNames() {
        assertThat(RlsPolicyLevel.normalize("tenant")).isEqualTo(RlsPolicyLevel.TENANT);
        assertThat(RlsPolicyLevel.normalize(" Workspace ")).isEqualTo(RlsPolicyLevel.TENANT);
        assertThat(RlsPolicyLevel.normalize("webview")).isEqualTo(RlsPolicyLevel.VIEW);
        assertThat(RlsPolicyLevel.normalize("CHART")).isEqualTo(RlsPolicyLevel.CHART);
    }

    @Test
    void normalizeReturnsNullForBlankOrUnknown() {
        assertThat(RlsPolicyLevel.normalize(null)).isNull();
        assertThat(RlsPolicyLevel.normalize("  ")).isNull();
        assertThat(RlsPolicyLevel.normalize("galaxy")).isNull();
    }
}
