package com.insightbi.platform.config;

import com.insightbi.platform.service.rls.LiteralDialect;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "insight.platform.rls")
public class RlsProperties {

    /** Escaping rules for substituted literals; must match the engine that executes the rewritten query. */
    private LiteralDialect literalDialect = LiteralDialect.POSTGRES;

    /** Prefix of the derived-table aliases produced by query composition, e.g. rls_0, rls_1. */
    private String aliasPrefix = "rls";

    public LiteralDialect getLiteralDialect() {
        return literalDialect;
    }

    public void setLiteralDialect(LiteralDialect literalDialect) {
        this.literalDialect = literalDialect;
    }

    public String getAliasPrefix() {
        return aliasPrefix;
    }

    public void setAliasPrefix(String aliasPrefix) {
        this.aliasPrefix = aliasPrefix;
    }
}
