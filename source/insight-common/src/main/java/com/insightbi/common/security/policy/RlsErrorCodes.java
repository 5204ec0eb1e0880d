package com.insightbi.common.security.policy;

/**
 * Machine-readable codes attached to row-level security failures and surfaced in {@code ApiResponse#code}.
 */
public final class RlsErrorCodes {
    private RlsErrorCodes() {}

    public static final String POLICY_INVALID = "insight-rls-0001";
    public static final String POLICY_NOT_FOUND = "insight-rls-0002";
    public static final String CONTEXT_NOT_FOUND = "insight-rls-0003";
    public static final String ATTRIBUTE_MISSING = "insight-rls-0004";
    public static final String ATTRIBUTE_SHAPE_MISMATCH = "insight-rls-0005";
    public static final String ATTRIBUTE_TYPE_UNSUPPORTED = "insight-rls-0006";
    public static final String TENANT_ACCESS_DENIED = "insight-rls-0007";
}
