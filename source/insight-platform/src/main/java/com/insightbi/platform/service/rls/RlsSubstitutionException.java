package com.insightbi.platform.service.rls;

import java.util.List;
import java.util.UUID;

/**
 * 谓词模板替换失败：引用了上下文中不存在的属性，或属性取值的形态与占位符不符。
 */
public class RlsSubstitutionException extends RowLevelSecurityException {

    private final UUID policyId;
    private final List<String> keys;

    public RlsSubstitutionException(String code, String message, List<String> keys) {
        this(code, message, keys, null);
    }

    private RlsSubstitutionException(String code, String message, List<String> keys, UUID policyId) {
        super(code, message);
        this.keys = keys == null ? List.of() : List.copyOf(keys);
        this.policyId = policyId;
    }

    /**
     * Returns a copy of this exception naming the policy whose template failed.
     */
    public RlsSubstitutionException forPolicy(UUID policyId, String policyName) {
        String label = policyName == null || policyName.isBlank() ? String.valueOf(policyId) : policyName + " (" + policyId + ")";
        RlsSubstitutionException named = new RlsSubstitutionException(getCode(), "Policy " + label + ": " + getMessage(), keys, policyId);
        named.initCause(this);
        return named;
    }

    public UUID getPolicyId() {
        return policyId;
    }

    /** Attribute names involved in the failure. */
    public List<String> getKeys() {
        return keys;
    }
}
