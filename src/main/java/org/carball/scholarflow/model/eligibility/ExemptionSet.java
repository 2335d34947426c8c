package org.carball.scholarflow.model.eligibility;

import java.util.Set;

/**
 * Exemptions held by one student for one scholarship type at a point in time. Revoked ids are kept
 * so a failure can be told apart from a failure whose exemption was withdrawn.
 */
public record ExemptionSet(Set<Long> activeRuleIds, Set<Long> revokedRuleIds) {

    public ExemptionSet {
        activeRuleIds = Set.copyOf(activeRuleIds);
        revokedRuleIds = Set.copyOf(revokedRuleIds);
    }

    public static ExemptionSet none() {
        return new ExemptionSet(Set.of(), Set.of());
    }

    public static ExemptionSet of(Long... ruleIds) {
        return new ExemptionSet(Set.of(ruleIds), Set.of());
    }

    public boolean exempts(Long ruleId) {
        return ruleId != null && activeRuleIds.contains(ruleId);
    }

    public boolean wasRevoked(Long ruleId) {
        return ruleId != null && revokedRuleIds.contains(ruleId);
    }
}
