package org.carball.scholarflow.model.scholarship;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Data
@Builder(toBuilder = true)
public class ScholarshipType {
    private String code;
    private String nameZh;
    private String nameEn;
    private BigDecimal amount;

    @Builder.Default
    private String currency = "TWD";

    private String academicYear;
    private Instant applicationStart;
    private Instant applicationEnd;

    private boolean combined;

    @Builder.Default
    private List<SubScholarship> subScholarships = new ArrayList<>();

    @Builder.Default
    private List<EligibilityRule> rules = new ArrayList<>();

    private boolean requiresProfessorRecommendation;

    @Builder.Default
    private int collegeApprovalsRequired = 1;

    @Builder.Default
    private int maxActiveApplicationsPerStudent = 1;

    @Builder.Default
    private boolean active = true;

    /**
     * Open-ended windows are treated as always open on the missing side.
     */
    public boolean isWithinWindow(Instant at) {
        if (applicationStart != null && at.isBefore(applicationStart)) {
            return false;
        }
        return applicationEnd == null || !at.isAfter(applicationEnd);
    }

    public Optional<SubScholarship> findSubScholarship(String subCode) {
        if (subCode == null) {
            return Optional.empty();
        }
        return subScholarships.stream()
                .filter(s -> s.getCode().equals(subCode))
                .findFirst();
    }

    /**
     * Rules that apply to an application: common rules plus those scoped to the given sub-scholarship,
     * ordered by priority.
     */
    public List<EligibilityRule> rulesFor(String subCode) {
        return rules.stream()
                .filter(r -> r.appliesTo(subCode))
                .sorted(Comparator.comparingInt(EligibilityRule::getPriority)
                        .thenComparing(EligibilityRule::getId, Comparator.nullsLast(Comparator.<Long>naturalOrder())))
                .collect(Collectors.toList());
    }

    public List<EligibilityRule> commonRules() {
        return rules.stream()
                .filter(r -> r.getSubScholarshipCode() == null)
                .collect(Collectors.toList());
    }

    public List<EligibilityRule> rulesScopedTo(String subCode) {
        return rules.stream()
                .filter(r -> subCode.equals(r.getSubScholarshipCode()))
                .collect(Collectors.toList());
    }

    public BigDecimal amountFor(String subCode) {
        return findSubScholarship(subCode)
                .map(SubScholarship::getAmount)
                .orElse(amount);
    }
}
