package org.carball.scholarflow.catalog;

import lombok.extern.slf4j.Slf4j;
import org.carball.scholarflow.exception.CatalogLockedException;
import org.carball.scholarflow.exception.NotFoundException;
import org.carball.scholarflow.exception.ValidationException;
import org.carball.scholarflow.model.scholarship.EligibilityRule;
import org.carball.scholarflow.model.scholarship.ScholarshipType;
import org.carball.scholarflow.model.scholarship.SubScholarship;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Registry of scholarship types and their eligibility rules. Types are never deleted, only
 * deactivated. Updates replace the stored type with a modified copy so concurrent readers always
 * see a consistent rule list.
 */
@Slf4j
public class ScholarshipCatalog {

    private final Map<String, ScholarshipType> types = new ConcurrentHashMap<>();
    private final AtomicLong ruleSequence = new AtomicLong();
    private final UsageProbe usageProbe;

    public ScholarshipCatalog(UsageProbe usageProbe) {
        this.usageProbe = usageProbe;
    }

    /**
     * Registers a new type or replaces one nothing has applied to yet. Rules without an id get one
     * assigned; every rule definition is validated.
     */
    public synchronized ScholarshipType register(ScholarshipType type) {
        if (type.getCode() == null || type.getCode().isBlank()) {
            throw new ValidationException("code", "scholarship type code is required");
        }
        if (types.containsKey(type.getCode()) && usageProbe.hasApplications(type.getCode())) {
            throw new CatalogLockedException(type.getCode(), "redefining the scholarship type");
        }
        validateSubScholarships(type);

        List<EligibilityRule> rules = new ArrayList<>();
        Set<Long> ruleIds = new HashSet<>();
        for (EligibilityRule rule : type.getRules()) {
            EligibilityRule prepared = prepareRule(type, rule);
            if (!ruleIds.add(prepared.getId())) {
                throw duplicateRuleId(type.getCode(), prepared);
            }
            rules.add(prepared);
        }

        ScholarshipType stored = type.toBuilder()
                .subScholarships(new ArrayList<>(type.getSubScholarships()))
                .rules(rules)
                .build();
        types.put(stored.getCode(), stored);
        log.info("Registered scholarship type '{}' with {} rule(s) and {} sub-scholarship(s)",
                stored.getCode(), rules.size(), stored.getSubScholarships().size());
        return stored;
    }

    public Optional<ScholarshipType> find(String code) {
        return Optional.ofNullable(code).map(types::get);
    }

    public ScholarshipType require(String code) {
        return find(code).orElseThrow(() -> new NotFoundException("Scholarship type", code));
    }

    public List<ScholarshipType> listActive() {
        return types.values().stream()
                .filter(ScholarshipType::isActive)
                .sorted(Comparator.comparing(ScholarshipType::getCode))
                .collect(Collectors.toList());
    }

    public synchronized EligibilityRule addRule(EligibilityRule rule) {
        ScholarshipType type = require(rule.getScholarshipTypeCode());
        if (usageProbe.hasApplications(type.getCode())) {
            throw new CatalogLockedException(type.getCode(), "adding eligibility rules");
        }
        EligibilityRule prepared = prepareRule(type, rule);
        if (type.getRules().stream().anyMatch(existing -> existing.getId().equals(prepared.getId()))) {
            throw duplicateRuleId(type.getCode(), prepared);
        }
        List<EligibilityRule> rules = new ArrayList<>(type.getRules());
        rules.add(prepared);
        types.put(type.getCode(), type.toBuilder().rules(rules).build());
        log.info("Added rule {} '{}' to scholarship type '{}'", prepared.getId(), prepared.getName(), type.getCode());
        return prepared;
    }

    /**
     * Toggles a rule's activation flag. Allowed even after applications exist.
     */
    public synchronized EligibilityRule setRuleActive(String typeCode, long ruleId, boolean active) {
        ScholarshipType type = require(typeCode);
        EligibilityRule updated = null;
        List<EligibilityRule> rules = new ArrayList<>();
        for (EligibilityRule rule : type.getRules()) {
            if (rule.getId() == ruleId) {
                updated = rule.toBuilder().active(active).build();
                rules.add(updated);
            } else {
                rules.add(rule);
            }
        }
        if (updated == null) {
            throw new NotFoundException("Eligibility rule", typeCode + "/" + ruleId);
        }
        types.put(typeCode, type.toBuilder().rules(rules).build());
        log.info("Rule {} of scholarship type '{}' is now {}", ruleId, typeCode, active ? "active" : "inactive");
        return updated;
    }

    /**
     * Moves the application window. Allowed even after applications exist.
     */
    public synchronized ScholarshipType updateWindow(String typeCode, Instant start, Instant end) {
        if (start != null && end != null && end.isBefore(start)) {
            throw new ValidationException("application_end", "window end is before its start");
        }
        ScholarshipType updated = require(typeCode).toBuilder()
                .applicationStart(start)
                .applicationEnd(end)
                .build();
        types.put(typeCode, updated);
        log.info("Application window of '{}' set to {} - {}", typeCode, start, end);
        return updated;
    }

    public synchronized ScholarshipType deactivate(String typeCode) {
        ScholarshipType updated = require(typeCode).toBuilder().active(false).build();
        types.put(typeCode, updated);
        log.info("Scholarship type '{}' deactivated", typeCode);
        return updated;
    }

    private EligibilityRule prepareRule(ScholarshipType type, EligibilityRule rule) {
        EligibilityRule prepared = rule.toBuilder()
                .scholarshipTypeCode(type.getCode())
                .id(rule.getId() != null ? rule.getId() : ruleSequence.incrementAndGet())
                .build();
        prepared.validateDefinition();

        if (prepared.getSubScholarshipCode() != null && type.findSubScholarship(prepared.getSubScholarshipCode()).isEmpty()) {
            throw new ValidationException("sub_scholarship", String.format(
                    "rule '%s' refers to unknown sub-scholarship '%s'", prepared.getName(), prepared.getSubScholarshipCode()));
        }
        // keep generated ids clear of explicitly numbered rules
        ruleSequence.accumulateAndGet(prepared.getId(), Math::max);
        return prepared;
    }

    // whitelist exemptions are keyed by rule id within a type
    private static ValidationException duplicateRuleId(String typeCode, EligibilityRule rule) {
        return new ValidationException("rule_id", String.format(
                "rule id %d is already used by another rule of scholarship type '%s' (rule '%s')",
                rule.getId(), typeCode, rule.getName()));
    }

    private void validateSubScholarships(ScholarshipType type) {
        if (!type.isCombined() && !type.getSubScholarships().isEmpty()) {
            throw new ValidationException("sub_scholarships", "only combined scholarship types may declare sub-scholarships");
        }
        if (type.isCombined() && type.getSubScholarships().isEmpty()) {
            throw new ValidationException("sub_scholarships", "a combined scholarship type needs at least one sub-scholarship");
        }
        Set<String> codes = new HashSet<>();
        for (SubScholarship sub : type.getSubScholarships()) {
            if (!codes.add(sub.getCode())) {
                throw new ValidationException("sub_scholarships", "duplicate sub-scholarship code " + sub.getCode());
            }
        }
    }
}
