package org.carball.scholarflow.whitelist;

import lombok.extern.slf4j.Slf4j;
import org.carball.scholarflow.exception.PermissionException;
import org.carball.scholarflow.exception.ValidationException;
import org.carball.scholarflow.model.application.Actor;
import org.carball.scholarflow.model.eligibility.ExemptionSet;
import org.carball.scholarflow.model.whitelist.WhitelistEntry;
import org.carball.scholarflow.model.whitelist.WhitelistEvent;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Append-only store of rule exemptions. Every grant and revocation is kept as an event so the
 * exemptions in force at any past instant can be reconstructed.
 */
@Slf4j
public class WhitelistStore {

    private final Map<String, WhitelistEntry> entries = new LinkedHashMap<>();
    private final List<WhitelistEvent> events = new ArrayList<>();
    private final Clock clock;
    private long sequence;

    public WhitelistStore(Clock clock) {
        this.clock = clock;
    }

    public synchronized WhitelistEntry grant(Actor actor, String scholarshipTypeCode, String studentId,
                                             Set<Long> ruleIds, String justification) {
        requireAdministrator(actor, "grant exemptions");
        if (scholarshipTypeCode == null || scholarshipTypeCode.isBlank()) {
            throw new ValidationException("scholarship_type", "scholarship type is required");
        }
        if (studentId == null || studentId.isBlank()) {
            throw new ValidationException("student_id", "student is required");
        }
        if (ruleIds == null || ruleIds.isEmpty()) {
            throw new ValidationException("rule_ids", "at least one rule must be exempted");
        }
        if (justification == null || justification.isBlank()) {
            throw new ValidationException("justification", "a justification is required for every exemption");
        }

        Instant now = clock.instant();
        WhitelistEntry entry = WhitelistEntry.builder()
                .entryId(String.format("WL-%06d", ++sequence))
                .scholarshipTypeCode(scholarshipTypeCode)
                .studentId(studentId)
                .exemptedRuleIds(Set.copyOf(ruleIds))
                .justification(justification.trim())
                .grantedBy(actor.id())
                .grantedAt(now)
                .build();
        entries.put(entry.getEntryId(), entry);
        events.add(new WhitelistEvent(WhitelistEvent.Action.GRANTED, entry.getEntryId(), scholarshipTypeCode,
                studentId, entry.getExemptedRuleIds(), actor.id(), entry.getJustification(), now));

        log.info("Whitelist {} granted by {}: student {} exempted from rules {} of {}",
                entry.getEntryId(), actor.id(), studentId, entry.getExemptedRuleIds(), scholarshipTypeCode);
        return entry;
    }

    /**
     * Marks an entry revoked. The entry stays in the store so past evaluations remain explainable.
     */
    public synchronized WhitelistEntry revoke(Actor actor, String entryId, String justification) {
        requireAdministrator(actor, "revoke exemptions");
        WhitelistEntry existing = entries.get(entryId);
        if (existing == null) {
            throw new ValidationException("entry_id", "no whitelist entry " + entryId);
        }
        if (existing.isRevoked()) {
            throw new ValidationException("entry_id", "whitelist entry " + entryId + " is already revoked");
        }

        Instant now = clock.instant();
        WhitelistEntry revoked = existing.toBuilder()
                .revokedBy(actor.id())
                .revokedAt(now)
                .build();
        entries.put(entryId, revoked);
        events.add(new WhitelistEvent(WhitelistEvent.Action.REVOKED, entryId, existing.getScholarshipTypeCode(),
                existing.getStudentId(), existing.getExemptedRuleIds(), actor.id(), justification, now));

        log.info("Whitelist {} revoked by {}", entryId, actor.id());
        return revoked;
    }

    public synchronized List<WhitelistEntry> listFor(String scholarshipTypeCode, String studentId) {
        return entries.values().stream()
                .filter(e -> e.getScholarshipTypeCode().equals(scholarshipTypeCode))
                .filter(e -> e.getStudentId().equals(studentId))
                .collect(Collectors.toList());
    }

    public synchronized List<WhitelistEvent> history() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public ExemptionSet exemptionsNow(String scholarshipTypeCode, String studentId) {
        return exemptionsAt(scholarshipTypeCode, studentId, clock.instant());
    }

    /**
     * Exemptions in force at the given instant, plus the rule ids whose exemption had been revoked
     * by then and not re-granted.
     */
    public synchronized ExemptionSet exemptionsAt(String scholarshipTypeCode, String studentId, Instant at) {
        Set<Long> active = new HashSet<>();
        Set<Long> revoked = new HashSet<>();
        for (WhitelistEntry entry : listFor(scholarshipTypeCode, studentId)) {
            if (entry.isActiveAt(at)) {
                active.addAll(entry.getExemptedRuleIds());
            } else if (entry.wasRevokedBy(at)) {
                revoked.addAll(entry.getExemptedRuleIds());
            }
        }
        revoked.removeAll(active);
        return new ExemptionSet(active, revoked);
    }

    private static void requireAdministrator(Actor actor, String action) {
        if (!actor.role().isAdministrative()) {
            throw new PermissionException(actor.id(), actor.role(),
                    String.format("%s %s may not %s", actor.role().getValue(), actor.id(), action));
        }
    }
}
