package org.carball.scholarflow.model.whitelist;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Exemption of one student from named hard rules of one scholarship type. Revocation sets the
 * tombstone fields; entries are never removed.
 */
@Value
@Builder(toBuilder = true)
public class WhitelistEntry {
    String entryId;
    String scholarshipTypeCode;
    String studentId;
    Set<Long> exemptedRuleIds;
    String justification;
    String grantedBy;
    Instant grantedAt;
    String revokedBy;
    Instant revokedAt;

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isActiveAt(Instant at) {
        return !grantedAt.isAfter(at) && (revokedAt == null || revokedAt.isAfter(at));
    }

    public boolean wasRevokedBy(Instant at) {
        return !grantedAt.isAfter(at) && revokedAt != null && !revokedAt.isAfter(at);
    }
}
