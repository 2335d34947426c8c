package org.carball.scholarflow.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.ZoneId;

@Data
@Builder(toBuilder = true)
@Slf4j
public class WorkflowSettings {

    // Academic input bounds
    @Builder.Default
    private BigDecimal gpaScaleMax = new BigDecimal("4.30");

    @Builder.Default
    private BigDecimal maxRankingPercent = new BigDecimal("100");

    // Submission
    @Builder.Default
    private boolean enforceApplicationWindow = true;

    // Application identifiers
    @Builder.Default
    private String applicationIdPrefix = "APP";

    @Builder.Default
    private String zoneId = "Asia/Taipei";

    @Builder.Default
    private String settingsName = "default";

    /**
     * Creates default settings matching the university's 4.30 GPA scale.
     */
    public static WorkflowSettings defaults() {
        return WorkflowSettings.builder().build();
    }

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    /**
     * Validates the settings and logs warnings for values that are likely mistakes.
     */
    public void validate() {
        if (gpaScaleMax == null || gpaScaleMax.signum() <= 0) {
            log.warn("GPA scale maximum ({}) should be positive", gpaScaleMax);
        } else if (gpaScaleMax.compareTo(new BigDecimal("5")) > 0) {
            log.warn("GPA scale maximum ({}) is unusually high for a 4.30 grading system", gpaScaleMax);
        }

        if (maxRankingPercent == null || maxRankingPercent.compareTo(new BigDecimal("100")) != 0) {
            log.warn("Maximum ranking percent ({}) differs from 100; ranking rules may misbehave", maxRankingPercent);
        }

        if (applicationIdPrefix == null || applicationIdPrefix.isBlank()) {
            log.warn("Application id prefix is blank; generated ids will start with '-'");
        }

        try {
            ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            log.warn("Zone id '{}' is not recognised: {}", zoneId, e.getMessage());
        }

        if (!enforceApplicationWindow) {
            log.warn("Application window enforcement is disabled; submissions are accepted at any time");
        }

        log.debug("Using settings - GPA max: {}, window enforced: {}, id prefix: {}, zone: {}",
                gpaScaleMax, enforceApplicationWindow, applicationIdPrefix, zoneId);
    }

    public String getSummary() {
        return String.format("Settings: %s | GPA max: %s | Window enforced: %s | Id prefix: %s | Zone: %s",
                settingsName, gpaScaleMax.toPlainString(), enforceApplicationWindow, applicationIdPrefix, zoneId);
    }
}
