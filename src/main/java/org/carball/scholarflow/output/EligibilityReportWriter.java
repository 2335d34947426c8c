package org.carball.scholarflow.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.scholarflow.model.eligibility.EligibilityReport;
import org.carball.scholarflow.model.eligibility.RuleOutcome;
import org.carball.scholarflow.model.eligibility.RuleResult;
import org.carball.scholarflow.model.schema.MissingItem;
import org.carball.scholarflow.model.scholarship.ScholarshipType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Renders a dry-run eligibility check as JSON or Markdown.
 */
@Slf4j
public class EligibilityReportWriter {

    private final ScholarshipType type;
    private final String subScholarshipCode;
    private final String studentId;
    private final EligibilityReport report;
    private final List<MissingItem> missingItems;
    private final List<String> eligibleSubScholarships;
    private final Instant generatedAt;
    private final ObjectMapper objectMapper;

    public EligibilityReportWriter(ScholarshipType type, String subScholarshipCode, String studentId,
                                   EligibilityReport report, List<MissingItem> missingItems,
                                   List<String> eligibleSubScholarships, Instant generatedAt) {
        this.type = type;
        this.subScholarshipCode = subScholarshipCode;
        this.studentId = studentId;
        this.report = report;
        this.missingItems = missingItems;
        this.eligibleSubScholarships = eligibleSubScholarships;
        this.generatedAt = generatedAt;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public boolean isReady() {
        return report.isEligible() && missingItems.isEmpty();
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON eligibility report", e);
            throw new RuntimeException("Failed to generate JSON eligibility report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Eligibility Check: ").append(type.getNameEn() != null ? type.getNameEn() : type.getCode()).append("\n\n");
        if (type.getNameZh() != null) {
            md.append("**").append(type.getNameZh()).append("**  \n");
        }
        md.append("**Generated:** ").append(generatedAt).append("  \n");
        md.append("**Student:** ").append(studentId).append("  \n");
        if (subScholarshipCode != null) {
            md.append("**Sub-scholarship:** ").append(subScholarshipCode).append("  \n");
        }
        BigDecimal amount = type.amountFor(subScholarshipCode);
        if (amount != null) {
            md.append("**Amount:** ").append(amount.toPlainString()).append(" ").append(type.getCurrency()).append("  \n");
        }
        md.append("\n");

        md.append("## Result\n\n");
        md.append(isReady()
                ? "✅ **Ready to submit.**\n\n"
                : "❌ **Not ready to submit.**\n\n");

        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Rules passed | ").append(report.passed().size()).append(" |\n");
        md.append("| Passed by exemption | ").append(report.exempted().size()).append(" |\n");
        md.append("| Warnings | ").append(report.warnings().size()).append(" |\n");
        md.append("| Hard failures | ").append(report.failed().size()).append(" |\n");
        md.append("| Missing items | ").append(missingItems.size()).append(" |\n\n");

        if (!missingItems.isEmpty()) {
            md.append("## Missing Items\n\n");
            missingItems.forEach(item -> md.append("- ").append(item.describe()).append("\n"));
            md.append("\n");
        }

        md.append("## Rules\n\n");
        md.append("| Rule | Condition | Actual | Outcome | Message |\n");
        md.append("|------|-----------|--------|---------|---------|\n");
        Stream.of(report.failed(), report.warnings(), report.passed())
                .flatMap(List::stream)
                .forEach(result -> md.append("| ").append(result.ruleName())
                        .append(" | `").append(result.conditionField()).append(" ").append(result.operator())
                        .append(" ").append(result.expectedValue()).append("`")
                        .append(" | ").append(result.actualValue() == null ? "-" : result.actualValue())
                        .append(" | ").append(outcomeBadge(result.outcome()))
                        .append(" | ").append(result.message() == null ? "" : result.message())
                        .append(" |\n"));
        md.append("\n");

        if (type.isCombined()) {
            md.append("## Eligible Sub-scholarships\n\n");
            if (eligibleSubScholarships.isEmpty()) {
                md.append("**None.**\n\n");
            } else {
                eligibleSubScholarships.forEach(code -> md.append("- ").append(code).append("\n"));
                md.append("\n");
            }
        }

        md.append("---\n\n");
        md.append("*Dry run only. No application was created or changed.*\n");
        return md.toString();
    }

    private static String outcomeBadge(RuleOutcome outcome) {
        return switch (outcome) {
            case PASSED -> "passed";
            case PASSED_BY_EXEMPTION -> "passed (exempted)";
            case WARNING -> "⚠️ warning";
            case FAILED -> "❌ failed";
            case FAILED_EXEMPTION_REVOKED -> "❌ failed (exemption revoked)";
        };
    }

    private ReportData buildReportData() {
        ReportData data = new ReportData();
        data.setGeneratedAt(generatedAt);
        data.setScholarshipType(type.getCode());
        data.setSubScholarship(subScholarshipCode);
        data.setStudentId(studentId);
        data.setReady(isReady());
        data.setEligible(report.isEligible());
        data.setFailed(toEntries(report.failed()));
        data.setWarnings(toEntries(report.warnings()));
        data.setPassed(toEntries(report.passed()));
        data.setMissingItems(missingItems.stream().map(MissingItem::describe).collect(Collectors.toList()));
        if (type.isCombined()) {
            data.setEligibleSubScholarships(new ArrayList<>(eligibleSubScholarships));
        }
        return data;
    }

    private static List<RuleEntry> toEntries(List<RuleResult> results) {
        return results.stream().map(result -> {
            RuleEntry entry = new RuleEntry();
            entry.setRuleId(result.ruleId());
            entry.setName(result.ruleName());
            entry.setCondition(result.conditionField() + " " + result.operator() + " " + result.expectedValue());
            entry.setActual(result.actualValue());
            entry.setSeverity(result.severity().getValue());
            entry.setOutcome(result.outcome().name().toLowerCase());
            entry.setSubScholarship(result.subScholarshipCode());
            entry.setMessage(result.message());
            entry.setMessageEn(result.messageEn());
            return entry;
        }).collect(Collectors.toList());
    }

    @Data
    public static class ReportData {
        private Instant generatedAt;
        private String scholarshipType;
        private String subScholarship;
        private String studentId;
        private boolean ready;
        private boolean eligible;
        private List<RuleEntry> failed;
        private List<RuleEntry> warnings;
        private List<RuleEntry> passed;
        private List<String> missingItems;
        private List<String> eligibleSubScholarships;
    }

    @Data
    public static class RuleEntry {
        private Long ruleId;
        private String name;
        private String condition;
        private String actual;
        private String severity;
        private String outcome;
        private String subScholarship;
        private String message;
        private String messageEn;
    }
}
