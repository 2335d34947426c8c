package org.carball.scholarflow.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * YAML shape of a scholarship catalog file. Operators, severities and field types are kept as
 * strings here and resolved by {@link CatalogLoader}, so a bad value is reported with its location.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogDefinition {

    @JsonProperty("scholarships")
    private List<ScholarshipDefinition> scholarships = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScholarshipDefinition {

        @JsonProperty("code")
        private String code;

        @JsonProperty("name")
        private String name;

        @JsonProperty("name_en")
        private String nameEn;

        @JsonProperty("amount")
        private BigDecimal amount;

        @JsonProperty("currency")
        private String currency = "TWD";

        @JsonProperty("academic_year")
        private String academicYear;

        @JsonProperty("application_start")
        private Instant applicationStart;

        @JsonProperty("application_end")
        private Instant applicationEnd;

        @JsonProperty("combined")
        private boolean combined;

        @JsonProperty("requires_professor_recommendation")
        private boolean requiresProfessorRecommendation;

        @JsonProperty("college_approvals_required")
        private int collegeApprovalsRequired = 1;

        @JsonProperty("max_active_applications")
        private int maxActiveApplications = 1;

        @JsonProperty("sub_scholarships")
        private List<SubScholarshipDefinition> subScholarships = new ArrayList<>();

        @JsonProperty("rules")
        private List<RuleDefinition> rules = new ArrayList<>();

        @JsonProperty("fields")
        private List<FieldDefinition> fields = new ArrayList<>();

        @JsonProperty("documents")
        private List<DocumentDefinition> documents = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SubScholarshipDefinition {

        @JsonProperty("code")
        private String code;

        @JsonProperty("name")
        private String name;

        @JsonProperty("name_en")
        private String nameEn;

        @JsonProperty("amount")
        private BigDecimal amount;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuleDefinition {

        @JsonProperty("name")
        private String name;

        @JsonProperty("sub_type")
        private String subType;

        @JsonProperty("field")
        private String field;

        @JsonProperty("operator")
        private String operator;

        @JsonProperty("value")
        private String value;

        @JsonProperty("severity")
        private String severity = "hard";

        @JsonProperty("priority")
        private int priority;

        @JsonProperty("active")
        private boolean active = true;

        @JsonProperty("tag")
        private String tag;

        @JsonProperty("message")
        private String message;

        @JsonProperty("message_en")
        private String messageEn;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FieldDefinition {

        @JsonProperty("name")
        private String name;

        @JsonProperty("sub_type")
        private String subType;

        @JsonProperty("label")
        private String label;

        @JsonProperty("label_en")
        private String labelEn;

        @JsonProperty("type")
        private String type = "text";

        @JsonProperty("required")
        private boolean required;

        @JsonProperty("min_value")
        private BigDecimal minValue;

        @JsonProperty("max_value")
        private BigDecimal maxValue;

        @JsonProperty("max_length")
        private Integer maxLength;

        @JsonProperty("options")
        private List<String> options = new ArrayList<>();

        @JsonProperty("display_order")
        private int displayOrder;

        @JsonProperty("help_text")
        private String helpText;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DocumentDefinition {

        @JsonProperty("name")
        private String name;

        @JsonProperty("sub_type")
        private String subType;

        @JsonProperty("name_en")
        private String nameEn;

        @JsonProperty("description")
        private String description;

        @JsonProperty("required")
        private boolean required = true;

        @JsonProperty("accepted_file_types")
        private List<String> acceptedFileTypes = new ArrayList<>();

        @JsonProperty("max_file_count")
        private int maxFileCount = 1;

        @JsonProperty("display_order")
        private int displayOrder;
    }
}
