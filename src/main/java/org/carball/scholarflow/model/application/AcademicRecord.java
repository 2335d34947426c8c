package org.carball.scholarflow.model.application;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Snapshot of the applicant's academic standing taken when the application is created.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AcademicRecord {

    @JsonProperty("academic_year")
    private String academicYear;

    @JsonProperty("semester")
    private String semester;

    // 0.00 - 4.30 scale
    @JsonProperty("gpa")
    private BigDecimal gpa;

    @JsonProperty("class_ranking_percent")
    private BigDecimal classRankingPercent;

    @JsonProperty("dept_ranking_percent")
    private BigDecimal deptRankingPercent;

    @JsonProperty("completed_terms")
    private Integer completedTerms;

    @JsonProperty("enrollment_status")
    private String enrollmentStatus;

    @JsonProperty("student_type")
    private String studentType;

    @JsonProperty("nationality")
    private String nationality;
}
