package org.carball.scholarflow.model.scholarship;

import lombok.Getter;
import org.carball.scholarflow.model.application.AcademicRecord;

import java.math.BigDecimal;

/**
 * Applicant attributes an eligibility rule may test. Numeric fields resolve to {@link BigDecimal},
 * categorical ones to {@link String}.
 */
@Getter
public enum ConditionField {

    GPA("gpa", true) {
        @Override
        public Object resolve(AcademicRecord record) {
            return record.getGpa();
        }
    },

    CLASS_RANKING_PERCENT("class_ranking_percent", true) {
        @Override
        public Object resolve(AcademicRecord record) {
            return record.getClassRankingPercent();
        }
    },

    DEPT_RANKING_PERCENT("dept_ranking_percent", true) {
        @Override
        public Object resolve(AcademicRecord record) {
            return record.getDeptRankingPercent();
        }
    },

    COMPLETED_TERMS("completed_terms", true) {
        @Override
        public Object resolve(AcademicRecord record) {
            return record.getCompletedTerms() == null ? null : BigDecimal.valueOf(record.getCompletedTerms());
        }
    },

    ENROLLMENT_STATUS("enrollment_status", false) {
        @Override
        public Object resolve(AcademicRecord record) {
            return record.getEnrollmentStatus();
        }
    },

    STUDENT_TYPE("student_type", false) {
        @Override
        public Object resolve(AcademicRecord record) {
            return record.getStudentType();
        }
    },

    NATIONALITY("nationality", false) {
        @Override
        public Object resolve(AcademicRecord record) {
            return record.getNationality();
        }
    };

    private final String key;
    private final boolean numeric;

    ConditionField(String key, boolean numeric) {
        this.key = key;
        this.numeric = numeric;
    }

    /**
     * Returns the applicant's value for this field, or {@code null} when the record has none.
     */
    public abstract Object resolve(AcademicRecord record);

    public static ConditionField fromKey(String key) {
        for (ConditionField field : values()) {
            if (field.key.equalsIgnoreCase(key)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown condition field: " + key);
    }
}
