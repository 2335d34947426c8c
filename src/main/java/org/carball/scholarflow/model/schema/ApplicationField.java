package org.carball.scholarflow.model.schema;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class ApplicationField {
    private Long id;
    private String scholarshipTypeCode;
    private String subScholarshipCode;
    private String name;
    private String labelZh;
    private String labelEn;
    private FieldType fieldType;
    private boolean required;

    @Builder.Default
    private FieldConstraints constraints = FieldConstraints.none();

    private int displayOrder;

    @Builder.Default
    private boolean active = true;

    private String helpText;
}
