package org.carball.scholarflow.model.schema;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
public class ApplicationDocument {
    private Long id;
    private String scholarshipTypeCode;
    private String subScholarshipCode;
    private String name;
    private String nameEn;
    private String description;

    @Builder.Default
    private boolean required = true;

    @Builder.Default
    private List<String> acceptedFileTypes = new ArrayList<>();

    @Builder.Default
    private int maxFileCount = 1;

    private int displayOrder;

    @Builder.Default
    private boolean active = true;

    public FieldType getFieldType() {
        return FieldType.FILE_SET;
    }
}
