package org.carball.scholarflow.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import org.carball.scholarflow.model.application.AcademicRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML description of a prospective applicant for a dry-run check.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApplicantProfile {

    @JsonProperty("student_id")
    private String studentId;

    @JsonProperty("scholarship")
    private String scholarship;

    @JsonProperty("sub_scholarship")
    private String subScholarship;

    @JsonProperty("academic_record")
    private AcademicRecord academicRecord;

    @JsonProperty("fields")
    private Map<String, String> fields = new LinkedHashMap<>();

    // names of the document requirements the applicant has files for
    @JsonProperty("documents")
    private List<String> documents = new ArrayList<>();
}
