package org.carball.scholarflow.catalog;

import org.carball.scholarflow.exception.ValidationException;
import org.carball.scholarflow.model.schema.ApplicationDocument;
import org.carball.scholarflow.model.schema.ApplicationField;
import org.carball.scholarflow.model.schema.FieldType;
import org.carball.scholarflow.model.schema.FormSchema;
import org.carball.scholarflow.model.scholarship.EligibilityRule;
import org.carball.scholarflow.model.scholarship.RuleOperator;
import org.carball.scholarflow.model.scholarship.RuleSeverity;
import org.carball.scholarflow.model.scholarship.ScholarshipType;
import org.carball.scholarflow.schema.SchemaRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

public class CatalogLoaderTest {

    @TempDir
    Path tempDir;

    private ScholarshipCatalog catalog;
    private SchemaRegistry schemaRegistry;
    private CatalogLoader loader;

    @BeforeEach
    void setUp() {
        catalog = new ScholarshipCatalog(UsageProbe.none());
        schemaRegistry = new SchemaRegistry(UsageProbe.none());
        loader = new CatalogLoader(catalog, schemaRegistry);
    }

    @Test
    void shouldLoadTypesRulesAndSchema() throws IOException {
        // When
        List<ScholarshipType> loaded;
        try (InputStream in = getClass().getResourceAsStream("/catalog/scholarships.yml")) {
            loaded = loader.load(in);
        }

        // Then
        assertThat(loaded).extracting(ScholarshipType::getCode)
                .containsExactly("undergraduate_freshman", "doctoral_combined");

        ScholarshipType freshman = catalog.require("undergraduate_freshman");
        assertThat(freshman.getNameEn()).isEqualTo("Undergraduate Freshman Scholarship");
        assertThat(freshman.getApplicationStart()).isEqualTo(Instant.parse("2024-09-01T00:00:00Z"));
        assertThat(freshman.getRules()).extracting(EligibilityRule::getOperator, EligibilityRule::getSeverity)
                .containsExactly(
                        tuple(RuleOperator.GREATER_OR_EQUAL, RuleSeverity.HARD),
                        tuple(RuleOperator.LESS_OR_EQUAL, RuleSeverity.WARNING),
                        tuple(RuleOperator.IN, RuleSeverity.HARD));
        assertThat(freshman.getRules().get(0).getMessageEn()).isEqualTo("GPA below 3.38");

        FormSchema schema = schemaRegistry.getSchema("undergraduate_freshman", null);
        assertThat(schema.fields()).extracting(ApplicationField::getName, ApplicationField::getFieldType)
                .containsExactly(
                        tuple("bank_account", FieldType.TEXT),
                        tuple("household_income", FieldType.NUMBER));
        assertThat(schema.field("bank_account").orElseThrow().getConstraints().getMaxLength()).isEqualTo(20);
        assertThat(schema.documents()).extracting(ApplicationDocument::getName).containsExactly("高中成績單");
    }

    @Test
    void shouldApplyDefaultsForCombinedType() throws IOException {
        // When
        try (InputStream in = getClass().getResourceAsStream("/catalog/scholarships.yml")) {
            loader.load(in);
        }

        // Then
        ScholarshipType doctoral = catalog.require("doctoral_combined");
        assertThat(doctoral.isCombined()).isTrue();
        assertThat(doctoral.isRequiresProfessorRecommendation()).isTrue();
        assertThat(doctoral.getCurrency()).isEqualTo("TWD");
        assertThat(doctoral.getCollegeApprovalsRequired()).isEqualTo(1);
        assertThat(doctoral.rulesFor("doctoral_moe")).extracting(EligibilityRule::getName)
                .containsExactlyInAnyOrder("Enrolled", "MOE GPA", "MOE ranking");
        assertThat(doctoral.getRules()).allMatch(EligibilityRule::isHard);

        assertThat(schemaRegistry.getSchema("doctoral_combined", "doctoral_most").document("research_proposal"))
                .hasValueSatisfying(d -> assertThat(d.getMaxFileCount()).isEqualTo(2));
        assertThat(schemaRegistry.getSchema("doctoral_combined", "doctoral_moe").documents()).isEmpty();
    }

    @Test
    void shouldLoadFromFile() throws IOException {
        // Given
        Path file = tempDir.resolve("catalog.yml");
        Files.writeString(file, """
                scholarships:
                  - code: research_assistant
                    name: 研究助理獎學金
                    amount: 12000
                    rules:
                      - name: Enrolled
                        field: enrollment_status
                        operator: in
                        value: "enrolled, extended"
                """);

        // When
        List<ScholarshipType> loaded = loader.load(file);

        // Then
        assertThat(loaded).singleElement()
                .satisfies(type -> assertThat(type.getAmount()).isEqualByComparingTo("12000"));
    }

    @Test
    void shouldRejectUnknownOperator() {
        assertThatThrownBy(() -> {
            try (InputStream in = getClass().getResourceAsStream("/bad-operator-catalog.yml")) {
                loader.load(in);
            }
        })
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("broken rule 'Bad operator'")
                .hasMessageContaining("Unknown rule operator: =>");
    }

    @Test
    void shouldLeaveNothingBehindWhenEntryHasDuplicateField() throws IOException {
        // Given
        Path file = tempDir.resolve("duplicate-field.yml");
        Files.writeString(file, """
                scholarships:
                  - code: research_assistant
                    name: 研究助理獎學金
                    fields:
                      - name: bank_account
                      - name: bank_account
                        type: number
                """);

        // When / Then
        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("field 'bank_account' already exists");
        assertThat(catalog.find("research_assistant")).isEmpty();
        assertThat(schemaRegistry.getSchema("research_assistant", null, true).fields()).isEmpty();

        // When: the corrected catalog is loaded again
        Files.writeString(file, """
                scholarships:
                  - code: research_assistant
                    name: 研究助理獎學金
                    fields:
                      - name: bank_account
                """);
        loader.load(file);

        // Then
        assertThat(schemaRegistry.getSchema("research_assistant", null).fields())
                .extracting(ApplicationField::getName)
                .containsExactly("bank_account");
    }

    @Test
    void shouldNotCreateFormEntriesForRejectedType() throws IOException {
        // Given: a combined type without sub-scholarships
        Path file = tempDir.resolve("invalid-type.yml");
        Files.writeString(file, """
                scholarships:
                  - code: doctoral_joint
                    name: 博士生聯合獎學金
                    combined: true
                    documents:
                      - name: research_proposal
                """);

        // When / Then
        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("at least one sub-scholarship");
        assertThat(schemaRegistry.getSchema("doctoral_joint", null, true).documents()).isEmpty();
    }

    @Test
    void shouldReportMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Catalog file not found");
    }

    @Test
    void shouldReturnNothingForEmptyCatalog() throws IOException {
        // Given
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "scholarships: []\n");

        // Then
        assertThat(loader.load(file)).isEmpty();
    }
}
