package org.carball.scholarflow.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.scholarflow.catalog.CatalogDefinition.DocumentDefinition;
import org.carball.scholarflow.catalog.CatalogDefinition.FieldDefinition;
import org.carball.scholarflow.catalog.CatalogDefinition.RuleDefinition;
import org.carball.scholarflow.catalog.CatalogDefinition.ScholarshipDefinition;
import org.carball.scholarflow.exception.ValidationException;
import org.carball.scholarflow.model.schema.ApplicationDocument;
import org.carball.scholarflow.model.schema.ApplicationField;
import org.carball.scholarflow.model.schema.FieldConstraints;
import org.carball.scholarflow.model.schema.FieldType;
import org.carball.scholarflow.model.scholarship.ConditionField;
import org.carball.scholarflow.model.scholarship.EligibilityRule;
import org.carball.scholarflow.model.scholarship.RuleOperator;
import org.carball.scholarflow.model.scholarship.RuleSeverity;
import org.carball.scholarflow.model.scholarship.ScholarshipType;
import org.carball.scholarflow.model.scholarship.SubScholarship;
import org.carball.scholarflow.schema.SchemaRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reads a YAML catalog and registers its scholarship types, rules and form schema entries.
 */
@Slf4j
public class CatalogLoader {

    private final ScholarshipCatalog catalog;
    private final SchemaRegistry schemaRegistry;
    private final ObjectMapper mapper;

    public CatalogLoader(ScholarshipCatalog catalog, SchemaRegistry schemaRegistry) {
        this.catalog = catalog;
        this.schemaRegistry = schemaRegistry;
        this.mapper = new ObjectMapper(new YAMLFactory());
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
    }

    public List<ScholarshipType> load(Path catalogFile) throws IOException {
        if (!Files.exists(catalogFile)) {
            throw new IOException("Catalog file not found: " + catalogFile);
        }
        try (InputStream in = Files.newInputStream(catalogFile)) {
            List<ScholarshipType> loaded = load(in);
            log.info("Loaded {} scholarship type(s) from {}", loaded.size(), catalogFile);
            return loaded;
        }
    }

    public List<ScholarshipType> load(InputStream in) throws IOException {
        CatalogDefinition definition = mapper.readValue(in, CatalogDefinition.class);
        if (definition == null || definition.getScholarships().isEmpty()) {
            log.warn("Catalog defines no scholarships");
            return List.of();
        }

        List<ScholarshipType> registered = new ArrayList<>();
        for (ScholarshipDefinition scholarship : definition.getScholarships()) {
            registered.add(apply(scholarship));
        }
        return registered;
    }

    private ScholarshipType apply(ScholarshipDefinition def) {
        ScholarshipType type = ScholarshipType.builder()
                .code(def.getCode())
                .nameZh(def.getName())
                .nameEn(def.getNameEn())
                .amount(def.getAmount())
                .currency(def.getCurrency())
                .academicYear(def.getAcademicYear())
                .applicationStart(def.getApplicationStart())
                .applicationEnd(def.getApplicationEnd())
                .combined(def.isCombined())
                .requiresProfessorRecommendation(def.isRequiresProfessorRecommendation())
                .collegeApprovalsRequired(def.getCollegeApprovalsRequired())
                .maxActiveApplicationsPerStudent(def.getMaxActiveApplications())
                .subScholarships(def.getSubScholarships().stream()
                        .map(sub -> SubScholarship.builder()
                                .code(sub.getCode())
                                .nameZh(sub.getName())
                                .nameEn(sub.getNameEn())
                                .amount(sub.getAmount())
                                .build())
                        .collect(Collectors.toList()))
                .rules(def.getRules().stream()
                        .map(rule -> toRule(def.getCode(), rule))
                        .collect(Collectors.toList()))
                .build();

        List<ApplicationField> fields = def.getFields().stream()
                .map(field -> toField(def.getCode(), field))
                .collect(Collectors.toList());
        List<ApplicationDocument> documents = def.getDocuments().stream()
                .map(document -> toDocument(def.getCode(), document))
                .collect(Collectors.toList());

        // a bad entry must leave neither the type nor part of its form behind
        schemaRegistry.checkNewEntries(fields, documents);
        ScholarshipType stored = catalog.register(type);
        schemaRegistry.createAll(fields, documents);

        log.debug("Scholarship '{}': {} field(s), {} document(s)", def.getCode(),
                def.getFields().size(), def.getDocuments().size());
        return stored;
    }

    private static EligibilityRule toRule(String typeCode, RuleDefinition def) {
        String where = typeCode + " rule '" + def.getName() + "'";
        return EligibilityRule.builder()
                .scholarshipTypeCode(typeCode)
                .subScholarshipCode(def.getSubType())
                .name(def.getName())
                .conditionField(resolve(where, "field", def.getField(), ConditionField::fromKey))
                .operator(resolve(where, "operator", def.getOperator(), RuleOperator::fromSymbol))
                .expectedValue(def.getValue())
                .severity(resolve(where, "severity", def.getSeverity(), RuleSeverity::fromValue))
                .priority(def.getPriority())
                .active(def.isActive())
                .tag(def.getTag())
                .messageZh(def.getMessage())
                .messageEn(def.getMessageEn())
                .build();
    }

    private static ApplicationField toField(String typeCode, FieldDefinition def) {
        String where = typeCode + " field '" + def.getName() + "'";
        return ApplicationField.builder()
                .scholarshipTypeCode(typeCode)
                .subScholarshipCode(def.getSubType())
                .name(def.getName())
                .labelZh(def.getLabel())
                .labelEn(def.getLabelEn())
                .fieldType(resolve(where, "type", def.getType(), FieldType::fromValue))
                .required(def.isRequired())
                .constraints(FieldConstraints.builder()
                        .minValue(def.getMinValue())
                        .maxValue(def.getMaxValue())
                        .maxLength(def.getMaxLength())
                        .options(new ArrayList<>(def.getOptions()))
                        .build())
                .displayOrder(def.getDisplayOrder())
                .helpText(def.getHelpText())
                .build();
    }

    private static ApplicationDocument toDocument(String typeCode, DocumentDefinition def) {
        return ApplicationDocument.builder()
                .scholarshipTypeCode(typeCode)
                .subScholarshipCode(def.getSubType())
                .name(def.getName())
                .nameEn(def.getNameEn())
                .description(def.getDescription())
                .required(def.isRequired())
                .acceptedFileTypes(new ArrayList<>(def.getAcceptedFileTypes()))
                .maxFileCount(def.getMaxFileCount())
                .displayOrder(def.getDisplayOrder())
                .build();
    }

    private static <T> T resolve(String where, String attribute, String raw, Function<String, T> lookup) {
        if (raw == null) {
            throw new ValidationException(attribute, where + ": " + attribute + " is required");
        }
        try {
            return lookup.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(attribute, where + ": " + e.getMessage());
        }
    }
}
