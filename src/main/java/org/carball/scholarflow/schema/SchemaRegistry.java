package org.carball.scholarflow.schema;

import lombok.extern.slf4j.Slf4j;
import org.carball.scholarflow.catalog.UsageProbe;
import org.carball.scholarflow.exception.NotFoundException;
import org.carball.scholarflow.exception.SchemaLockedException;
import org.carball.scholarflow.exception.ValidationException;
import org.carball.scholarflow.model.application.DocumentReference;
import org.carball.scholarflow.model.schema.ApplicationDocument;
import org.carball.scholarflow.model.schema.ApplicationField;
import org.carball.scholarflow.model.schema.FieldType;
import org.carball.scholarflow.model.schema.FormSchema;
import org.carball.scholarflow.model.schema.MissingItem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Holds the dynamic form definition of each scholarship type: which fields and documents an
 * application carries, in what order, and which are required.
 *
 * <p>Entries scoped to a sub-scholarship are merged with the type's common entries. Names are unique
 * among active entries visible together. Once an entry has submitted data, only additive changes and
 * deactivation are accepted.
 */
@Slf4j
public class SchemaRegistry {

    private static final Comparator<ApplicationField> FIELD_ORDER = Comparator
            .comparingInt(ApplicationField::getDisplayOrder)
            .thenComparing(ApplicationField::getName);

    private static final Comparator<ApplicationDocument> DOCUMENT_ORDER = Comparator
            .comparingInt(ApplicationDocument::getDisplayOrder)
            .thenComparing(ApplicationDocument::getName);

    private final Map<Long, ApplicationField> fields = new ConcurrentHashMap<>();
    private final Map<Long, ApplicationDocument> documents = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final UsageProbe usageProbe;

    public SchemaRegistry(UsageProbe usageProbe) {
        this.usageProbe = usageProbe;
    }

    public FormSchema getSchema(String typeCode, String subCode) {
        return getSchema(typeCode, subCode, false);
    }

    /**
     * Returns the merged schema for a type and optional sub-scholarship. Inactive entries are only
     * included for administrative editing views.
     */
    public FormSchema getSchema(String typeCode, String subCode, boolean includeInactive) {
        List<ApplicationField> visibleFields = fields.values().stream()
                .filter(f -> inScope(f.getScholarshipTypeCode(), f.getSubScholarshipCode(), typeCode, subCode))
                .filter(f -> includeInactive || f.isActive())
                .sorted(FIELD_ORDER)
                .map(f -> f.toBuilder().build())
                .collect(Collectors.toList());

        List<ApplicationDocument> visibleDocuments = documents.values().stream()
                .filter(d -> inScope(d.getScholarshipTypeCode(), d.getSubScholarshipCode(), typeCode, subCode))
                .filter(d -> includeInactive || d.isActive())
                .sorted(DOCUMENT_ORDER)
                .map(d -> d.toBuilder().build())
                .collect(Collectors.toList());

        return new FormSchema(visibleFields, visibleDocuments);
    }

    // Fields

    public synchronized ApplicationField createField(ApplicationField definition) {
        validateFieldDefinition(definition);
        ApplicationField stored = definition.toBuilder()
                .id(sequence.incrementAndGet())
                .build();
        if (stored.isActive()) {
            ensureUniqueField(stored);
        }
        fields.put(stored.getId(), stored);
        log.info("Created field '{}' ({}) for scholarship '{}'", stored.getName(),
                stored.getFieldType().getValue(), scopeLabel(stored.getScholarshipTypeCode(), stored.getSubScholarshipCode()));
        return stored.toBuilder().build();
    }

    /**
     * Applies changes to an existing field. Type, required-ness, name and scope are structural and
     * locked once the field has submitted values.
     */
    public synchronized ApplicationField updateField(long fieldId, ApplicationField changes) {
        ApplicationField existing = requireField(fieldId);
        validateFieldDefinition(changes);

        List<String> structural = new ArrayList<>();
        if (changes.getFieldType() != existing.getFieldType()) {
            structural.add("type");
        }
        if (changes.isRequired() != existing.isRequired()) {
            structural.add("required");
        }
        if (!changes.getName().equals(existing.getName())) {
            structural.add("name");
        }
        if (!Objects.equals(changes.getScholarshipTypeCode(), existing.getScholarshipTypeCode())
                || !Objects.equals(changes.getSubScholarshipCode(), existing.getSubScholarshipCode())) {
            structural.add("scope");
        }
        if (!structural.isEmpty() && usageProbe.isFieldInUse(existing.getScholarshipTypeCode(), existing.getName())) {
            throw new SchemaLockedException(existing.getScholarshipTypeCode(), existing.getName(), structural);
        }

        ApplicationField updated = changes.toBuilder()
                .id(existing.getId())
                .active(existing.isActive())
                .build();
        if (updated.isActive()) {
            ensureUniqueField(updated);
        }
        fields.put(fieldId, updated);
        log.info("Updated field {} '{}'", fieldId, updated.getName());
        return updated.toBuilder().build();
    }

    public synchronized ApplicationField deactivateField(long fieldId) {
        ApplicationField updated = requireField(fieldId).toBuilder().active(false).build();
        fields.put(fieldId, updated);
        log.info("Deactivated field {} '{}'", fieldId, updated.getName());
        return updated.toBuilder().build();
    }

    public synchronized ApplicationField reactivateField(long fieldId) {
        ApplicationField updated = requireField(fieldId).toBuilder().active(true).build();
        ensureUniqueField(updated);
        fields.put(fieldId, updated);
        log.info("Reactivated field {} '{}'", fieldId, updated.getName());
        return updated.toBuilder().build();
    }

    // Documents

    public synchronized ApplicationDocument createDocument(ApplicationDocument definition) {
        validateDocumentDefinition(definition);
        ApplicationDocument stored = definition.toBuilder()
                .id(sequence.incrementAndGet())
                .build();
        if (stored.isActive()) {
            ensureUniqueDocument(stored);
        }
        documents.put(stored.getId(), stored);
        log.info("Created document '{}' for scholarship '{}'", stored.getName(),
                scopeLabel(stored.getScholarshipTypeCode(), stored.getSubScholarshipCode()));
        return stored.toBuilder().build();
    }

    public synchronized ApplicationDocument updateDocument(long documentId, ApplicationDocument changes) {
        ApplicationDocument existing = requireDocument(documentId);
        validateDocumentDefinition(changes);

        List<String> structural = new ArrayList<>();
        if (changes.isRequired() != existing.isRequired()) {
            structural.add("required");
        }
        if (!changes.getName().equals(existing.getName())) {
            structural.add("name");
        }
        if (!Objects.equals(changes.getScholarshipTypeCode(), existing.getScholarshipTypeCode())
                || !Objects.equals(changes.getSubScholarshipCode(), existing.getSubScholarshipCode())) {
            structural.add("scope");
        }
        if (!structural.isEmpty() && usageProbe.isDocumentInUse(existing.getScholarshipTypeCode(), existing.getName())) {
            throw new SchemaLockedException(existing.getScholarshipTypeCode(), existing.getName(), structural);
        }

        ApplicationDocument updated = changes.toBuilder()
                .id(existing.getId())
                .active(existing.isActive())
                .build();
        if (updated.isActive()) {
            ensureUniqueDocument(updated);
        }
        documents.put(documentId, updated);
        log.info("Updated document {} '{}'", documentId, updated.getName());
        return updated.toBuilder().build();
    }

    public synchronized ApplicationDocument deactivateDocument(long documentId) {
        ApplicationDocument updated = requireDocument(documentId).toBuilder().active(false).build();
        documents.put(documentId, updated);
        log.info("Deactivated document {} '{}'", documentId, updated.getName());
        return updated.toBuilder().build();
    }

    public synchronized ApplicationDocument reactivateDocument(long documentId) {
        ApplicationDocument updated = requireDocument(documentId).toBuilder().active(true).build();
        ensureUniqueDocument(updated);
        documents.put(documentId, updated);
        log.info("Reactivated document {} '{}'", documentId, updated.getName());
        return updated.toBuilder().build();
    }

    // Batches

    /**
     * Checks a batch of new entries against each other and against the stored ones without storing
     * anything.
     */
    public synchronized void checkNewEntries(List<ApplicationField> newFields, List<ApplicationDocument> newDocuments) {
        List<ApplicationField> fieldPool = new ArrayList<>(fields.values());
        for (ApplicationField field : newFields) {
            validateFieldDefinition(field);
            if (field.isActive()) {
                ensureUniqueField(field, fieldPool);
                fieldPool.add(field);
            }
        }
        List<ApplicationDocument> documentPool = new ArrayList<>(documents.values());
        for (ApplicationDocument document : newDocuments) {
            validateDocumentDefinition(document);
            if (document.isActive()) {
                ensureUniqueDocument(document, documentPool);
                documentPool.add(document);
            }
        }
    }

    /**
     * Creates every entry of the batch, or none of them when any entry is invalid.
     */
    public synchronized void createAll(List<ApplicationField> newFields, List<ApplicationDocument> newDocuments) {
        checkNewEntries(newFields, newDocuments);
        newFields.forEach(this::createField);
        newDocuments.forEach(this::createDocument);
    }

    // Submitted data checks

    /**
     * Checks every provided value against its field's type and bounds, reporting all violations at
     * once. Values for names the schema does not define are rejected.
     */
    public void validateValues(FormSchema schema, Map<String, String> values) {
        Map<String, String> violations = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String value = entry.getValue();
            if (value == null || value.isBlank()) {
                continue;
            }
            schema.field(entry.getKey()).ifPresentOrElse(
                    field -> field.getFieldType().check(value, field.getConstraints())
                            .ifPresent(problem -> violations.put(field.getName(), problem)),
                    () -> violations.put(entry.getKey(), "unknown field"));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    /**
     * Lists every required field without a value and every required document without an attachment.
     */
    public List<MissingItem> findMissing(FormSchema schema, Map<String, String> values,
                                         Collection<DocumentReference> attached) {
        List<MissingItem> missing = new ArrayList<>();
        for (ApplicationField field : schema.fields()) {
            if (field.isRequired() && !field.getFieldType().isFilled(values.get(field.getName()))) {
                missing.add(MissingItem.field(field.getName()));
            }
        }
        for (ApplicationDocument document : schema.documents()) {
            boolean satisfied = attached.stream().anyMatch(ref -> ref.documentName().equals(document.getName()));
            if (document.isRequired() && !satisfied) {
                missing.add(MissingItem.document(document.getName()));
            }
        }
        return missing;
    }

    private ApplicationField requireField(long fieldId) {
        ApplicationField field = fields.get(fieldId);
        if (field == null) {
            throw new NotFoundException("Application field", String.valueOf(fieldId));
        }
        return field;
    }

    private ApplicationDocument requireDocument(long documentId) {
        ApplicationDocument document = documents.get(documentId);
        if (document == null) {
            throw new NotFoundException("Application document", String.valueOf(documentId));
        }
        return document;
    }

    private void validateFieldDefinition(ApplicationField definition) {
        Map<String, String> problems = new LinkedHashMap<>();
        if (definition.getScholarshipTypeCode() == null || definition.getScholarshipTypeCode().isBlank()) {
            problems.put("scholarship_type", "scholarship type is required");
        }
        if (definition.getName() == null || definition.getName().isBlank()) {
            problems.put("name", "field name is required");
        }
        if (definition.getFieldType() == null) {
            problems.put("type", "field type is required");
        } else if (definition.getFieldType() == FieldType.FILE_SET) {
            problems.put("type", "file sets are defined as documents");
        }
        if (definition.getConstraints() == null) {
            problems.put("constraints", "constraints must not be null");
        } else if (definition.getConstraints().getMinValue() != null && definition.getConstraints().getMaxValue() != null
                && definition.getConstraints().getMinValue().compareTo(definition.getConstraints().getMaxValue()) > 0) {
            problems.put("constraints", "minimum exceeds maximum");
        }
        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }
    }

    private void validateDocumentDefinition(ApplicationDocument definition) {
        Map<String, String> problems = new LinkedHashMap<>();
        if (definition.getScholarshipTypeCode() == null || definition.getScholarshipTypeCode().isBlank()) {
            problems.put("scholarship_type", "scholarship type is required");
        }
        if (definition.getName() == null || definition.getName().isBlank()) {
            problems.put("name", "document name is required");
        }
        if (definition.getMaxFileCount() < 1) {
            problems.put("max_file_count", "must allow at least one file");
        }
        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }
    }

    private void ensureUniqueField(ApplicationField candidate) {
        ensureUniqueField(candidate, fields.values());
    }

    private static void ensureUniqueField(ApplicationField candidate, Collection<ApplicationField> pool) {
        boolean clash = pool.stream()
                .filter(ApplicationField::isActive)
                .filter(f -> f.getId() == null || !f.getId().equals(candidate.getId()))
                .filter(f -> f.getName().equals(candidate.getName()))
                .anyMatch(f -> overlaps(f.getScholarshipTypeCode(), f.getSubScholarshipCode(),
                        candidate.getScholarshipTypeCode(), candidate.getSubScholarshipCode()));
        if (clash) {
            throw new ValidationException("name", String.format("field '%s' already exists for scholarship '%s'",
                    candidate.getName(), candidate.getScholarshipTypeCode()));
        }
    }

    private void ensureUniqueDocument(ApplicationDocument candidate) {
        ensureUniqueDocument(candidate, documents.values());
    }

    private static void ensureUniqueDocument(ApplicationDocument candidate, Collection<ApplicationDocument> pool) {
        boolean clash = pool.stream()
                .filter(ApplicationDocument::isActive)
                .filter(d -> d.getId() == null || !d.getId().equals(candidate.getId()))
                .filter(d -> d.getName().equals(candidate.getName()))
                .anyMatch(d -> overlaps(d.getScholarshipTypeCode(), d.getSubScholarshipCode(),
                        candidate.getScholarshipTypeCode(), candidate.getSubScholarshipCode()));
        if (clash) {
            throw new ValidationException("name", String.format("document '%s' already exists for scholarship '%s'",
                    candidate.getName(), candidate.getScholarshipTypeCode()));
        }
    }

    private static boolean inScope(String entryType, String entrySub, String typeCode, String subCode) {
        return entryType.equals(typeCode) && (entrySub == null || entrySub.equals(subCode));
    }

    // Two entries are visible together unless they belong to different sub-scholarships.
    private static boolean overlaps(String typeA, String subA, String typeB, String subB) {
        return typeA.equals(typeB) && (subA == null || subB == null || subA.equals(subB));
    }

    private static String scopeLabel(String typeCode, String subCode) {
        return subCode == null ? typeCode : typeCode + "/" + subCode;
    }
}
