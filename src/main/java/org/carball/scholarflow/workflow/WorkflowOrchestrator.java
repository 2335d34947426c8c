package org.carball.scholarflow.workflow;

import lombok.extern.slf4j.Slf4j;
import org.carball.scholarflow.catalog.ScholarshipCatalog;
import org.carball.scholarflow.config.WorkflowSettings;
import org.carball.scholarflow.eligibility.EligibilityEvaluator;
import org.carball.scholarflow.exception.DuplicateApplicationException;
import org.carball.scholarflow.exception.IllegalTransitionException;
import org.carball.scholarflow.exception.NotFoundException;
import org.carball.scholarflow.exception.PermissionException;
import org.carball.scholarflow.exception.ValidationException;
import org.carball.scholarflow.model.application.AcademicRecord;
import org.carball.scholarflow.model.application.Actor;
import org.carball.scholarflow.model.application.Application;
import org.carball.scholarflow.model.application.ApplicationStatus;
import org.carball.scholarflow.model.application.DocumentReference;
import org.carball.scholarflow.model.application.Role;
import org.carball.scholarflow.model.application.TransitionRequest;
import org.carball.scholarflow.model.eligibility.EligibilityReport;
import org.carball.scholarflow.model.eligibility.ExemptionSet;
import org.carball.scholarflow.model.schema.ApplicationDocument;
import org.carball.scholarflow.model.schema.FormSchema;
import org.carball.scholarflow.model.scholarship.ScholarshipType;
import org.carball.scholarflow.output.ApplicationView;
import org.carball.scholarflow.output.ApplicationViewProjector;
import org.carball.scholarflow.schema.SchemaRegistry;
import org.carball.scholarflow.whitelist.WhitelistStore;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Entry point for everything that changes an application. Writes to one application are serialized
 * by a per-application lock; the repository's version check catches writers that bypass it.
 * Listeners are notified after the write and cannot undo it.
 */
@Slf4j
public class WorkflowOrchestrator {

    private final ScholarshipCatalog catalog;
    private final SchemaRegistry schemaRegistry;
    private final EligibilityEvaluator evaluator;
    private final WhitelistStore whitelistStore;
    private final ApplicationRepository repository;
    private final ApplicationStateMachine stateMachine;
    private final ApplicationViewProjector projector;
    private final ApplicationIdGenerator idGenerator;
    private final Clock clock;

    // one lock per application id ever written; entries live as long as the orchestrator
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Object creationLock = new Object();
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();

    public WorkflowOrchestrator(ScholarshipCatalog catalog, SchemaRegistry schemaRegistry, EligibilityEvaluator evaluator,
                                WhitelistStore whitelistStore, ApplicationRepository repository,
                                WorkflowSettings settings, Clock clock) {
        this.catalog = catalog;
        this.schemaRegistry = schemaRegistry;
        this.evaluator = evaluator;
        this.whitelistStore = whitelistStore;
        this.repository = repository;
        this.clock = clock;

        ReviewAggregator aggregator = new ReviewAggregator();
        this.stateMachine = new ApplicationStateMachine(catalog, schemaRegistry, evaluator, whitelistStore,
                aggregator, settings, clock);
        this.projector = new ApplicationViewProjector(catalog, aggregator);
        this.idGenerator = new ApplicationIdGenerator(settings, clock);
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    /**
     * Opens a draft application for a student. Fails when the type is not offered or the student
     * already holds as many open applications for it as the type allows.
     */
    public Application createApplication(Actor student, String scholarshipTypeCode, String subScholarshipCode,
                                         AcademicRecord academicRecord, Set<String> advisorIds) {
        if (student.role() != Role.STUDENT) {
            throw new PermissionException(student.id(), student.role(), "only students may open applications");
        }
        ScholarshipType type = catalog.require(scholarshipTypeCode);
        if (!type.isActive()) {
            throw new ValidationException("scholarship_type", "scholarship " + scholarshipTypeCode + " is no longer offered");
        }
        checkSubScholarship(type, subScholarshipCode);
        evaluator.validateRecord(academicRecord);

        synchronized (creationLock) {
            long open = repository.findByStudentAndType(student.id(), scholarshipTypeCode).stream()
                    .filter(a -> a.getStatus().isActive())
                    .count();
            if (open >= type.getMaxActiveApplicationsPerStudent()) {
                throw new DuplicateApplicationException(student.id(), scholarshipTypeCode,
                        type.getMaxActiveApplicationsPerStudent());
            }

            Instant now = clock.instant();
            Application application = Application.builder()
                    .id(idGenerator.next())
                    .studentId(student.id())
                    .scholarshipTypeCode(scholarshipTypeCode)
                    .subScholarshipCode(subScholarshipCode)
                    .academicRecord(academicRecord.toBuilder().build())
                    .createdAt(now)
                    .build();
            if (advisorIds != null) {
                application.getAdvisorIds().addAll(advisorIds);
            }
            application.getStatusTimestamps().put(ApplicationStatus.DRAFT, now);

            Application stored = repository.insert(application);
            log.info("Created application {} for student {} on scholarship {}", stored.getId(), student.id(), scholarshipTypeCode);
            return stored;
        }
    }

    /**
     * Writes field values into a draft. A blank or null value clears the field. Passing a
     * sub-scholarship code switches the selection of a combined type.
     */
    public Application updateDraft(String applicationId, Actor actor, Map<String, String> values, String subScholarshipCode) {
        return mutateDraft(applicationId, actor, "update", working -> {
            ScholarshipType type = catalog.require(working.getScholarshipTypeCode());
            if (subScholarshipCode != null) {
                checkSubScholarship(type, subScholarshipCode);
                working.setSubScholarshipCode(subScholarshipCode);
            }
            FormSchema schema = schemaRegistry.getSchema(type.getCode(), working.getSubScholarshipCode());
            schemaRegistry.validateValues(schema, values);
            values.forEach((name, value) -> {
                if (value == null || value.isBlank()) {
                    working.getFieldValues().remove(name);
                } else {
                    working.getFieldValues().put(name, value);
                }
            });
            return working;
        });
    }

    public Application attachDocument(String applicationId, Actor actor, String documentName, String reference) {
        return mutateDraft(applicationId, actor, "attach documents to", working -> {
            FormSchema schema = schemaRegistry.getSchema(working.getScholarshipTypeCode(), working.getSubScholarshipCode());
            ApplicationDocument document = schema.document(documentName)
                    .orElseThrow(() -> new ValidationException("document", "no document requirement named " + documentName));
            if (working.documentCount(documentName) >= document.getMaxFileCount()) {
                throw new ValidationException("document", String.format("%s accepts at most %d file(s)",
                        documentName, document.getMaxFileCount()));
            }
            working.getDocuments().add(new DocumentReference(documentName, reference, clock.instant()));
            return working;
        });
    }

    public Application detachDocument(String applicationId, Actor actor, String reference) {
        return mutateDraft(applicationId, actor, "detach documents from", working -> {
            boolean removed = working.getDocuments().removeIf(d -> d.reference().equals(reference));
            if (!removed) {
                throw new NotFoundException("Document reference", reference);
            }
            return working;
        });
    }

    /**
     * Adds a professor as advisor. Allowed for the owning student or an administrator until the
     * application is forwarded for professor recommendation.
     */
    public Application assignAdvisor(String applicationId, Actor actor, String professorId) {
        return withLock(applicationId, () -> {
            Application current = load(applicationId);
            if (!actor.role().isAdministrative() && !current.isOwnedBy(actor.id())) {
                throw new PermissionException(actor.id(), actor.role(),
                        actor.role().getValue() + " " + actor.id() + " may not assign advisors to " + applicationId);
            }
            if (!current.getStatus().acceptsAdvisorChanges()) {
                throw new IllegalTransitionException(applicationId, current.getStatus(), null, String.format(
                        "Application %s is %s and its advisors can no longer change", applicationId,
                        current.getStatus().getValue()));
            }
            Application working = current.copy();
            working.getAdvisorIds().add(professorId);
            return repository.save(working, current.getVersion());
        });
    }

    /**
     * Applies an inbound intent. On success the stored application is returned and listeners are
     * told about the change.
     */
    public Application handle(TransitionRequest request) {
        Actor actor = request.actor();
        ApplicationStatus from;
        Application saved;

        ReentrantLock lock = lockFor(request.applicationId());
        lock.lock();
        try {
            Application current = load(request.applicationId());
            from = current.getStatus();
            Application next = stateMachine.transition(current, request.intent(), actor, request.comment());
            saved = repository.save(next, current.getVersion());
        } finally {
            lock.unlock();
        }

        publish(new TransitionEvent(saved.getId(), request.intent(), from, saved.getStatus(),
                actor.id(), actor.role(), clock.instant()));
        return saved;
    }

    public EligibilityReport previewEligibility(String applicationId) {
        Application application = load(applicationId);
        ScholarshipType type = catalog.require(application.getScholarshipTypeCode());
        return evaluator.preview(application.getAcademicRecord(), type, application.getSubScholarshipCode(),
                exemptionsFor(application));
    }

    public List<String> eligibleSubScholarships(String applicationId) {
        Application application = load(applicationId);
        ScholarshipType type = catalog.require(application.getScholarshipTypeCode());
        return evaluator.eligibleSubScholarships(application.getAcademicRecord(), type, exemptionsFor(application));
    }

    public ApplicationView view(String applicationId, Actor viewer) {
        Application application = load(applicationId);
        boolean related = application.isOwnedBy(viewer.id()) || application.hasAdvisor(viewer.id());
        if (!related && (viewer.role() == Role.STUDENT || viewer.role() == Role.PROFESSOR)) {
            throw new PermissionException(viewer.id(), viewer.role(),
                    viewer.role().getValue() + " " + viewer.id() + " may not view application " + applicationId);
        }
        return projector.project(application, viewer);
    }

    public Application get(String applicationId) {
        return load(applicationId);
    }

    private Application mutateDraft(String applicationId, Actor actor, String action,
                                    Function<Application, Application> change) {
        return withLock(applicationId, () -> {
            Application current = load(applicationId);
            if (!current.isOwnedBy(actor.id())) {
                throw new PermissionException(actor.id(), actor.role(),
                        actor.role().getValue() + " " + actor.id() + " may not " + action + " application " + applicationId);
            }
            if (!current.getStatus().isEditable()) {
                throw new IllegalTransitionException(applicationId, current.getStatus(), null, String.format(
                        "Application %s is %s and can no longer be edited", applicationId, current.getStatus().getValue()));
            }
            Application updated = change.apply(current.copy());
            return repository.save(updated, current.getVersion());
        });
    }

    private ReentrantLock lockFor(String applicationId) {
        return locks.computeIfAbsent(applicationId, id -> new ReentrantLock());
    }

    private Application withLock(String applicationId, LockedWrite write) {
        ReentrantLock lock = lockFor(applicationId);
        lock.lock();
        try {
            return write.run();
        } finally {
            lock.unlock();
        }
    }

    private void publish(TransitionEvent event) {
        for (TransitionListener listener : listeners) {
            try {
                listener.onTransition(event);
            } catch (RuntimeException e) {
                log.warn("Transition listener failed for application {} ({} -> {}): {}", event.applicationId(),
                        event.fromStatus().getValue(), event.toStatus().getValue(), e.getMessage(), e);
            }
        }
    }

    private Application load(String applicationId) {
        return repository.findById(applicationId)
                .orElseThrow(() -> new NotFoundException("Application", applicationId));
    }

    private ExemptionSet exemptionsFor(Application application) {
        return whitelistStore.exemptionsNow(application.getScholarshipTypeCode(), application.getStudentId());
    }

    private static void checkSubScholarship(ScholarshipType type, String subScholarshipCode) {
        if (subScholarshipCode == null) {
            return;
        }
        if (!type.isCombined()) {
            throw new ValidationException("sub_scholarship", "scholarship " + type.getCode() + " has no sub-scholarships");
        }
        if (type.findSubScholarship(subScholarshipCode).isEmpty()) {
            throw new ValidationException("sub_scholarship", "unknown sub-scholarship " + subScholarshipCode);
        }
    }

    @FunctionalInterface
    private interface LockedWrite {
        Application run();
    }
}
