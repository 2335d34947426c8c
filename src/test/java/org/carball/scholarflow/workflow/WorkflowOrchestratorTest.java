package org.carball.scholarflow.workflow;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.scholarflow.WorkflowFixtures;
import org.carball.scholarflow.WorkflowHarness;
import org.carball.scholarflow.exception.DuplicateApplicationException;
import org.carball.scholarflow.exception.EligibilityException;
import org.carball.scholarflow.exception.IllegalTransitionException;
import org.carball.scholarflow.exception.IncompleteSubmissionException;
import org.carball.scholarflow.exception.PermissionException;
import org.carball.scholarflow.exception.ValidationException;
import org.carball.scholarflow.model.application.AcademicRecord;
import org.carball.scholarflow.model.application.Actor;
import org.carball.scholarflow.model.application.Application;
import org.carball.scholarflow.model.application.ApplicationStatus;
import org.carball.scholarflow.model.application.Intent;
import org.carball.scholarflow.model.application.ReviewDecision;
import org.carball.scholarflow.model.application.ReviewStage;
import org.carball.scholarflow.model.application.StatusChange;
import org.carball.scholarflow.model.application.TransitionRequest;
import org.carball.scholarflow.model.application.Verdict;
import org.carball.scholarflow.model.eligibility.EligibilityReport;
import org.carball.scholarflow.model.eligibility.RuleOutcome;
import org.carball.scholarflow.model.eligibility.RuleResult;
import org.carball.scholarflow.model.schema.MissingItem;
import org.carball.scholarflow.model.whitelist.WhitelistEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;
import static org.carball.scholarflow.WorkflowFixtures.DOCTORAL;
import static org.carball.scholarflow.WorkflowFixtures.ENROLLED_RULE_ID;
import static org.carball.scholarflow.WorkflowFixtures.FRESHMAN;
import static org.carball.scholarflow.WorkflowFixtures.GPA_RULE_ID;
import static org.carball.scholarflow.WorkflowFixtures.MOE;
import static org.carball.scholarflow.WorkflowFixtures.MOST;
import static org.carball.scholarflow.WorkflowFixtures.MOST_GPA_RULE_ID;
import static org.carball.scholarflow.WorkflowFixtures.TRANSCRIPT;
import static org.carball.scholarflow.WorkflowFixtures.record;

public class WorkflowOrchestratorTest {

    private WorkflowHarness harness;
    private WorkflowOrchestrator orchestrator;
    private final Actor student = Actor.student("s1001");

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        harness = new WorkflowHarness();
        orchestrator = harness.orchestrator;

        logger = (Logger) LoggerFactory.getLogger(WorkflowOrchestrator.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldRejectSubmissionWhenHardRuleFails() {
        // Given
        Application draft = completeFreshmanDraft(student, "3.20");

        // When
        EligibilityException error = catchThrowableOfType(
                () -> orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.SUBMIT, student)),
                EligibilityException.class);

        // Then
        assertThat(error.getFailedRules())
                .extracting(RuleResult::ruleId, RuleResult::outcome)
                .containsExactly(tuple(GPA_RULE_ID, RuleOutcome.FAILED));

        Application stored = orchestrator.get(draft.getId());
        assertThat(stored.getStatus()).isEqualTo(ApplicationStatus.DRAFT);
        assertThat(stored.getVersion()).isEqualTo(draft.getVersion());
        assertThat(stored.getHistory()).isEmpty();
    }

    @Test
    void shouldSubmitWhenFailedRuleIsWhitelisted() {
        // Given
        Application draft = completeFreshmanDraft(student, "3.20");
        harness.whitelist.grant(harness.admin, FRESHMAN, student.id(), Set.of(GPA_RULE_ID),
                "Transfer student, GPA computed on a different scale");

        // When
        Application submitted = orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.SUBMIT, student));

        // Then
        assertThat(submitted.getStatus()).isEqualTo(ApplicationStatus.SUBMITTED);
        assertThat(submitted.getEligibilityAudit().exempted())
                .extracting(RuleResult::ruleId, RuleResult::outcome)
                .containsExactly(tuple(GPA_RULE_ID, RuleOutcome.PASSED_BY_EXEMPTION));
    }

    @Test
    void shouldReportMissingDocumentBeforeEvaluatingEligibility() {
        // Given: failing GPA and no transcript attached
        Application draft = orchestrator.createApplication(student, FRESHMAN, null, record("3.20"), Set.of());
        orchestrator.updateDraft(draft.getId(), student, Map.of("bank_account", "0123456789"), null);

        // When
        IncompleteSubmissionException error = catchThrowableOfType(
                () -> orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.SUBMIT, student)),
                IncompleteSubmissionException.class);

        // Then
        assertThat(error.getMissingItems()).containsExactly(MissingItem.document(TRANSCRIPT));
        assertThat(orchestrator.get(draft.getId()).getStatus()).isEqualTo(ApplicationStatus.DRAFT);
    }

    @Test
    void shouldReportEveryMissingItemAtOnce() {
        // Given
        Application draft = orchestrator.createApplication(student, FRESHMAN, null, record("3.90"), Set.of());

        // When / Then
        assertThatThrownBy(() -> orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.SUBMIT, student)))
                .isInstanceOf(IncompleteSubmissionException.class)
                .satisfies(e -> assertThat(((IncompleteSubmissionException) e).getMissingItems())
                        .containsExactly(MissingItem.field("bank_account"), MissingItem.document(TRANSCRIPT)));
    }

    @Test
    void shouldNotApproveWhileCollegeReviewIsPending() {
        // Given: advisor has recommended, college has not acted
        Application application = doctoralInCollegeReview();

        // When / Then
        assertThatThrownBy(() -> orchestrator.handle(
                TransitionRequest.of(application.getId(), Intent.APPROVE, harness.admin)))
                .isInstanceOf(IllegalTransitionException.class)
                .hasMessageContaining("college_review=pending");

        assertThat(orchestrator.get(application.getId()).getStatus()).isEqualTo(ApplicationStatus.COLLEGE_REVIEW);
    }

    @Test
    void shouldApproveOnceEveryRequiredStageApproves() {
        // Given
        Application application = doctoralInCollegeReview();

        // When
        Application afterCollege = orchestrator.handle(
                TransitionRequest.of(application.getId(), Intent.APPROVE, harness.college, "Strong research record"));
        Application approved = orchestrator.handle(
                TransitionRequest.of(application.getId(), Intent.APPROVE, harness.admin));

        // Then
        assertThat(afterCollege.getStatus()).isEqualTo(ApplicationStatus.COLLEGE_REVIEW);
        assertThat(approved.getStatus()).isEqualTo(ApplicationStatus.APPROVED);
        assertThat(approved.getDecisions())
                .extracting(ReviewDecision::stage, ReviewDecision::verdict)
                .containsExactly(
                        tuple(ReviewStage.PROFESSOR_RECOMMENDATION, Verdict.APPROVE),
                        tuple(ReviewStage.COLLEGE_REVIEW, Verdict.APPROVE),
                        tuple(ReviewStage.COMMITTEE_DECISION, Verdict.APPROVE));
        assertThat(approved.getStatusTimestamps()).containsKeys(
                ApplicationStatus.SUBMITTED, ApplicationStatus.RECOMMENDED, ApplicationStatus.APPROVED);
    }

    @Test
    void shouldLetExactlyOneConcurrentWithdrawSucceed() throws Exception {
        // Given
        Application submitted = submittedFreshman(student);
        CountDownLatch start = new CountDownLatch(1);
        Callable<Application> withdraw = () -> {
            start.await();
            return orchestrator.handle(TransitionRequest.of(submitted.getId(), Intent.WITHDRAW, student));
        };

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Application> first = executor.submit(withdraw);
            Future<Application> second = executor.submit(withdraw);

            // When
            start.countDown();
            List<Object> outcomes = new ArrayList<>();
            for (Future<Application> future : List.of(first, second)) {
                try {
                    outcomes.add(future.get(5, TimeUnit.SECONDS));
                } catch (java.util.concurrent.ExecutionException e) {
                    outcomes.add(e.getCause());
                }
            }

            // Then
            assertThat(outcomes).filteredOn(o -> o instanceof Application).hasSize(1);
            assertThat(outcomes).filteredOn(o -> o instanceof IllegalTransitionException).hasSize(1);
        } finally {
            executor.shutdownNow();
        }

        Application stored = orchestrator.get(submitted.getId());
        assertThat(stored.getStatus()).isEqualTo(ApplicationStatus.WITHDRAWN);
        assertThat(stored.getHistory())
                .filteredOn(change -> change.to() == ApplicationStatus.WITHDRAWN)
                .hasSize(1);
    }

    @Test
    void shouldCheckTransitionExistsBeforeRole() {
        // Given
        Application draft = completeFreshmanDraft(student, "3.90");

        // When / Then: no approve from draft at all, even for the wrong role
        assertThatThrownBy(() -> orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.APPROVE, student)))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    void shouldRejectSubmissionByAnotherStudent() {
        // Given
        Application draft = completeFreshmanDraft(student, "3.90");

        // When / Then
        assertThatThrownBy(() -> orchestrator.handle(
                TransitionRequest.of(draft.getId(), Intent.SUBMIT, Actor.student("s9999"))))
                .isInstanceOf(PermissionException.class)
                .hasMessageContaining("not the owner");
    }

    @Test
    void shouldRejectRecommendationFromUnassignedProfessor() {
        // Given
        Application application = doctoralPendingRecommendation();

        // When / Then
        assertThatThrownBy(() -> orchestrator.handle(
                TransitionRequest.of(application.getId(), Intent.RECOMMEND, Actor.professor("prof-other"))))
                .isInstanceOf(PermissionException.class);
        assertThatThrownBy(() -> orchestrator.handle(
                TransitionRequest.of(application.getId(), Intent.RECOMMEND, harness.college)))
                .isInstanceOf(PermissionException.class);
    }

    @Test
    void shouldRejectApplicationWhenAdvisorDeclines() {
        // Given
        Application application = doctoralPendingRecommendation();

        // When
        Application declined = orchestrator.handle(TransitionRequest.of(
                application.getId(), Intent.DECLINE, harness.advisor, "Research plan is not feasible"));

        // Then
        assertThat(declined.getStatus()).isEqualTo(ApplicationStatus.REJECTED);
        assertThat(declined.getStatus().isTerminal()).isTrue();
    }

    @Test
    void shouldRejectSubmissionOutsideApplicationWindow() {
        // Given
        Application draft = completeFreshmanDraft(student, "3.90");
        harness.clock.set(Instant.parse("2025-07-15T00:00:00Z"));

        // When / Then
        assertThatThrownBy(() -> orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.SUBMIT, student)))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getViolations()).containsKey("application_window"));
        assertThat(orchestrator.get(draft.getId()).getStatus()).isEqualTo(ApplicationStatus.DRAFT);
    }

    @Test
    void shouldAttachWarningsWithoutBlockingSubmission() {
        // Given: ranking outside the warning threshold
        Application draft = orchestrator.createApplication(student, FRESHMAN, null,
                record("3.90").toBuilder().classRankingPercent(new BigDecimal("48")).build(), Set.of());
        orchestrator.updateDraft(draft.getId(), student, Map.of("bank_account", "0123456789"), null);
        orchestrator.attachDocument(draft.getId(), student, TRANSCRIPT, "files/transcript.pdf");

        // When
        Application submitted = orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.SUBMIT, student));

        // Then
        assertThat(submitted.getStatus()).isEqualTo(ApplicationStatus.SUBMITTED);
        assertThat(submitted.getWarnings())
                .extracting(RuleResult::ruleName, RuleResult::outcome)
                .containsExactly(tuple("Class ranking", RuleOutcome.WARNING));
    }

    @Test
    void shouldReturnToDraftAndDiscardDecisionsOfPreviousCycle() {
        // Given: college approved, then returned for revision
        Application application = freshmanInCollegeReview(student);
        orchestrator.handle(TransitionRequest.of(application.getId(), Intent.APPROVE, harness.college));
        Application returned = orchestrator.handle(TransitionRequest.of(
                application.getId(), Intent.RETURN, harness.admin, "Bank account belongs to a parent"));

        assertThat(returned.getStatus()).isEqualTo(ApplicationStatus.DRAFT);
        assertThat(returned.getReviewCycle()).isEqualTo(1);

        // When: the student fixes the draft and it goes back to college review
        orchestrator.updateDraft(application.getId(), student, Map.of("bank_account", "9876543210"), null);
        orchestrator.handle(TransitionRequest.of(application.getId(), Intent.SUBMIT, student));
        orchestrator.handle(TransitionRequest.of(application.getId(), Intent.START_REVIEW, harness.admin));
        orchestrator.handle(TransitionRequest.of(application.getId(), Intent.FORWARD, harness.admin));

        // Then: the approval from the first cycle no longer counts
        assertThatThrownBy(() -> orchestrator.handle(
                TransitionRequest.of(application.getId(), Intent.APPROVE, harness.admin)))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    void shouldKeepTransitionWhenListenerFails() {
        // Given
        List<TransitionEvent> received = Collections.synchronizedList(new ArrayList<>());
        orchestrator.addListener(event -> {
            throw new IllegalStateException("mail server down");
        });
        orchestrator.addListener(received::add);
        Application draft = completeFreshmanDraft(student, "3.90");

        // When
        Application submitted = orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.SUBMIT, student));

        // Then
        assertThat(submitted.getStatus()).isEqualTo(ApplicationStatus.SUBMITTED);
        assertThat(orchestrator.get(draft.getId()).getStatus()).isEqualTo(ApplicationStatus.SUBMITTED);
        assertThat(received).singleElement().satisfies(event -> {
            assertThat(event.fromStatus()).isEqualTo(ApplicationStatus.DRAFT);
            assertThat(event.toStatus()).isEqualTo(ApplicationStatus.SUBMITTED);
            assertThat(event.actorId()).isEqualTo(student.id());
        });
        assertThat(logAppender.list.stream().anyMatch(log ->
                log.getLevel() == Level.WARN &&
                log.getFormattedMessage().contains("Transition listener failed")))
                .isTrue();
    }

    @Test
    void shouldLimitOpenApplicationsPerStudent() {
        // Given
        Application first = orchestrator.createApplication(student, FRESHMAN, null, record("3.90"), Set.of());

        // When / Then
        assertThatThrownBy(() -> orchestrator.createApplication(student, FRESHMAN, null, record("3.90"), Set.of()))
                .isInstanceOf(DuplicateApplicationException.class);

        orchestrator.handle(TransitionRequest.of(first.getId(), Intent.WITHDRAW, student));
        Application second = orchestrator.createApplication(student, FRESHMAN, null, record("3.90"), Set.of());
        assertThat(second.getId()).isNotEqualTo(first.getId()).startsWith("APP-2025-");
    }

    @Test
    void shouldRejectEditsOutsideDraft() {
        // Given
        Application submitted = submittedFreshman(student);

        // When / Then
        assertThatThrownBy(() -> orchestrator.updateDraft(submitted.getId(), student, Map.of("bank_account", "1"), null))
                .isInstanceOf(IllegalTransitionException.class)
                .hasMessageContaining("can no longer be edited");
        assertThatThrownBy(() -> orchestrator.attachDocument(submitted.getId(), student, TRANSCRIPT, "late.pdf"))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    void shouldValidateDraftValuesAgainstSchema() {
        // Given
        Application draft = orchestrator.createApplication(student, FRESHMAN, null, record("3.90"), Set.of());

        // When / Then
        assertThatThrownBy(() -> orchestrator.updateDraft(draft.getId(), student, Map.of("favourite_colour", "blue"), null))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getViolations())
                        .containsEntry("favourite_colour", "unknown field"));
        assertThatThrownBy(() -> orchestrator.updateDraft(draft.getId(), Actor.student("s9999"),
                Map.of("bank_account", "1"), null))
                .isInstanceOf(PermissionException.class);
    }

    @Test
    void shouldLimitAttachmentsToMaxFileCount() {
        // Given
        Application draft = orchestrator.createApplication(student, FRESHMAN, null, record("3.90"), Set.of());
        orchestrator.attachDocument(draft.getId(), student, TRANSCRIPT, "files/transcript.pdf");

        // When / Then
        assertThatThrownBy(() -> orchestrator.attachDocument(draft.getId(), student, TRANSCRIPT, "files/again.pdf"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("at most 1");

        Application detached = orchestrator.detachDocument(draft.getId(), student, "files/transcript.pdf");
        assertThat(detached.getDocuments()).isEmpty();
    }

    @Test
    void shouldRequireSubScholarshipForCombinedType() {
        // Given
        Application draft = orchestrator.createApplication(student, DOCTORAL, null, record("3.90"), Set.of("prof-1"));
        orchestrator.updateDraft(draft.getId(), student, Map.of("research_topic", "Graph neural networks"), null);

        // When / Then
        assertThatThrownBy(() -> orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.SUBMIT, student)))
                .isInstanceOf(IncompleteSubmissionException.class)
                .satisfies(e -> assertThat(((IncompleteSubmissionException) e).getMissingItems())
                        .containsExactly(MissingItem.subScholarship()));
    }

    @Test
    void shouldTagFailureWhenExemptionWasRevoked() {
        // Given
        Application draft = completeFreshmanDraft(student, "3.20");
        WhitelistEntry entry = harness.whitelist.grant(harness.admin, FRESHMAN, student.id(), Set.of(GPA_RULE_ID),
                "Pending transcript correction");
        harness.clock.advance(Duration.ofHours(1));
        harness.whitelist.revoke(harness.admin, entry.getEntryId(), "Correction did not arrive");
        harness.clock.advance(Duration.ofHours(1));

        // When
        EligibilityException error = catchThrowableOfType(
                () -> orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.SUBMIT, student)),
                EligibilityException.class);

        // Then
        assertThat(error.getFailedRules())
                .extracting(RuleResult::outcome)
                .containsExactly(RuleOutcome.FAILED_EXEMPTION_REVOKED);
    }

    @Test
    void shouldIncrementVersionOnEveryWrite() {
        // Given
        Application created = orchestrator.createApplication(student, FRESHMAN, null, record("3.90"), Set.of());

        // When
        Application edited = orchestrator.updateDraft(created.getId(), student, Map.of("bank_account", "0123456789"), null);
        Application attached = orchestrator.attachDocument(created.getId(), student, TRANSCRIPT, "files/t.pdf");
        Application submitted = orchestrator.handle(TransitionRequest.of(created.getId(), Intent.SUBMIT, student));

        // Then
        assertThat(List.of(created.getVersion(), edited.getVersion(), attached.getVersion(), submitted.getVersion()))
                .containsExactly(0L, 1L, 2L, 3L);
        assertThat(submitted.getHistory())
                .extracting(StatusChange::from, StatusChange::to)
                .containsExactly(tuple(ApplicationStatus.DRAFT, ApplicationStatus.SUBMITTED));
    }

    @Test
    void shouldPreviewEligibleSubScholarships() {
        // Given: GPA between the MOE and MOST floors
        Application draft = orchestrator.createApplication(student, DOCTORAL, MOST, record("3.60"), Set.of("prof-1"));

        // When
        List<String> eligible = orchestrator.eligibleSubScholarships(draft.getId());

        // Then
        assertThat(eligible).containsExactly(MOE);
        assertThat(orchestrator.previewEligibility(draft.getId()).isEligible()).isFalse();
    }

    @Test
    void shouldRouteDirectlyToCollegeReviewWithoutProfessorGate() {
        // Given
        Application submitted = submittedFreshman(student);
        orchestrator.handle(TransitionRequest.of(submitted.getId(), Intent.START_REVIEW, harness.college));

        // When
        Application forwarded = orchestrator.handle(TransitionRequest.of(submitted.getId(), Intent.FORWARD, harness.admin));

        // Then
        assertThat(forwarded.getStatus()).isEqualTo(ApplicationStatus.COLLEGE_REVIEW);
    }

    @Test
    void shouldAssignAdvisorWhileUnderReview() {
        // Given
        Application draft = orchestrator.createApplication(student, DOCTORAL, MOST, record("3.90"), Set.of("prof-1"));
        orchestrator.updateDraft(draft.getId(), student, Map.of("research_topic", "Graph neural networks"), null);
        orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.SUBMIT, student));
        orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.START_REVIEW, harness.admin));

        // When
        Application updated = orchestrator.assignAdvisor(draft.getId(), harness.admin, "prof-2");

        // Then
        assertThat(updated.getStatus()).isEqualTo(ApplicationStatus.UNDER_REVIEW);
        assertThat(updated.getAdvisorIds()).containsExactly("prof-1", "prof-2");
    }

    @Test
    void shouldNotChangeAdvisorsOnceProfessorStageHasOpened() {
        // Given: prof-1 has recommended and the application sits in college review
        Application application = doctoralInCollegeReview();

        // When / Then
        assertThatThrownBy(() -> orchestrator.assignAdvisor(application.getId(), student, "prof-2"))
                .isInstanceOf(IllegalTransitionException.class)
                .hasMessageContaining("advisors can no longer change");
        assertThatThrownBy(() -> orchestrator.assignAdvisor(application.getId(), harness.admin, "prof-2"))
                .isInstanceOf(IllegalTransitionException.class);

        // Then: the approved professor stage still counts toward final approval
        orchestrator.handle(TransitionRequest.of(application.getId(), Intent.APPROVE, harness.college));
        Application approved = orchestrator.handle(TransitionRequest.of(application.getId(), Intent.APPROVE, harness.admin));
        assertThat(approved.getStatus()).isEqualTo(ApplicationStatus.APPROVED);
        assertThat(approved.getAdvisorIds()).containsExactly("prof-1");
    }

    @Test
    void shouldNotChangeAdvisorsWhileRecommendationIsPending() {
        // Given
        Application pending = doctoralPendingRecommendation();

        // When / Then
        assertThatThrownBy(() -> orchestrator.assignAdvisor(pending.getId(), student, "prof-2"))
                .isInstanceOf(IllegalTransitionException.class);
        assertThat(orchestrator.get(pending.getId()).getVersion()).isEqualTo(pending.getVersion());
    }

    @Test
    void shouldTreatMissingAdvisorListAsEmpty() {
        // When
        Application draft = orchestrator.createApplication(student, FRESHMAN, null, record("3.90"), null);

        // Then
        assertThat(draft.getAdvisorIds()).isEmpty();
    }

    @Test
    void shouldLimitExemptionToGrantedStudentTypeAndRule() {
        // Given: s1001 is exempted from the MOST GPA floor of the doctoral scholarship only
        String jointDoctoral = "doctoral_joint";
        harness.catalog.register(WorkflowFixtures.doctoral().toBuilder().code(jointDoctoral).build());
        harness.whitelist.grant(harness.admin, DOCTORAL, student.id(), Set.of(MOST_GPA_RULE_ID),
                "Joint supervision abroad, GPA not yet transferred");
        Actor classmate = Actor.student("s1002");

        AcademicRecord suspended = record("3.00").toBuilder().enrollmentStatus("suspended").build();
        Application own = orchestrator.createApplication(student, DOCTORAL, MOST, suspended, Set.of("prof-1"));
        Application classmates = orchestrator.createApplication(classmate, DOCTORAL, MOST, record("3.00"), Set.of("prof-1"));
        Application otherType = orchestrator.createApplication(student, jointDoctoral, MOST, record("3.00"), Set.of("prof-1"));

        // When
        EligibilityReport ownReport = orchestrator.previewEligibility(own.getId());
        EligibilityReport classmateReport = orchestrator.previewEligibility(classmates.getId());
        EligibilityReport otherTypeReport = orchestrator.previewEligibility(otherType.getId());

        // Then
        assertThat(ownReport.exempted()).extracting(RuleResult::ruleId).containsExactly(MOST_GPA_RULE_ID);
        assertThat(ownReport.failed())
                .extracting(RuleResult::ruleId, RuleResult::outcome)
                .containsExactly(tuple(ENROLLED_RULE_ID, RuleOutcome.FAILED));
        assertThat(classmateReport.failed())
                .extracting(RuleResult::ruleId, RuleResult::outcome)
                .containsExactly(tuple(MOST_GPA_RULE_ID, RuleOutcome.FAILED));
        assertThat(otherTypeReport.exempted()).isEmpty();
        assertThat(otherTypeReport.failed())
                .extracting(RuleResult::ruleId, RuleResult::outcome)
                .containsExactly(tuple(MOST_GPA_RULE_ID, RuleOutcome.FAILED));
    }

    private Application completeFreshmanDraft(Actor owner, String gpa) {
        Application draft = orchestrator.createApplication(owner, FRESHMAN, null, record(gpa), Set.of());
        orchestrator.updateDraft(draft.getId(), owner, Map.of("bank_account", "0123456789"), null);
        return orchestrator.attachDocument(draft.getId(), owner, TRANSCRIPT, "files/transcript.pdf");
    }

    private Application submittedFreshman(Actor owner) {
        Application draft = completeFreshmanDraft(owner, "3.90");
        return orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.SUBMIT, owner));
    }

    private Application freshmanInCollegeReview(Actor owner) {
        Application submitted = submittedFreshman(owner);
        orchestrator.handle(TransitionRequest.of(submitted.getId(), Intent.START_REVIEW, harness.admin));
        return orchestrator.handle(TransitionRequest.of(submitted.getId(), Intent.FORWARD, harness.admin));
    }

    private Application doctoralPendingRecommendation() {
        Application draft = orchestrator.createApplication(student, DOCTORAL, MOST, record("3.90"), Set.of("prof-1"));
        orchestrator.updateDraft(draft.getId(), student, Map.of("research_topic", "Graph neural networks"), null);
        orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.SUBMIT, student));
        orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.START_REVIEW, harness.admin));
        Application pending = orchestrator.handle(TransitionRequest.of(draft.getId(), Intent.FORWARD, harness.admin));
        assertThat(pending.getStatus()).isEqualTo(ApplicationStatus.PENDING_RECOMMENDATION);
        return pending;
    }

    private Application doctoralInCollegeReview() {
        Application pending = doctoralPendingRecommendation();
        Application recommended = orchestrator.handle(TransitionRequest.of(
                pending.getId(), Intent.RECOMMEND, harness.advisor, "Excellent candidate"));
        assertThat(recommended.getStatus()).isEqualTo(ApplicationStatus.RECOMMENDED);
        return orchestrator.handle(TransitionRequest.of(pending.getId(), Intent.FORWARD, harness.admin));
    }
}
