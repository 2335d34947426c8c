package org.carball.scholarflow.workflow;

import org.carball.scholarflow.catalog.UsageProbe;
import org.carball.scholarflow.exception.ConcurrentTransitionException;
import org.carball.scholarflow.exception.NotFoundException;
import org.carball.scholarflow.exception.ValidationException;
import org.carball.scholarflow.model.application.Application;
import org.carball.scholarflow.model.application.ApplicationStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryApplicationRepository implements ApplicationRepository, UsageProbe {

    private final Map<String, Application> applications = new ConcurrentHashMap<>();

    @Override
    public Optional<Application> findById(String applicationId) {
        return Optional.ofNullable(applications.get(applicationId)).map(Application::copy);
    }

    @Override
    public Application insert(Application application) {
        Application stored = application.copy();
        if (applications.putIfAbsent(stored.getId(), stored) != null) {
            throw new ValidationException("id", "application " + stored.getId() + " already exists");
        }
        return stored.copy();
    }

    @Override
    public Application save(Application application, long expectedVersion) {
        Application stored = applications.compute(application.getId(), (id, existing) -> {
            if (existing == null) {
                throw new NotFoundException("Application", id);
            }
            if (existing.getVersion() != expectedVersion) {
                throw new ConcurrentTransitionException(id, expectedVersion, existing.getVersion());
            }
            Application next = application.copy();
            next.setVersion(expectedVersion + 1);
            return next;
        });
        return stored.copy();
    }

    @Override
    public List<Application> findByStudentAndType(String studentId, String scholarshipTypeCode) {
        return applications.values().stream()
                .filter(a -> a.getStudentId().equals(studentId))
                .filter(a -> a.getScholarshipTypeCode().equals(scholarshipTypeCode))
                .map(Application::copy)
                .collect(Collectors.toList());
    }

    @Override
    public boolean hasApplications(String scholarshipTypeCode) {
        return applications.values().stream()
                .anyMatch(a -> a.getScholarshipTypeCode().equals(scholarshipTypeCode));
    }

    @Override
    public boolean isFieldInUse(String scholarshipTypeCode, String fieldName) {
        return live(scholarshipTypeCode).stream()
                .anyMatch(a -> {
                    String value = a.getFieldValues().get(fieldName);
                    return value != null && !value.isBlank();
                });
    }

    @Override
    public boolean isDocumentInUse(String scholarshipTypeCode, String documentName) {
        return live(scholarshipTypeCode).stream()
                .anyMatch(a -> a.documentCount(documentName) > 0);
    }

    private List<Application> live(String scholarshipTypeCode) {
        return applications.values().stream()
                .filter(a -> a.getScholarshipTypeCode().equals(scholarshipTypeCode))
                .filter(a -> a.getStatus() != ApplicationStatus.WITHDRAWN)
                .collect(Collectors.toList());
    }
}
