package org.carball.scholarflow.workflow;

import org.carball.scholarflow.model.application.Application;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for application aggregates. Implementations store the aggregate together with its
 * decisions and history in one write.
 */
public interface ApplicationRepository {

    Optional<Application> findById(String applicationId);

    Application insert(Application application);

    /**
     * Replaces the stored aggregate if its version still equals {@code expectedVersion}, and returns
     * the stored copy with the version incremented.
     *
     * @throws org.carball.scholarflow.exception.ConcurrentTransitionException on a version mismatch
     */
    Application save(Application application, long expectedVersion);

    List<Application> findByStudentAndType(String studentId, String scholarshipTypeCode);
}
