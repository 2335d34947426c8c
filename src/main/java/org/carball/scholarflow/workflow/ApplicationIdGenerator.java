package org.carball.scholarflow.workflow;

import org.carball.scholarflow.config.WorkflowSettings;

import java.time.Clock;
import java.time.Year;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues ids of the form {@code APP-2025-000042}. The year is the calendar year in the configured
 * zone when the id is issued.
 */
public class ApplicationIdGenerator {

    private final AtomicLong sequence = new AtomicLong();
    private final WorkflowSettings settings;
    private final Clock clock;

    public ApplicationIdGenerator(WorkflowSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public String next() {
        int year = Year.now(clock.withZone(settings.zone())).getValue();
        return String.format("%s-%d-%06d", settings.getApplicationIdPrefix(), year, sequence.incrementAndGet());
    }
}
