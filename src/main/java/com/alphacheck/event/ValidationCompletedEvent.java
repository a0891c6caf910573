package com.alphacheck.event;

import com.alphacheck.service.ValidationReport;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every validation run, whatever its outcome.
 *
 * <p>Listeners: CustomMetricsService (run and per-checker counters).
 */
public class ValidationCompletedEvent extends ApplicationEvent {

    private final ValidationReport report;
    private final LocalDateTime completedAt;

    public ValidationCompletedEvent(Object source, ValidationReport report) {
        super(source);
        this.report = report;
        this.completedAt = LocalDateTime.now();
    }

    public ValidationReport getReport() {
        return report;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }
}
