package com.alphacheck.observability;

import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.event.ValidationCompletedEvent;
import com.alphacheck.service.ValidationReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer metrics for validation runs.
 *
 * <ul>
 *   <li><b>validation.runs</b> (counter, tag {@code outcome=success|failure})</li>
 *   <li><b>validation.checks</b> (counter, tags {@code checker}, {@code status})</li>
 *   <li><b>validation.duration</b> (timer): wall time of a full run</li>
 * </ul>
 */
@Service
public class CustomMetricsService {

    private static final Logger log = LoggerFactory.getLogger(CustomMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Timer runDurationTimer;

    public CustomMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.runDurationTimer = Timer.builder("validation.duration")
                .description("Wall time of a full validation run")
                .register(meterRegistry);
    }

    @EventListener
    public void onValidationCompleted(ValidationCompletedEvent event) {
        ValidationReport report = event.getReport();
        runCounter(report.isSuccess() ? "success" : "failure").increment();
        for (CheckResult result : report.getResults()) {
            checkCounter(result).increment();
        }
        runDurationTimer.record(report.getDurationMs(), TimeUnit.MILLISECONDS);
        log.debug("Recorded metrics for run: {}", report.getSummaryLine());
    }

    Counter runCounter(String outcome) {
        return Counter.builder("validation.runs")
                .description("Completed validation runs")
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    private Counter checkCounter(CheckResult result) {
        return Counter.builder("validation.checks")
                .description("Checker results by status")
                .tag("checker", result.getCheckerName())
                .tag("status", result.getStatus().name())
                .register(meterRegistry);
    }
}
