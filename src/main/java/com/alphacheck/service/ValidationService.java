package com.alphacheck.service;

import com.alphacheck.checker.Checker;
import com.alphacheck.checker.CheckerRegistry;
import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.event.ValidationCompletedEvent;
import com.alphacheck.exception.CheckerConfigurationException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs every registered checker against one dataset and assembles the report.
 *
 * <p>The dataset contract is checked first; a broken dataset raises before any checker
 * starts. Checkers then run concurrently on the checker pool, each behind its own exception
 * boundary: a misconfigured checker reports ERROR with its own message, any other
 * exception reports ERROR with {@code Checker failed: <message>}. Sibling checkers always
 * run to completion, and results keep registry order.
 */
@Service
public class ValidationService {

    private static final Logger log = LoggerFactory.getLogger(ValidationService.class);

    private final CheckerRegistry checkerRegistry;
    private final Executor checkerExecutor;
    private final ApplicationEventPublisher eventPublisher;

    public ValidationService(
            CheckerRegistry checkerRegistry,
            @Qualifier("checkerExecutor") Executor checkerExecutor,
            ApplicationEventPublisher eventPublisher) {
        this.checkerRegistry = checkerRegistry;
        this.checkerExecutor = checkerExecutor;
        this.eventPublisher = eventPublisher;
    }

    public ValidationReport run(ValidationDataset dataset) {
        dataset.requireComplete();

        List<Checker> checkers = checkerRegistry.getCheckers();
        log.info("Validation run started with {} checkers", checkers.size());
        LocalDateTime startedAt = LocalDateTime.now();
        long start = System.currentTimeMillis();

        List<CompletableFuture<CheckResult>> futures = checkers.stream()
                .map(checker -> CompletableFuture.supplyAsync(() -> runChecker(checker, dataset), checkerExecutor))
                .toList();
        List<CheckResult> results = futures.stream().map(CompletableFuture::join).toList();

        ValidationReport report =
                ValidationReport.of(results, dataset.summarize(), startedAt, System.currentTimeMillis() - start);
        if (report.isSuccess()) {
            log.info("Validation run finished in {}ms: {}", report.getDurationMs(), report.getSummaryLine());
        } else {
            log.warn(
                    "Validation run finished in {}ms: {} ({} failed, {} errors)",
                    report.getDurationMs(),
                    report.getSummaryLine(),
                    report.getFailed(),
                    report.getErrored());
        }

        eventPublisher.publishEvent(new ValidationCompletedEvent(this, report));
        return report;
    }

    CheckResult runChecker(Checker checker, ValidationDataset dataset) {
        long start = System.currentTimeMillis();
        try {
            CheckResult result = checker.check(dataset);
            log.debug(
                    "Checker '{}' finished in {}ms with {}",
                    checker.getName(),
                    System.currentTimeMillis() - start,
                    result.getStatus());
            return result;
        } catch (CheckerConfigurationException e) {
            log.warn("Checker '{}' cannot run: {}", checker.getName(), e.getMessage());
            return CheckResult.error(checker.getName(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Checker '{}' failed", checker.getName(), e);
            return CheckResult.error(checker.getName(), "Checker failed: " + e.getMessage());
        }
    }
}
