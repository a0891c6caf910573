package com.alphacheck.service;

import com.alphacheck.domain.enums.CheckStatus;
import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.domain.model.DatasetSummary;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * All checker results of one run, in registry order, with per-status counts.
 *
 * <p>A run is successful when no checker returned FAIL or ERROR; WARN does not fail a run.
 */
@Getter
@Builder
public class ValidationReport {

    private final LocalDateTime startedAt;
    private final long durationMs;
    private final DatasetSummary dataSummary;
    private final List<CheckResult> results;

    public static ValidationReport of(
            List<CheckResult> results, DatasetSummary dataSummary, LocalDateTime startedAt, long durationMs) {
        return ValidationReport.builder()
                .results(List.copyOf(results))
                .dataSummary(dataSummary)
                .startedAt(startedAt)
                .durationMs(durationMs)
                .build();
    }

    public int getTotal() {
        return results.size();
    }

    public int getPassed() {
        return count(CheckStatus.PASS);
    }

    public int getFailed() {
        return count(CheckStatus.FAIL);
    }

    public int getWarned() {
        return count(CheckStatus.WARN);
    }

    public int getErrored() {
        return count(CheckStatus.ERROR);
    }

    public boolean isSuccess() {
        return getFailed() == 0 && getErrored() == 0;
    }

    public String getSummaryLine() {
        return getPassed() + " of " + getTotal() + " checkers passed";
    }

    private int count(CheckStatus status) {
        return (int) results.stream().filter(r -> r.getStatus() == status).count();
    }
}
