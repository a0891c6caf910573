package com.alphacheck.domain.model;

import com.alphacheck.domain.enums.CheckStatus;
import java.util.List;
import lombok.Getter;

/**
 * Outcome of one checker run.
 *
 * <p>The message is a one-line summary with exact counts. Detail lines are the full
 * diagnostic listing; they may be truncated per group but never change the counts.
 */
@Getter
public class CheckResult {

    private final String checkerName;
    private final CheckStatus status;
    private final String message;
    private final List<String> details;

    private CheckResult(String checkerName, CheckStatus status, String message, List<String> details) {
        this.checkerName = checkerName;
        this.status = status;
        this.message = message;
        this.details = details != null ? List.copyOf(details) : List.of();
    }

    public static CheckResult pass(String checkerName, String message) {
        return new CheckResult(checkerName, CheckStatus.PASS, message, null);
    }

    public static CheckResult fail(String checkerName, String message, List<String> details) {
        return new CheckResult(checkerName, CheckStatus.FAIL, message, details);
    }

    public static CheckResult warn(String checkerName, String message, List<String> details) {
        return new CheckResult(checkerName, CheckStatus.WARN, message, details);
    }

    public static CheckResult error(String checkerName, String message) {
        return new CheckResult(checkerName, CheckStatus.ERROR, message, null);
    }

    public boolean isPassed() {
        return status == CheckStatus.PASS;
    }

    public boolean hasDetails() {
        return !details.isEmpty();
    }

    @Override
    public String toString() {
        return checkerName + " [" + status + "]: " + message;
    }
}
