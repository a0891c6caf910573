package com.alphacheck.domain.enums;

/**
 * Outcome of a single checker run.
 *
 * <p>FAIL = business-rule breach with diagnostics. WARN = reportable but non-fatal finding
 * (e.g. allocation cardinality). ERROR = the checker itself could not run (unexpected
 * exception or missing auxiliary data); sibling checkers are unaffected.
 */
public enum CheckStatus {
    PASS,
    FAIL,
    WARN,
    ERROR;

    /** FAIL and ERROR count against the run; PASS and WARN do not. */
    public boolean isCritical() {
        return this == FAIL || this == ERROR;
    }
}
