package com.alphacheck.domain.enums;

/**
 * Classification of findings raised by the conservation checker.
 *
 * <p>PM_TO_MERGED and MERGED_TO_SPLIT are sum mismatches at a phase boundary.
 * ORPHANED_SPLIT = split volume for a (time, ticker) that has no merged input at all.
 * ALLOCATION_CARDINALITY = a merged group was split across an unexpected number of traders
 * (warning level only).
 */
public enum ConservationViolationType {
    PM_TO_MERGED,
    MERGED_TO_SPLIT,
    ORPHANED_SPLIT,
    ALLOCATION_CARDINALITY;

    public boolean isWarning() {
        return this == ALLOCATION_CARDINALITY;
    }
}
