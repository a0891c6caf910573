package com.alphacheck.checker;

import com.alphacheck.domain.enums.ConservationViolationType;
import lombok.Builder;
import lombok.Getter;

/**
 * A single conservation finding for one (time, ticker) key.
 *
 * <p>{@code upstreamTotal}/{@code downstreamTotal} are the two sums compared at the phase
 * boundary. For allocation-cardinality findings they hold the expected and actual trader
 * counts instead.
 */
@Getter
@Builder
public class ConservationViolation {

    private final ConservationViolationType type;
    private final long time;
    private final String ticker;
    private final double upstreamTotal;
    private final double downstreamTotal;

    /** Free-form context, e.g. the PM breakdown behind a previous-close total. */
    private final String note;

    public double getDifference() {
        return upstreamTotal - downstreamTotal;
    }

    public String describe() {
        String at = "time=" + DetailLines.time(time) + ", ticker=" + ticker;
        String line = switch (type) {
            case PM_TO_MERGED -> "PM -> Merged violation at " + at
                    + ": pm_total=" + DetailLines.volume(upstreamTotal)
                    + ", merged_total=" + DetailLines.volume(downstreamTotal)
                    + ", diff=" + DetailLines.volume(getDifference());
            case MERGED_TO_SPLIT -> "Merged -> Split violation at " + at
                    + ": merged_total=" + DetailLines.volume(upstreamTotal)
                    + ", split_total=" + DetailLines.volume(downstreamTotal)
                    + ", diff=" + DetailLines.volume(getDifference());
            case ORPHANED_SPLIT -> "Orphaned split alpha at " + at
                    + ": split_total=" + DetailLines.volume(downstreamTotal)
                    + " has no corresponding merged target";
            case ALLOCATION_CARDINALITY -> "Allocation warning at " + at
                    + ": expected " + (long) upstreamTotal
                    + " traders, got " + (long) downstreamTotal;
        };
        return note != null ? line + " (" + note + ")" : line;
    }

    @Override
    public String toString() {
        return describe();
    }
}
