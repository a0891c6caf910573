package com.alphacheck.fillrate;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the per-trade fill table.
 *
 * <p>{@code fillRate} is NaN when the intended trade is within tolerance of zero. Such rows
 * stay in the table (they are real steps) but are excluded from every aggregate.
 */
@Value
@Builder
public class FillRecord {

    String participantId;
    String ticker;
    long timeFrom;

    /** Arrival bucket; every view filters and groups on it. */
    long timeTo;

    double targetVolume;
    double currentPosition;
    double nextPosition;
    double intendedTrade;
    double actualTrade;
    double fillRate;

    public boolean isAnalyzable() {
        return Double.isFinite(fillRate);
    }
}
