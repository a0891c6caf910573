package com.alphacheck.fillrate;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Typed payload behind an {@link AnalysisResult}. Which fields are set depends on the view:
 * overview fills best/worst and the histogram, by-time and by-ticker fill {@code groups},
 * deep fills {@code trades} and the totals.
 */
@Getter
@Builder
public class FillRateBreakdown {

    private final int totalTrades;
    private final int analyzableTrades;
    private final FillStatistics statistics;

    private final FillRecord best;
    private final FillRecord worst;
    private final FillRateHistogram histogram;

    private final List<FillRateGroup> groups;

    private final List<FillRecord> trades;
    private final Double totalIntended;
    private final Double totalActual;
    private final Double netFillRate;
}
