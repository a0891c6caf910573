package com.alphacheck.fillrate;

import com.alphacheck.domain.enums.FillRateView;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Answer to one fill-rate view. {@code plotReference} is reserved for a rendering layer
 * and is always null here.
 */
@Getter
@Builder
public class AnalysisResult {

    private final String analyzerName;
    private final FillRateView view;
    private final String summary;
    private final String plotReference;

    @Builder.Default
    private final List<String> details = List.of();

    private final FillRateBreakdown breakdown;

    public boolean hasAnalyzableTrades() {
        return breakdown != null && breakdown.getAnalyzableTrades() > 0;
    }
}
