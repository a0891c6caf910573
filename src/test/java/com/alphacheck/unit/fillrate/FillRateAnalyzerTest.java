package com.alphacheck.unit.fillrate;

import static com.alphacheck.fixtures.DatasetBuilder.T1;
import static com.alphacheck.fixtures.DatasetBuilder.T2;
import static com.alphacheck.fixtures.DatasetBuilder.T3;
import static com.alphacheck.fixtures.DatasetBuilder.dataset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.alphacheck.checker.CheckerSettings;
import com.alphacheck.domain.enums.FillRateView;
import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.fillrate.AnalysisResult;
import com.alphacheck.fillrate.FillRateAnalyzer;
import com.alphacheck.fillrate.FillRateEngine;
import com.alphacheck.fillrate.FillRateQuery;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FillRateAnalyzerTest {

    private FillRateAnalyzer analyzer;
    private ValidationDataset dataset;

    @BeforeEach
    void setUp() {
        analyzer = new FillRateAnalyzer(new FillRateEngine(CheckerSettings.defaults()));
        // AAA fills 90% then holds, BBB fills 50%
        dataset = dataset()
                .split("S1", T1, "AAA", 1000)
                .split("S2", T1, "BBB", 500)
                .split("S1", T2, "AAA", 900)
                .split("S1", T3, "AAA", 900)
                .position("S1", T1, "AAA", 0)
                .position("S2", T1, "BBB", 0)
                .position("S1", T2, "AAA", 900)
                .position("S2", T2, "BBB", 250)
                .position("S1", T3, "AAA", 900)
                .build();
    }

    @Test
    @DisplayName("Overview counts zero-intent rows but excludes them from aggregates")
    void overview() {
        AnalysisResult result = analyzer.analyze(dataset, FillRateQuery.overview());

        assertThat(result.getAnalyzerName()).isEqualTo("Fill Rate Analysis");
        assertThat(result.getView()).isEqualTo(FillRateView.OVERVIEW);
        assertThat(result.getSummary()).isEqualTo("Total trades: 3 | Analyzable: 2 | Mean fill rate: 0.700");
        assertThat(result.getDetails())
                .containsExactly("Best performer: AAA (0.900)", "Worst performer: BBB (0.500)", "Std fill rate: 0.283");
        assertThat(result.getBreakdown().getHistogram().getTotal()).isEqualTo(2);
        assertThat(result.getPlotReference()).isNull();
    }

    @Test
    @DisplayName("By-time view filters on the arrival bucket")
    void byTime() {
        AnalysisResult result = analyzer.analyze(dataset, FillRateQuery.byTime(T2));

        assertThat(result.getSummary()).isEqualTo("time=93100000 (9:31): 2 tickers analyzed | Overall mean: 0.700");
        assertThat(result.getDetails()).contains("  AAA: 0.900 (1 trade)", "  BBB: 0.500 (1 trade)");
    }

    @Test
    @DisplayName("Nothing arrives at the first bucket")
    void byTimeFirstBucketIsEmpty() {
        AnalysisResult result = analyzer.analyze(dataset, FillRateQuery.byTime(T1));

        assertThat(result.hasAnalyzableTrades()).isFalse();
        assertThat(result.getSummary()).isEqualTo("No analyzable trades found for time=93000000 (9:30)");
    }

    @Test
    @DisplayName("By-ticker view groups by arrival bucket and skips NaN steps")
    void byTicker() {
        AnalysisResult result = analyzer.analyze(dataset, FillRateQuery.byTicker("AAA"));

        assertThat(result.getSummary()).isEqualTo("ticker=AAA: 1 time periods | Overall mean: 0.900");
        assertThat(result.getBreakdown().getTotalTrades()).isEqualTo(2);
        assertThat(result.getBreakdown().getGroups()).singleElement()
                .satisfies(group -> assertThat(group.getKey()).isEqualTo("93100000 (9:31)"));
    }

    @Test
    @DisplayName("Deep view of a single trade has net rate equal to its fill rate")
    void deepSingleTrade() {
        AnalysisResult result = analyzer.analyze(dataset, FillRateQuery.deep(T2, "AAA"));

        assertThat(result.getSummary()).isEqualTo("time=93100000 (9:31), ticker=AAA: 1 trades | Net fill rate: 0.900");
        assertThat(result.getBreakdown().getNetFillRate()).isCloseTo(0.9, within(1e-12));
        assertThat(result.getBreakdown().getTotalIntended()).isEqualTo(1000.0);
        assertThat(result.getDetails()).contains("  S1: intended=1000, actual=900, fill_rate=0.900");
    }

    @Test
    @DisplayName("Several queries are answered from one fill table")
    void analyzeAll() {
        List<AnalysisResult> results = analyzer.analyzeAll(
                dataset, List.of(FillRateQuery.overview(), FillRateQuery.byTicker("BBB")));

        assertThat(results).extracting(AnalysisResult::getView)
                .containsExactly(FillRateView.OVERVIEW, FillRateView.BY_TICKER);
        assertThat(results.get(1).getSummary()).isEqualTo("ticker=BBB: 1 time periods | Overall mean: 0.500");
    }

    @Test
    @DisplayName("Overview of a dataset with no steps reports no analyzable trades")
    void emptyOverview() {
        AnalysisResult result = analyzer.analyze(dataset().build(), FillRateQuery.overview());

        assertThat(result.getSummary()).isEqualTo("No analyzable trades found");
        assertThat(result.hasAnalyzableTrades()).isFalse();
    }
}
