package com.alphacheck.fillrate;

import com.alphacheck.checker.DetailLines;
import com.alphacheck.domain.enums.FillRateView;
import com.alphacheck.domain.model.ValidationDataset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answers fill-rate views over a dataset.
 *
 * <p>All four views are filters over one shared fill table. {@link #analyzeAll} builds the
 * table once and answers every query from it; {@link #analyze} is the single-query form.
 * Rows with a NaN fill rate (zero intended trade) are counted in {@code totalTrades} but
 * never enter a mean, extreme, histogram or net rate.
 */
@Service
public class FillRateAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FillRateAnalyzer.class);

    public static final String NAME = "Fill Rate Analysis";

    private final FillRateEngine fillRateEngine;

    public FillRateAnalyzer(FillRateEngine fillRateEngine) {
        this.fillRateEngine = fillRateEngine;
    }

    public AnalysisResult analyze(ValidationDataset dataset, FillRateQuery query) {
        return answer(fillRateEngine.computeFills(dataset), query);
    }

    public List<AnalysisResult> analyzeAll(ValidationDataset dataset, List<FillRateQuery> queries) {
        FillTable table = fillRateEngine.computeFills(dataset);
        return queries.stream().map(query -> answer(table, query)).toList();
    }

    public AnalysisResult answer(FillTable table, FillRateQuery query) {
        log.debug("Answering fill rate query {}", query);
        return switch (query.getView()) {
            case OVERVIEW -> overview(table.all());
            case BY_TIME -> byTime(query.getTime(), table.arrivingAt(query.getTime()));
            case BY_TICKER -> byTicker(query.getTicker(), table.forTicker(query.getTicker()));
            case DEEP -> deep(query.getTime(), query.getTicker(), table.forBucket(query.getTime(), query.getTicker()));
        };
    }

    // ==================== Views ====================

    private AnalysisResult overview(List<FillRecord> records) {
        List<FillRecord> analyzable = analyzable(records);
        if (analyzable.isEmpty()) {
            return empty(FillRateView.OVERVIEW, "No analyzable trades found", records.size(),
                    List.of("All trades had zero intended trade"));
        }
        List<Double> rates = rates(analyzable);
        FillStatistics statistics = FillStatistics.of(rates);
        FillRecord best = analyzable.stream().max(Comparator.comparingDouble(FillRecord::getFillRate)).orElseThrow();
        FillRecord worst = analyzable.stream().min(Comparator.comparingDouble(FillRecord::getFillRate)).orElseThrow();

        String summary = String.format(
                "Total trades: %d | Analyzable: %d | Mean fill rate: %s",
                records.size(), analyzable.size(), rate(statistics.getMean()));
        List<String> details = List.of(
                "Best performer: " + best.getTicker() + " (" + rate(best.getFillRate()) + ")",
                "Worst performer: " + worst.getTicker() + " (" + rate(worst.getFillRate()) + ")",
                "Std fill rate: " + rate(statistics.getStd()));

        return result(FillRateView.OVERVIEW, summary, details, FillRateBreakdown.builder()
                .totalTrades(records.size())
                .analyzableTrades(analyzable.size())
                .statistics(statistics)
                .best(best)
                .worst(worst)
                .histogram(FillRateHistogram.of(rates, FillRateHistogram.DEFAULT_BINS))
                .build());
    }

    private AnalysisResult byTime(long time, List<FillRecord> records) {
        List<FillRecord> analyzable = analyzable(records);
        if (analyzable.isEmpty()) {
            return empty(FillRateView.BY_TIME, "No analyzable trades found for time=" + DetailLines.time(time),
                    records.size(), List.of());
        }
        List<FillRateGroup> groups = group(analyzable, FillRecord::getTicker, Function.identity());
        FillStatistics statistics = FillStatistics.of(rates(analyzable));

        List<String> details = new ArrayList<>();
        details.add("Per-ticker performance:");
        groups.forEach(g -> details.add("  " + g.getKey() + ": " + rate(g.getMeanFillRate())
                + " (" + DetailLines.plural(g.getTrades(), "trade") + ")"));

        String summary = String.format(
                "time=%s: %d tickers analyzed | Overall mean: %s",
                DetailLines.time(time), groups.size(), rate(statistics.getMean()));
        return result(FillRateView.BY_TIME, summary, details, FillRateBreakdown.builder()
                .totalTrades(records.size())
                .analyzableTrades(analyzable.size())
                .statistics(statistics)
                .groups(groups)
                .build());
    }

    private AnalysisResult byTicker(String ticker, List<FillRecord> records) {
        List<FillRecord> analyzable = analyzable(records);
        if (analyzable.isEmpty()) {
            return empty(FillRateView.BY_TICKER, "No analyzable trades found for ticker=" + ticker,
                    records.size(), List.of());
        }
        List<FillRateGroup> groups = group(analyzable, FillRecord::getTimeTo, DetailLines::time);
        FillStatistics statistics = FillStatistics.of(rates(analyzable));

        List<String> details = new ArrayList<>();
        details.add("Timeline performance:");
        groups.forEach(g -> details.add("  time=" + g.getKey() + ": " + rate(g.getMeanFillRate())
                + " (" + DetailLines.plural(g.getTrades(), "trade") + ")"));

        String summary = String.format(
                "ticker=%s: %d time periods | Overall mean: %s", ticker, groups.size(), rate(statistics.getMean()));
        return result(FillRateView.BY_TICKER, summary, details, FillRateBreakdown.builder()
                .totalTrades(records.size())
                .analyzableTrades(analyzable.size())
                .statistics(statistics)
                .groups(groups)
                .build());
    }

    private AnalysisResult deep(long time, String ticker, List<FillRecord> records) {
        List<FillRecord> analyzable = analyzable(records);
        String label = "time=" + DetailLines.time(time) + ", ticker=" + ticker;
        if (analyzable.isEmpty()) {
            return empty(FillRateView.DEEP, "No analyzable trades for " + label, records.size(), List.of());
        }
        FillStatistics statistics = FillStatistics.of(rates(analyzable));
        double totalIntended = analyzable.stream().mapToDouble(FillRecord::getIntendedTrade).sum();
        double totalActual = analyzable.stream().mapToDouble(FillRecord::getActualTrade).sum();
        double netFillRate = fillRateEngine.fillRate(totalIntended, totalActual);

        List<String> details = new ArrayList<>();
        details.add("Trade-by-trade breakdown:");
        analyzable.forEach(r -> details.add(String.format(
                "  %s: intended=%s, actual=%s, fill_rate=%s",
                r.getParticipantId(),
                DetailLines.volume(r.getIntendedTrade()),
                DetailLines.volume(r.getActualTrade()),
                rate(r.getFillRate()))));
        details.add("Mean fill rate: " + rate(statistics.getMean()));
        details.add("Std fill rate: " + rate(statistics.getStd()));
        details.add("Min fill rate: " + rate(statistics.getMin()));
        details.add("Max fill rate: " + rate(statistics.getMax()));
        details.add("Total intended: " + DetailLines.volume(totalIntended));
        details.add("Total actual: " + DetailLines.volume(totalActual));

        String summary = String.format(
                "%s: %d trades | Net fill rate: %s", label, analyzable.size(), rate(netFillRate));
        return result(FillRateView.DEEP, summary, details, FillRateBreakdown.builder()
                .totalTrades(records.size())
                .analyzableTrades(analyzable.size())
                .statistics(statistics)
                .trades(analyzable)
                .totalIntended(totalIntended)
                .totalActual(totalActual)
                .netFillRate(netFillRate)
                .build());
    }

    // ==================== Helpers ====================

    private static <K extends Comparable<K>> List<FillRateGroup> group(
            List<FillRecord> records, Function<FillRecord, K> key, Function<K, String> label) {
        SortedMap<K, List<Double>> grouped = new TreeMap<>();
        for (FillRecord record : records) {
            grouped.computeIfAbsent(key.apply(record), k -> new ArrayList<>()).add(record.getFillRate());
        }
        List<FillRateGroup> groups = new ArrayList<>();
        for (Map.Entry<K, List<Double>> entry : grouped.entrySet()) {
            FillStatistics stats = FillStatistics.of(entry.getValue());
            groups.add(new FillRateGroup(label.apply(entry.getKey()), stats.getMean(), stats.getCount()));
        }
        return groups;
    }

    private static List<FillRecord> analyzable(List<FillRecord> records) {
        return records.stream().filter(FillRecord::isAnalyzable).toList();
    }

    private static List<Double> rates(List<FillRecord> records) {
        return records.stream().map(FillRecord::getFillRate).toList();
    }

    private static String rate(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private AnalysisResult empty(FillRateView view, String summary, int totalTrades, List<String> details) {
        return result(view, summary, details, FillRateBreakdown.builder()
                .totalTrades(totalTrades)
                .analyzableTrades(0)
                .statistics(FillStatistics.of(List.of()))
                .build());
    }

    private AnalysisResult result(FillRateView view, String summary, List<String> details, FillRateBreakdown breakdown) {
        return AnalysisResult.builder()
                .analyzerName(NAME)
                .view(view)
                .summary(summary)
                .details(details)
                .breakdown(breakdown)
                .build();
    }
}
