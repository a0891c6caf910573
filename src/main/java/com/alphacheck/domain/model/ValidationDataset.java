package com.alphacheck.domain.model;

import com.alphacheck.domain.TradingTime;
import com.alphacheck.exception.DataContractException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;

/**
 * The five (optionally six) aligned tables of one validation run.
 *
 * <p>Read-only for every checker and analyzer. Optional tables are null when absent;
 * use {@link #hasMarketData()} and {@link #hasVirtualPositions()} before reading them.
 * When the pipeline has no merge stage the loader hands the PM table in as the merged
 * table and sets {@code mergeStagePresent=false}.
 */
@Getter
@Builder
public class ValidationDataset {

    public static final String PM_TABLE = "pm";
    public static final String MERGED_TABLE = "merged";
    public static final String SPLIT_TABLE = "split";
    public static final String POSITION_TABLE = "positions";
    public static final String MARKET_TABLE = "market";
    public static final String VIRTUAL_POSITION_TABLE = "virtualPositions";

    private final List<AlphaEvent> pmSignals;
    private final List<AlphaEvent> mergedSignals;
    private final List<AlphaEvent> splitSignals;
    private final List<PositionEvent> positions;
    private final List<MarketEvent> marketSnapshots;
    private final List<VirtualPositionEvent> virtualPositions;

    @Builder.Default
    private final boolean mergeStagePresent = true;

    public boolean hasMarketData() {
        return marketSnapshots != null;
    }

    public boolean hasVirtualPositions() {
        return virtualPositions != null;
    }

    /** True when at least one snapshot carries an upstream available-sellable volume. */
    public boolean hasAvailableSellable() {
        return positions != null && positions.stream().anyMatch(p -> p.getAvailableSellableVolume() != null);
    }

    /** Ascending intraday snapshot times; PREV_CLOSE is never included. */
    public List<Long> intradayPositionTimes() {
        return positions.stream()
                .map(PositionEvent::getTime)
                .filter(TradingTime::isIntraday)
                .collect(Collectors.toCollection(TreeSet::new))
                .stream()
                .toList();
    }

    /** Ascending intraday split-target times; PREV_CLOSE is never included. */
    public List<Long> intradayTargetTimes() {
        return splitSignals.stream()
                .map(AlphaEvent::getTime)
                .filter(TradingTime::isIntraday)
                .collect(Collectors.toCollection(TreeSet::new))
                .stream()
                .toList();
    }

    /**
     * Pre-flight contract check. Raises before any checker runs so that a broken dataset
     * never produces a partial report.
     */
    public void requireComplete() {
        List<String> missing = new ArrayList<>();
        if (pmSignals == null) missing.add(PM_TABLE);
        if (mergedSignals == null) missing.add(MERGED_TABLE);
        if (splitSignals == null) missing.add(SPLIT_TABLE);
        if (positions == null) missing.add(POSITION_TABLE);
        if (!missing.isEmpty()) {
            throw new DataContractException(
                    "Required tables missing: " + String.join(", ", missing), Map.of("tables", missing));
        }
        requireKeys(PM_TABLE, pmSignals, AlphaEvent::getParticipantId, AlphaEvent::getTicker);
        requireKeys(MERGED_TABLE, mergedSignals, AlphaEvent::getParticipantId, AlphaEvent::getTicker);
        requireKeys(SPLIT_TABLE, splitSignals, AlphaEvent::getParticipantId, AlphaEvent::getTicker);
        requireKeys(POSITION_TABLE, positions, PositionEvent::getParticipantId, PositionEvent::getTicker);
    }

    public DatasetSummary summarize() {
        List<DatasetSummary.TableSummary> tables = new ArrayList<>();
        tables.add(summarizeTable(PM_TABLE, pmSignals, AlphaEvent::getTime, AlphaEvent::getTicker));
        tables.add(summarizeTable(MERGED_TABLE, mergedSignals, AlphaEvent::getTime, AlphaEvent::getTicker));
        tables.add(summarizeTable(SPLIT_TABLE, splitSignals, AlphaEvent::getTime, AlphaEvent::getTicker));
        tables.add(summarizeTable(POSITION_TABLE, positions, PositionEvent::getTime, PositionEvent::getTicker));
        tables.add(summarizeTable(MARKET_TABLE, marketSnapshots, MarketEvent::getTime, MarketEvent::getTicker));
        tables.add(summarizeTable(
                VIRTUAL_POSITION_TABLE,
                virtualPositions,
                VirtualPositionEvent::getTime,
                VirtualPositionEvent::getTicker));
        return DatasetSummary.builder()
                .tables(tables)
                .mergeStagePresent(mergeStagePresent)
                .marketDataPresent(hasMarketData())
                .virtualPositionsPresent(hasVirtualPositions())
                .build();
    }

    private static <T> DatasetSummary.TableSummary summarizeTable(
            String name, Collection<T> rows, Function<T, Long> time, Function<T, String> ticker) {
        if (rows == null) {
            return new DatasetSummary.TableSummary(name, 0, 0, 0);
        }
        Set<Long> times = rows.stream().map(time).collect(Collectors.toSet());
        Set<String> tickers = rows.stream().map(ticker).collect(Collectors.toSet());
        return new DatasetSummary.TableSummary(name, rows.size(), times.size(), tickers.size());
    }

    private static <T> void requireKeys(
            String table, List<T> rows, Function<T, String> participant, Function<T, String> ticker) {
        for (int i = 0; i < rows.size(); i++) {
            T row = rows.get(i);
            if (participant.apply(row) == null || ticker.apply(row) == null) {
                throw new DataContractException(
                        String.format("Table %s row %d is missing participant or ticker", table, i + 1));
            }
        }
    }
}
