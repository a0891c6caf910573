package com.alphacheck.loader;

import com.alphacheck.domain.enums.Phase;
import com.alphacheck.domain.model.AlphaEvent;
import com.alphacheck.domain.model.DatasetSummary;
import com.alphacheck.domain.model.MarketEvent;
import com.alphacheck.domain.model.PositionEvent;
import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.domain.model.VirtualPositionEvent;
import com.alphacheck.exception.DataContractException;
import com.alphacheck.exception.ResourceNotFoundException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads a directory of pipe-delimited event files into a {@link ValidationDataset}.
 *
 * <p>Required: {@value #PM_FILE}, {@value #SPLIT_FILE}, {@value #POSITION_FILE}.
 * Optional: {@value #MERGED_FILE} (the PM table stands in when absent),
 * {@value #MARKET_FILE} and {@value #VIRTUAL_POSITION_FILE}.
 *
 * <p>Headers are checked before any row is converted. Every non-integer {@code time} cell
 * (e.g. {@code nil_last_alpha}) becomes PREV_CLOSE.
 */
@Component
public class CsvDatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvDatasetLoader.class);

    public static final String PM_FILE = "InCheckAlphaEv.csv";
    public static final String MERGED_FILE = "MergedAlphaEv.csv";
    public static final String SPLIT_FILE = "SplitAlphaEv.csv";
    public static final String POSITION_FILE = "SplitCtxEv.csv";
    public static final String MARKET_FILE = "MarketDataEv.csv";
    public static final String VIRTUAL_POSITION_FILE = "PmVirtualPosEv.csv";

    static final List<String> ALPHA_COLUMNS = List.of("event", "alphaid", "time", "ticker", "volume");
    static final List<String> POSITION_COLUMNS = List.of(
            "event",
            "alphaid",
            "time",
            "ticker",
            "realtime_pos",
            "realtime_long_pos",
            "realtime_short_pos",
            "realtime_avail_shot_vol");
    static final List<String> MARKET_COLUMNS =
            List.of("event", "alphaid", "time", "ticker", "last_price", "prev_close_price");
    static final List<String> VIRTUAL_POSITION_COLUMNS = List.of("alphaid", "time", "ticker", "virtual_position");

    private static final char SEPARATOR = '|';

    private final CsvMapper csvMapper;

    public CsvDatasetLoader() {
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.WRAP_AS_ARRAY)
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
    }

    public ValidationDataset load(Path dataDir) {
        if (!Files.isDirectory(dataDir)) {
            throw new ResourceNotFoundException("Data directory", dataDir);
        }
        log.info("Loading validation dataset from {}", dataDir);

        List<AlphaEvent> pm = readAlpha(require(dataDir, PM_FILE), Phase.PM);
        Path mergedFile = dataDir.resolve(MERGED_FILE);
        boolean mergeStagePresent = Files.exists(mergedFile);
        List<AlphaEvent> merged = mergeStagePresent ? readAlpha(mergedFile, Phase.MERGED) : asMerged(pm);
        List<AlphaEvent> split = readAlpha(require(dataDir, SPLIT_FILE), Phase.SPLIT);
        List<PositionEvent> positions = readPositions(require(dataDir, POSITION_FILE));

        Path marketFile = dataDir.resolve(MARKET_FILE);
        List<MarketEvent> market = Files.exists(marketFile) ? readMarket(marketFile) : null;
        Path virtualFile = dataDir.resolve(VIRTUAL_POSITION_FILE);
        List<VirtualPositionEvent> virtualPositions = Files.exists(virtualFile) ? readVirtualPositions(virtualFile) : null;

        ValidationDataset dataset = ValidationDataset.builder()
                .pmSignals(pm)
                .mergedSignals(merged)
                .splitSignals(split)
                .positions(positions)
                .marketSnapshots(market)
                .virtualPositions(virtualPositions)
                .mergeStagePresent(mergeStagePresent)
                .build();
        logSummary(dataset.summarize());
        return dataset;
    }

    // ==================== Tables ====================

    List<AlphaEvent> readAlpha(Path file, Phase phase) {
        CsvTable table = read(file);
        table.requireColumns(ALPHA_COLUMNS);
        List<AlphaEvent> events = new ArrayList<>(table.size());
        for (int row = 0; row < table.size(); row++) {
            events.add(AlphaEvent.builder()
                    .phase(phase)
                    .participantId(table.text(row, "alphaid"))
                    .time(table.time(row, "time"))
                    .ticker(table.text(row, "ticker"))
                    .targetVolume(table.number(row, "volume"))
                    .build());
        }
        return events;
    }

    List<PositionEvent> readPositions(Path file) {
        CsvTable table = read(file);
        table.requireColumns(POSITION_COLUMNS);
        List<PositionEvent> events = new ArrayList<>(table.size());
        for (int row = 0; row < table.size(); row++) {
            events.add(PositionEvent.builder()
                    .participantId(table.text(row, "alphaid"))
                    .time(table.time(row, "time"))
                    .ticker(table.text(row, "ticker"))
                    .currentPosition(table.number(row, "realtime_pos"))
                    .longPosition(table.number(row, "realtime_long_pos"))
                    .shortPosition(table.number(row, "realtime_short_pos"))
                    .availableSellableVolume(table.optionalNumber(row, "realtime_avail_shot_vol"))
                    .build());
        }
        return events;
    }

    List<MarketEvent> readMarket(Path file) {
        CsvTable table = read(file);
        table.requireColumns(MARKET_COLUMNS);
        List<MarketEvent> events = new ArrayList<>(table.size());
        for (int row = 0; row < table.size(); row++) {
            events.add(MarketEvent.builder()
                    .time(table.time(row, "time"))
                    .ticker(table.text(row, "ticker"))
                    .lastPrice(table.optionalDecimal(row, "last_price"))
                    .prevClosePrice(table.optionalDecimal(row, "prev_close_price"))
                    .build());
        }
        return events;
    }

    List<VirtualPositionEvent> readVirtualPositions(Path file) {
        CsvTable table = read(file);
        table.requireColumns(VIRTUAL_POSITION_COLUMNS);
        List<VirtualPositionEvent> events = new ArrayList<>(table.size());
        for (int row = 0; row < table.size(); row++) {
            events.add(VirtualPositionEvent.builder()
                    .participantId(table.text(row, "alphaid"))
                    .time(table.time(row, "time"))
                    .ticker(table.text(row, "ticker"))
                    .virtualPosition(table.number(row, "virtual_position"))
                    .build());
        }
        return events;
    }

    // ==================== Helpers ====================

    private CsvTable read(Path file) {
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(SEPARATOR);
        try (MappingIterator<String[]> iterator =
                csvMapper.readerFor(String[].class).with(schema).readValues(file.toFile())) {
            List<String[]> rows = iterator.readAll();
            if (rows.isEmpty()) {
                throw new DataContractException(file.getFileName() + " has no header row");
            }
            return new CsvTable(file.getFileName().toString(), rows.get(0), rows.subList(1, rows.size()));
        } catch (IOException e) {
            throw new DataContractException("Failed to read " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static Path require(Path dataDir, String fileName) {
        Path file = dataDir.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            throw new DataContractException("Required file not found: " + file);
        }
        return file;
    }

    private static List<AlphaEvent> asMerged(List<AlphaEvent> pm) {
        return pm.stream()
                .map(e -> AlphaEvent.builder()
                        .phase(Phase.MERGED)
                        .participantId(e.getParticipantId())
                        .time(e.getTime())
                        .ticker(e.getTicker())
                        .targetVolume(e.getTargetVolume())
                        .build())
                .toList();
    }

    private static void logSummary(DatasetSummary summary) {
        for (DatasetSummary.TableSummary table : summary.getTables()) {
            log.info(
                    "Loaded {}: {} records, {} time buckets, {} tickers",
                    table.name(),
                    table.rows(),
                    table.timeBuckets(),
                    table.tickers());
        }
        if (!summary.isMergeStagePresent()) {
            log.info("No {} found, PM signals used as merged signals", MERGED_FILE);
        }
    }
}
