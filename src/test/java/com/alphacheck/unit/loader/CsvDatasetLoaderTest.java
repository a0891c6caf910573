package com.alphacheck.unit.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alphacheck.domain.TradingTime;
import com.alphacheck.domain.enums.Phase;
import com.alphacheck.domain.model.AlphaEvent;
import com.alphacheck.domain.model.PositionEvent;
import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.exception.DataContractException;
import com.alphacheck.exception.ErrorCode;
import com.alphacheck.exception.ResourceNotFoundException;
import com.alphacheck.loader.CsvDatasetLoader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvDatasetLoaderTest {

    private static final String ALPHA_HEADER = "event|alphaid|time|ticker|volume";
    private static final String POSITION_HEADER = "event|alphaid|time|ticker|realtime_pos|realtime_long_pos"
            + "|realtime_short_pos|realtime_avail_shot_vol";

    @TempDir
    Path dataDir;

    private CsvDatasetLoader loader;

    @BeforeEach
    void setUp() throws IOException {
        loader = new CsvDatasetLoader();
        write(CsvDatasetLoader.PM_FILE,
                ALPHA_HEADER,
                "InCheckAlphaEv|PM1|nil_last_alpha|AAA|500",
                "InCheckAlphaEv|PM1|93000000|AAA|600");
        write(CsvDatasetLoader.SPLIT_FILE,
                ALPHA_HEADER,
                "SplitAlphaEv|S1|93000000|AAA|300",
                "SplitAlphaEv|S2|93000000|AAA|300");
        write(CsvDatasetLoader.POSITION_FILE,
                POSITION_HEADER,
                "SplitCtxEv|S1|93000000|AAA|200|200|0|",
                "SplitCtxEv|S2|93000000|AAA|100|100|0|50");
    }

    @Test
    @DisplayName("Non-numeric time cells load as PREV_CLOSE")
    void nilLastAlphaIsPrevClose() {
        ValidationDataset dataset = loader.load(dataDir);

        assertThat(dataset.getPmSignals()).extracting(AlphaEvent::getTime)
                .containsExactly(TradingTime.PREV_CLOSE, 93_000_000L);
        assertThat(dataset.getSplitSignals()).extracting(AlphaEvent::getPhase).containsOnly(Phase.SPLIT);
    }

    @Test
    @DisplayName("Missing merged file falls back to the PM table")
    void mergedFallsBackToPm() {
        ValidationDataset dataset = loader.load(dataDir);

        assertThat(dataset.isMergeStagePresent()).isFalse();
        assertThat(dataset.getMergedSignals()).hasSize(2);
        assertThat(dataset.getMergedSignals()).extracting(AlphaEvent::getPhase).containsOnly(Phase.MERGED);
        assertThat(dataset.getMergedSignals()).extracting(AlphaEvent::getTargetVolume).containsExactly(500.0, 600.0);
    }

    @Test
    @DisplayName("Merged file is read when present")
    void mergedFileRead() throws IOException {
        write(CsvDatasetLoader.MERGED_FILE, ALPHA_HEADER, "MergedAlphaEv|G1|93000000|AAA|600");

        ValidationDataset dataset = loader.load(dataDir);

        assertThat(dataset.isMergeStagePresent()).isTrue();
        assertThat(dataset.getMergedSignals()).singleElement()
                .satisfies(e -> assertThat(e.getParticipantId()).isEqualTo("G1"));
    }

    @Test
    @DisplayName("Blank sellable volume loads as null and optional tables stay absent")
    void blankSellableIsNull() {
        ValidationDataset dataset = loader.load(dataDir);

        assertThat(dataset.getPositions()).extracting(PositionEvent::getAvailableSellableVolume)
                .containsExactly(null, 50.0);
        assertThat(dataset.hasMarketData()).isFalse();
        assertThat(dataset.hasVirtualPositions()).isFalse();
    }

    @Test
    @DisplayName("Optional market and virtual position files are loaded")
    void optionalTables() throws IOException {
        write(CsvDatasetLoader.MARKET_FILE,
                "event|alphaid|time|ticker|last_price|prev_close_price",
                "MarketDataEv|MD|93000000|AAA|10.25|10.10");
        write(CsvDatasetLoader.VIRTUAL_POSITION_FILE,
                "alphaid|time|ticker|virtual_position",
                "PM1|nil_last_alpha|AAA|5000");

        ValidationDataset dataset = loader.load(dataDir);

        assertThat(dataset.getMarketSnapshots()).singleElement()
                .satisfies(m -> assertThat(m.getLastPrice()).isEqualByComparingTo(new BigDecimal("10.25")));
        assertThat(dataset.getVirtualPositions()).singleElement()
                .satisfies(v -> assertThat(v.getTime()).isEqualTo(TradingTime.PREV_CLOSE));
    }

    @Test
    @DisplayName("Missing required column names the file and the column")
    void missingColumn() throws IOException {
        write(CsvDatasetLoader.SPLIT_FILE, "event|alphaid|time|ticker", "SplitAlphaEv|S1|93000000|AAA");

        assertThatThrownBy(() -> loader.load(dataDir))
                .isInstanceOf(DataContractException.class)
                .hasMessage("SplitAlphaEv.csv missing required columns: [volume]");
    }

    @Test
    @DisplayName("Missing required file is a data contract violation")
    void missingFile() throws IOException {
        Files.delete(dataDir.resolve(CsvDatasetLoader.POSITION_FILE));

        assertThatThrownBy(() -> loader.load(dataDir))
                .isInstanceOf(DataContractException.class)
                .hasMessageStartingWith("Required file not found:")
                .hasMessageContaining("SplitCtxEv.csv")
                .satisfies(e -> assertThat(((DataContractException) e).getErrorCode())
                        .isEqualTo(ErrorCode.DATA_CONTRACT_VIOLATION));
    }

    @Test
    @DisplayName("Malformed volume reports file, line and column")
    void malformedNumber() throws IOException {
        write(CsvDatasetLoader.SPLIT_FILE, ALPHA_HEADER, "SplitAlphaEv|S1|93000000|AAA|lots");

        assertThatThrownBy(() -> loader.load(dataDir))
                .isInstanceOf(DataContractException.class)
                .hasMessage("SplitAlphaEv.csv line 2 column volume: not a number: 'lots'");
    }

    @Test
    @DisplayName("Integer time cell beyond the long range is a data contract violation")
    void overflowingTime() throws IOException {
        write(CsvDatasetLoader.SPLIT_FILE, ALPHA_HEADER, "SplitAlphaEv|S1|99999999999999999999|AAA|100");

        assertThatThrownBy(() -> loader.load(dataDir))
                .isInstanceOf(DataContractException.class)
                .hasMessage("SplitAlphaEv.csv line 2 column time: time out of range: '99999999999999999999'");
    }

    @Test
    @DisplayName("Infinite price is a data contract violation")
    void infinitePrice() throws IOException {
        write(CsvDatasetLoader.MARKET_FILE,
                "event|alphaid|time|ticker|last_price|prev_close_price",
                "MarketDataEv|MD|93000000|AAA|Infinity|10.10");

        assertThatThrownBy(() -> loader.load(dataDir))
                .isInstanceOf(DataContractException.class)
                .hasMessage("MarketDataEv.csv line 2 column last_price: not a finite number: 'Infinity'");
    }

    @Test
    @DisplayName("Price with a floating-point type suffix is not a decimal")
    void suffixedPrice() throws IOException {
        write(CsvDatasetLoader.MARKET_FILE,
                "event|alphaid|time|ticker|last_price|prev_close_price",
                "MarketDataEv|MD|93000000|AAA|10.25d|10.10");

        assertThatThrownBy(() -> loader.load(dataDir))
                .isInstanceOf(DataContractException.class)
                .hasMessage("MarketDataEv.csv line 2 column last_price: not a decimal: '10.25d'");
    }

    @Test
    @DisplayName("Unknown directory is reported as not found")
    void missingDirectory() {
        assertThatThrownBy(() -> loader.load(dataDir.resolve("nope")))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("Data directory not found")
                .extracting(e -> ((ResourceNotFoundException) e).getDetails().get("location"))
                .isEqualTo(dataDir.resolve("nope").toString());
    }

    private void write(String fileName, String... lines) throws IOException {
        Files.write(dataDir.resolve(fileName), java.util.List.of(lines));
    }
}
