package com.alphacheck.unit.domain;

import static com.alphacheck.fixtures.DatasetBuilder.T1;
import static com.alphacheck.fixtures.DatasetBuilder.T2;
import static com.alphacheck.fixtures.DatasetBuilder.dataset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alphacheck.domain.TradingTime;
import com.alphacheck.domain.model.DatasetSummary;
import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.domain.model.VirtualPosition;
import com.alphacheck.exception.DataContractException;
import com.alphacheck.exception.ErrorCode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ValidationDatasetTest {

    @Test
    @DisplayName("Pre-flight check rejects a dataset without required tables")
    void requireCompleteRejectsMissingTables() {
        ValidationDataset dataset = ValidationDataset.builder()
                .pmSignals(List.of())
                .mergedSignals(List.of())
                .build();

        assertThatThrownBy(dataset::requireComplete)
                .isInstanceOf(DataContractException.class)
                .hasMessageContaining("split")
                .hasMessageContaining("positions")
                .satisfies(e -> assertThat(((DataContractException) e).getErrorCode())
                        .isEqualTo(ErrorCode.DATA_CONTRACT_VIOLATION));
    }

    @Test
    @DisplayName("Intraday position times are sorted and exclude PREV_CLOSE")
    void intradayTimesExcludePrevClose() {
        ValidationDataset dataset = dataset()
                .position("T1", T2, "AAA", 100)
                .position("T1", TradingTime.PREV_CLOSE, "AAA", 0)
                .position("T2", T1, "AAA", 100)
                .position("T1", T1, "AAA", 100)
                .build();

        assertThat(dataset.intradayPositionTimes()).containsExactly(T1, T2);
    }

    @Test
    @DisplayName("Summary counts distinct times and tickers; absent tables report zeros")
    void summarizeCountsDistinctValues() {
        ValidationDataset dataset = dataset()
                .pm("PM1", T1, "AAA", 100)
                .pm("PM2", T1, "BBB", 100)
                .pm("PM1", T2, "AAA", 100)
                .split("S1", T1, "AAA", 100)
                .position("S1", T1, "AAA", 0)
                .build();

        DatasetSummary summary = dataset.summarize();

        assertThat(summary.table(ValidationDataset.PM_TABLE).rows()).isEqualTo(3);
        assertThat(summary.table(ValidationDataset.PM_TABLE).timeBuckets()).isEqualTo(2);
        assertThat(summary.table(ValidationDataset.PM_TABLE).tickers()).isEqualTo(2);
        assertThat(summary.table(ValidationDataset.MARKET_TABLE).rows()).isZero();
        assertThat(summary.isMarketDataPresent()).isFalse();
        assertThat(summary.isVirtualPositionsPresent()).isFalse();
    }

    @Test
    @DisplayName("Available sellable is detected when any snapshot carries it")
    void detectsAvailableSellable() {
        assertThat(dataset().position("S1", T1, "AAA", 100).build().hasAvailableSellable()).isFalse();
        assertThat(dataset().position("S1", T1, "AAA", 100, 50.0).build().hasAvailableSellable()).isTrue();
    }

    @Test
    @DisplayName("Virtual position ledger keeps buys unsettled and consumes settled inventory on sells")
    void virtualPositionLedger() {
        VirtualPosition ledger = VirtualPosition.opening("AAA", 8000);

        ledger.releaseSettled(2000);
        ledger.moveTo(6000);
        assertThat(ledger.getSettledQuantity()).isEqualTo(6000);
        assertThat(ledger.getCurrentQuantity()).isEqualTo(6000);

        ledger.moveTo(8000);
        assertThat(ledger.getSettledQuantity()).isEqualTo(6000);
        assertThat(ledger.getUnsettledQuantity()).isEqualTo(2000);
        assertThat(ledger.getSellableQuantity()).isEqualTo(6000);
    }
}
