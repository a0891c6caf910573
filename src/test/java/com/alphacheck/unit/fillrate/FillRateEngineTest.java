package com.alphacheck.unit.fillrate;

import static com.alphacheck.fixtures.DatasetBuilder.T1;
import static com.alphacheck.fixtures.DatasetBuilder.T2;
import static com.alphacheck.fixtures.DatasetBuilder.T3;
import static com.alphacheck.fixtures.DatasetBuilder.dataset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.alphacheck.checker.CheckerSettings;
import com.alphacheck.fillrate.FillRateEngine;
import com.alphacheck.fillrate.FillRecord;
import com.alphacheck.fillrate.FillTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FillRateEngineTest {

    private final FillRateEngine engine = new FillRateEngine(CheckerSettings.defaults());

    @Test
    @DisplayName("Fill rate is the realized change over the intended trade")
    void computesFillRate() {
        FillTable table = engine.computeFills(dataset()
                .split("S1", T1, "AAA", 1000)
                .split("S1", T2, "AAA", 1000)
                .position("S1", T1, "AAA", 0)
                .position("S1", T2, "AAA", 900)
                .build());

        assertThat(table.size()).isEqualTo(1);
        FillRecord record = table.all().get(0);
        assertThat(record.getIntendedTrade()).isEqualTo(1000);
        assertThat(record.getActualTrade()).isEqualTo(900);
        assertThat(record.getFillRate()).isCloseTo(0.9, within(1e-12));
        assertThat(record.getTimeFrom()).isEqualTo(T1);
        assertThat(record.getTimeTo()).isEqualTo(T2);
    }

    @Test
    @DisplayName("Zero intended trade keeps the row with a NaN fill rate")
    void zeroIntentIsNaN() {
        FillTable table = engine.computeFills(dataset()
                .split("S1", T1, "AAA", 500)
                .split("S1", T2, "AAA", 600)
                .position("S1", T1, "AAA", 500)
                .position("S1", T2, "AAA", 600)
                .build());

        assertThat(table.size()).isEqualTo(1);
        assertThat(table.all().get(0).getFillRate()).isNaN();
        assertThat(table.all().get(0).isAnalyzable()).isFalse();
    }

    @Test
    @DisplayName("A target is measured at the next target bucket, not at the next snapshot")
    void pairsOnTargetBuckets() {
        FillTable table = engine.computeFills(dataset()
                .split("S1", T1, "AAA", 1000)
                .split("S1", T3, "AAA", 1000)
                .position("S1", T1, "AAA", 0)
                .position("S1", T2, "AAA", 300)
                .position("S1", T3, "AAA", 1000)
                .build());

        assertThat(table.all()).singleElement().satisfies(record -> {
            assertThat(record.getTimeFrom()).isEqualTo(T1);
            assertThat(record.getTimeTo()).isEqualTo(T3);
            assertThat(record.getActualTrade()).isEqualTo(1000);
            assertThat(record.getFillRate()).isEqualTo(1.0);
        });
        assertThat(table.arrivingAt(T2)).isEmpty();
        assertThat(table.arrivingAt(T3)).hasSize(1);
    }

    @Test
    @DisplayName("Duplicate rows for one trader and ticker are summed")
    void duplicateRowsSummed() {
        FillTable table = engine.computeFills(dataset()
                .split("S1", T1, "AAA", 600)
                .split("S1", T1, "AAA", 400)
                .split("S1", T2, "AAA", 1000)
                .position("S1", T1, "AAA", 0)
                .position("S1", T2, "AAA", 300)
                .position("S1", T2, "AAA", 200)
                .build());

        assertThat(table.all()).singleElement().satisfies(record -> {
            assertThat(record.getIntendedTrade()).isEqualTo(1000);
            assertThat(record.getActualTrade()).isEqualTo(500);
        });
    }

    @Test
    @DisplayName("Overfills and reversals produce rates above one and below zero")
    void ratesAreUnbounded() {
        assertThat(engine.fillRate(100, 150)).isEqualTo(1.5);
        assertThat(engine.fillRate(-200, 100)).isEqualTo(-0.5);
    }

    @Test
    @DisplayName("Steps missing a snapshot on either side are dropped")
    void innerJoin() {
        FillTable table = engine.computeFills(dataset()
                .split("S1", T1, "AAA", 1000)
                .split("S2", T1, "AAA", 1000)
                .position("S1", T1, "AAA", 0)
                .position("S2", T1, "AAA", 0)
                .position("S1", T2, "AAA", 500)
                .split("S1", T2, "AAA", 1000)
                .split("S1", T3, "AAA", 1000)
                .position("S1", T3, "AAA", 1000)
                .build());

        assertThat(table.all()).extracting(FillRecord::getParticipantId).containsExactly("S1", "S1");
        assertThat(table.arrivingAt(T3)).hasSize(1);
    }
}
