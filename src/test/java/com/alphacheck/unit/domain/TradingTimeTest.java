package com.alphacheck.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alphacheck.domain.TradingTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TradingTimeTest {

    @Test
    @DisplayName("Integer cells pass through unchanged")
    void integerTimesPassThrough() {
        assertThat(TradingTime.parse("93000000")).isEqualTo(93_000_000L);
        assertThat(TradingTime.parse(" 140000000 ")).isEqualTo(140_000_000L);
    }

    @Test
    @DisplayName("Textual closing marker becomes PREV_CLOSE")
    void textualMarkerBecomesPrevClose() {
        assertThat(TradingTime.parse("nil_last_alpha")).isEqualTo(TradingTime.PREV_CLOSE);
        assertThat(TradingTime.parse("")).isEqualTo(TradingTime.PREV_CLOSE);
        assertThat(TradingTime.parse(null)).isEqualTo(TradingTime.PREV_CLOSE);
    }

    @Test
    @DisplayName("Integral decimals written by spreadsheets are truncated to the integer key")
    void integralDecimalIsAccepted() {
        assertThat(TradingTime.parse("93000000.0")).isEqualTo(93_000_000L);
        assertThat(TradingTime.parse("93000000.5")).isEqualTo(TradingTime.PREV_CLOSE);
    }

    @Test
    @DisplayName("Integer cell beyond the long range is rejected rather than folded to PREV_CLOSE")
    void overflowingIntegerRejected() {
        assertThatThrownBy(() -> TradingTime.parse("99999999999999999999"))
                .isInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("PREV_CLOSE sorts before every intraday bucket")
    void prevCloseSortsFirst() {
        assertThat(TradingTime.PREV_CLOSE).isLessThan(0L);
        assertThat(TradingTime.isPrevClose(TradingTime.PREV_CLOSE)).isTrue();
        assertThat(TradingTime.isIntraday(93_000_000L)).isTrue();
    }

    @Test
    @DisplayName("Format renders H:MM for HHMMSSmmm keys and PREV for the sentinel")
    void formatsClockTime() {
        assertThat(TradingTime.format(93_000_000L)).isEqualTo("9:30");
        assertThat(TradingTime.format(140_500_000L)).isEqualTo("14:05");
        assertThat(TradingTime.format(TradingTime.PREV_CLOSE)).isEqualTo("PREV");
        assertThat(TradingTime.format(42L)).isEqualTo("42");
    }
}
