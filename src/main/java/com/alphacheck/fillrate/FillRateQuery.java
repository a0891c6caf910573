package com.alphacheck.fillrate;

import com.alphacheck.domain.TradingTime;
import com.alphacheck.domain.enums.FillRateView;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A single view request over the fill table. {@code time} is always an arrival bucket. */
@Getter
@EqualsAndHashCode
public class FillRateQuery {

    private final FillRateView view;
    private final Long time;
    private final String ticker;

    private FillRateQuery(FillRateView view, Long time, String ticker) {
        this.view = view;
        this.time = time;
        this.ticker = ticker;
    }

    public static FillRateQuery overview() {
        return new FillRateQuery(FillRateView.OVERVIEW, null, null);
    }

    public static FillRateQuery byTime(long time) {
        return new FillRateQuery(FillRateView.BY_TIME, time, null);
    }

    public static FillRateQuery byTicker(String ticker) {
        return new FillRateQuery(FillRateView.BY_TICKER, null, ticker);
    }

    public static FillRateQuery deep(long time, String ticker) {
        return new FillRateQuery(FillRateView.DEEP, time, ticker);
    }

    @Override
    public String toString() {
        return switch (view) {
            case OVERVIEW -> "overview";
            case BY_TIME -> "time=" + TradingTime.format(time);
            case BY_TICKER -> "ticker=" + ticker;
            case DEEP -> "time=" + TradingTime.format(time) + ", ticker=" + ticker;
        };
    }
}
