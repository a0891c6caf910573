package com.alphacheck.domain.enums;

/** Aggregation views served from the shared per-trade fill table. */
public enum FillRateView {
    OVERVIEW,
    BY_TIME,
    BY_TICKER,
    DEEP
}
