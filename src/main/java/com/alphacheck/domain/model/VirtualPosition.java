package com.alphacheck.domain.model;

import lombok.Getter;

/**
 * Running per-ticker ledger used by the T+1 settlement checker.
 *
 * <p>{@code settledQuantity} is inventory carried from the previous close that may be sold
 * today. {@code unsettledQuantity} is everything acquired (or short-sold past the settled
 * amount) during the current day. Buys only ever grow the unsettled part; a same-day
 * purchase becomes sellable on the next trading day, which is outside a single run.
 *
 * <p>Created fresh for every run and mutated forward in time order only.
 */
@Getter
public class VirtualPosition {

    private final String ticker;
    private double settledQuantity;
    private double unsettledQuantity;

    private VirtualPosition(String ticker, double settledQuantity) {
        this.ticker = ticker;
        this.settledQuantity = settledQuantity;
        this.unsettledQuantity = 0;
    }

    /** Opens the day with the previous close as fully settled inventory. */
    public static VirtualPosition opening(String ticker, double previousClose) {
        return new VirtualPosition(ticker, previousClose);
    }

    public double getCurrentQuantity() {
        return settledQuantity + unsettledQuantity;
    }

    /** Settled quantity that can still be sold; never negative. */
    public double getSellableQuantity() {
        return Math.max(0, settledQuantity);
    }

    /** Consumes settled inventory for an approved sell. */
    public void releaseSettled(double quantity) {
        settledQuantity -= quantity;
    }

    /**
     * Moves the running position to the achieved target. Settled inventory is untouched,
     * so any increase lands in the unsettled part.
     */
    public void moveTo(double target) {
        unsettledQuantity = target - settledQuantity;
    }
}
