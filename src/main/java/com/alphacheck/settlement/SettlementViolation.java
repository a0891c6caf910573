package com.alphacheck.settlement;

import com.alphacheck.checker.DetailLines;
import lombok.Builder;
import lombok.Getter;

/** A sell that needs more than the T+1-sellable inventory at that bucket. */
@Getter
@Builder
public class SettlementViolation {

    private final long time;
    private final String ticker;
    private final double target;
    private final double currentBefore;
    private final double requiredSell;
    private final double availableSettled;

    public double getExcess() {
        return requiredSell - availableSettled;
    }

    public String describe() {
        return String.format(
                "%s: target=%s, vpos_before=%s, need_sell=%s, available=%s, excess=%s",
                ticker,
                DetailLines.volume(target),
                DetailLines.volume(currentBefore),
                DetailLines.volume(requiredSell),
                DetailLines.volume(availableSettled),
                DetailLines.volume(getExcess()));
    }
}
