package com.alphacheck.settlement;

import com.alphacheck.domain.TradingTime;
import com.alphacheck.domain.model.AlphaEvent;
import com.alphacheck.domain.model.PositionEvent;
import com.alphacheck.domain.model.TimeTicker;
import com.alphacheck.domain.model.ValidationDataset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Trusts the upstream T+1-aware sellable volume instead of tracking settlement itself.
 *
 * <p>For each merged target the group position and sellable volume are the sums over the
 * trader snapshots of that (time, ticker). A blank sellable cell counts as 0.
 */
public class AvailableSellableSettlementStrategy implements SettlementStrategy {

    @Override
    public String getName() {
        return "available sellable";
    }

    @Override
    public boolean supports(ValidationDataset dataset) {
        return dataset.hasAvailableSellable();
    }

    @Override
    public SettlementOutcome evaluate(ValidationDataset dataset, double tolerance) {
        Map<TimeTicker, double[]> snapshots = new HashMap<>();
        for (PositionEvent position : dataset.getPositions()) {
            double[] sums = snapshots.computeIfAbsent(position.timeTicker(), k -> new double[2]);
            sums[0] += position.getCurrentPosition();
            if (position.getAvailableSellableVolume() != null) {
                sums[1] += position.getAvailableSellableVolume();
            }
        }

        SortedMap<TimeTicker, Double> targets = new TreeMap<>();
        for (AlphaEvent merged : dataset.getMergedSignals()) {
            if (TradingTime.isIntraday(merged.getTime())) {
                targets.merge(merged.timeTicker(), merged.getTargetVolume(), Double::sum);
            }
        }

        List<SettlementViolation> violations = new ArrayList<>();
        for (Map.Entry<TimeTicker, Double> entry : targets.entrySet()) {
            double[] sums = snapshots.getOrDefault(entry.getKey(), new double[2]);
            double current = sums[0];
            double available = Math.max(0, sums[1]);
            double requiredSell = current - entry.getValue();
            if (requiredSell > tolerance && requiredSell > available + tolerance) {
                violations.add(SettlementViolation.builder()
                        .time(entry.getKey().time())
                        .ticker(entry.getKey().ticker())
                        .target(entry.getValue())
                        .currentBefore(current)
                        .requiredSell(requiredSell)
                        .availableSettled(available)
                        .build());
            }
        }
        return new SettlementOutcome(violations, targets.size());
    }
}
