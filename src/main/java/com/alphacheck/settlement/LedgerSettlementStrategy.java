package com.alphacheck.settlement;

import com.alphacheck.domain.TradingTime;
import com.alphacheck.domain.model.AlphaEvent;
import com.alphacheck.domain.model.TimeTicker;
import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.domain.model.VirtualPosition;
import com.alphacheck.domain.model.VirtualPositionEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Tracks settled vs unsettled inventory per ticker through the day.
 *
 * <p>Each ticker opens with the PM virtual positions at PREV_CLOSE as settled inventory
 * (0 when absent). Merged group targets are then replayed in ascending time order and
 * treated as the achieved position of their bucket:
 * <ul>
 *   <li>sell: the required quantity must fit in the settled inventory, which it consumes</li>
 *   <li>buy: the position grows but settled inventory does not</li>
 * </ul>
 * A blocked sell leaves settled inventory untouched; the position still moves to target.
 */
public class LedgerSettlementStrategy implements SettlementStrategy {

    @Override
    public String getName() {
        return "ledger";
    }

    @Override
    public boolean supports(ValidationDataset dataset) {
        return dataset.hasVirtualPositions();
    }

    @Override
    public SettlementOutcome evaluate(ValidationDataset dataset, double tolerance) {
        Map<String, VirtualPosition> ledgers = openLedgers(dataset.getVirtualPositions());

        SortedMap<TimeTicker, Double> targets = new TreeMap<>();
        for (AlphaEvent merged : dataset.getMergedSignals()) {
            if (TradingTime.isIntraday(merged.getTime())) {
                targets.merge(merged.timeTicker(), merged.getTargetVolume(), Double::sum);
            }
        }

        List<SettlementViolation> violations = new ArrayList<>();
        for (Map.Entry<TimeTicker, Double> entry : targets.entrySet()) {
            String ticker = entry.getKey().ticker();
            double target = entry.getValue();
            VirtualPosition ledger = ledgers.computeIfAbsent(ticker, t -> VirtualPosition.opening(t, 0));

            double currentBefore = ledger.getCurrentQuantity();
            double tradeVolume = target - currentBefore;
            if (tradeVolume < -tolerance) {
                double requiredSell = -tradeVolume;
                double sellable = ledger.getSellableQuantity();
                if (requiredSell > sellable + tolerance) {
                    violations.add(SettlementViolation.builder()
                            .time(entry.getKey().time())
                            .ticker(ticker)
                            .target(target)
                            .currentBefore(currentBefore)
                            .requiredSell(requiredSell)
                            .availableSettled(sellable)
                            .build());
                } else {
                    ledger.releaseSettled(requiredSell);
                }
            }
            ledger.moveTo(target);
        }
        return new SettlementOutcome(violations, targets.size());
    }

    private static Map<String, VirtualPosition> openLedgers(List<VirtualPositionEvent> virtualPositions) {
        Map<String, Double> closing = new TreeMap<>();
        for (VirtualPositionEvent event : virtualPositions) {
            if (TradingTime.isPrevClose(event.getTime())) {
                closing.merge(event.getTicker(), event.getVirtualPosition(), Double::sum);
            }
        }
        Map<String, VirtualPosition> ledgers = new TreeMap<>();
        closing.forEach((ticker, quantity) -> ledgers.put(ticker, VirtualPosition.opening(ticker, quantity)));
        return ledgers;
    }
}
