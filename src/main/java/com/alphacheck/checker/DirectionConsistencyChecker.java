package com.alphacheck.checker;

import com.alphacheck.domain.TradeIntentJoiner;
import com.alphacheck.domain.TradingTime;
import com.alphacheck.domain.enums.DirectionViolationType;
import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.domain.vo.TradeIntent;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A trader's position may only move in the direction its target asked for.
 *
 * <p>For each consecutive snapshot pair (t, t+1): a buy intent (target above position)
 * must not end with a lower position, a sell intent must not end with a higher one. Steps
 * whose intended trade is within tolerance of zero carry no obligation. PREV_CLOSE is
 * never part of a pair.
 */
public class DirectionConsistencyChecker implements Checker {

    private final CheckerSettings settings;

    public DirectionConsistencyChecker(CheckerSettings settings) {
        this.settings = settings;
    }

    @Override
    public String getName() {
        return "Trade Direction Consistency";
    }

    @Override
    public CheckResult check(ValidationDataset dataset) {
        double tolerance = settings.getTolerance();
        List<TradeIntent> trades = TradeIntentJoiner.joinOnSnapshotTimes(dataset);

        List<DirectionViolation> violations = new ArrayList<>();
        for (TradeIntent trade : trades) {
            DirectionViolationType type = classify(trade, tolerance);
            if (type != null) {
                violations.add(DirectionViolation.builder().type(type).trade(trade).build());
            }
        }

        if (violations.isEmpty()) {
            return CheckResult.pass(
                    getName(),
                    String.format(
                            "All %d trades follow correct direction consistency "
                                    + "(buy increases positions, sell decreases positions)",
                            trades.size()));
        }

        List<String> details = new ArrayList<>();
        appendSection(details, "BUY", violations, DirectionViolationType.BUY_DECREASED);
        appendSection(details, "SELL", violations, DirectionViolationType.SELL_INCREASED);
        return CheckResult.fail(
                getName(),
                String.format(
                        "Found %d direction consistency violations out of %d total trades",
                        violations.size(), trades.size()),
                details);
    }

    /** Null when the step is consistent or carries no directional obligation. */
    static DirectionViolationType classify(TradeIntent trade, double tolerance) {
        double intended = trade.getIntendedTrade();
        if (Math.abs(intended) < tolerance) {
            return null;
        }
        if (intended > 0 && trade.getNextPosition() < trade.getCurrentPosition() - tolerance) {
            return DirectionViolationType.BUY_DECREASED;
        }
        if (intended < 0 && trade.getNextPosition() > trade.getCurrentPosition() + tolerance) {
            return DirectionViolationType.SELL_INCREASED;
        }
        return null;
    }

    private void appendSection(
            List<String> details, String label, List<DirectionViolation> all, DirectionViolationType type) {
        SortedMap<Long, List<DirectionViolation>> byPeriod = new TreeMap<>();
        int count = 0;
        for (DirectionViolation violation : all) {
            if (violation.getType() == type) {
                byPeriod.computeIfAbsent(violation.getTrade().getTimeFrom(), t -> new ArrayList<>())
                        .add(violation);
                count++;
            }
        }
        if (count == 0) {
            return;
        }
        details.add(label + " direction violations (" + count + "):");
        DetailLines.appendGrouped(
                details,
                byPeriod,
                from -> {
                    List<DirectionViolation> rows = byPeriod.get(from);
                    long to = rows.get(0).getTrade().getTimeTo();
                    return TradingTime.format(from) + " -> " + TradingTime.format(to) + ": "
                            + DetailLines.plural(rows.size(), "violation");
                },
                DirectionViolation::describe,
                settings.getMaxDetailRows());
    }
}
