package com.alphacheck.settlement;

import com.alphacheck.checker.Checker;
import com.alphacheck.checker.CheckerSettings;
import com.alphacheck.checker.DetailLines;
import com.alphacheck.domain.enums.SettlementStrategyType;
import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.exception.CheckerConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforces the T+1 rule: a group may never sell inventory bought on the same trading day.
 *
 * <p>The sellable quantity comes from one of two strategies. With {@code AUTO} the ledger
 * is used when PM virtual positions were supplied, otherwise the upstream available-sellable
 * volume when any snapshot carries one. A strategy without its data is a configuration
 * fault and raises {@link CheckerConfigurationException}; it is never silently skipped.
 */
public class SettlementChecker implements Checker {

    private static final Logger log = LoggerFactory.getLogger(SettlementChecker.class);

    private final CheckerSettings settings;
    private final SettlementStrategy ledgerStrategy = new LedgerSettlementStrategy();
    private final SettlementStrategy availableSellableStrategy = new AvailableSellableSettlementStrategy();

    public SettlementChecker(CheckerSettings settings) {
        this.settings = settings;
    }

    @Override
    public String getName() {
        return "PM T+1 Sellable Constraint";
    }

    @Override
    public CheckResult check(ValidationDataset dataset) {
        SettlementStrategy strategy = resolveStrategy(dataset);
        log.debug("T+1 check using {} strategy", strategy.getName());

        SettlementOutcome outcome = strategy.evaluate(dataset, settings.getTolerance());
        if (outcome.getViolations().isEmpty()) {
            return CheckResult.pass(
                    getName(),
                    String.format(
                            "All %d merged alpha targets respect T+1 sellable constraints (%s)",
                            outcome.getTargetsChecked(), strategy.getName()));
        }

        SortedMap<Long, List<SettlementViolation>> byTime = new TreeMap<>();
        outcome.getViolations()
                .forEach(v -> byTime.computeIfAbsent(v.getTime(), t -> new ArrayList<>()).add(v));

        int total = outcome.getViolations().size();
        List<String> details = new ArrayList<>();
        details.add(String.format("Found %d T+1 constraint violations (%s):", total, strategy.getName()));
        DetailLines.appendGrouped(
                details,
                byTime,
                time -> "time=" + DetailLines.time(time) + ": "
                        + DetailLines.plural(byTime.get(time).size(), "violation"),
                SettlementViolation::describe,
                settings.getMaxDetailRows());

        return CheckResult.fail(
                getName(),
                String.format(
                        "Found %d T+1 constraint violations (total excess: %s)",
                        total, DetailLines.volume(outcome.getTotalExcess())),
                details);
    }

    SettlementStrategy resolveStrategy(ValidationDataset dataset) {
        SettlementStrategyType type = settings.getSettlementStrategy();
        return switch (type) {
            case LEDGER -> require(ledgerStrategy, dataset, "PM virtual position data not provided");
            case AVAILABLE_SELLABLE -> require(
                    availableSellableStrategy, dataset, "No position snapshot carries an available sellable volume");
            case AUTO -> {
                if (ledgerStrategy.supports(dataset)) {
                    yield ledgerStrategy;
                }
                if (availableSellableStrategy.supports(dataset)) {
                    yield availableSellableStrategy;
                }
                throw new CheckerConfigurationException(
                        "PM virtual position data not provided and no position snapshot carries an available"
                                + " sellable volume");
            }
        };
    }

    private static SettlementStrategy require(SettlementStrategy strategy, ValidationDataset dataset, String message) {
        if (!strategy.supports(dataset)) {
            throw new CheckerConfigurationException(message);
        }
        return strategy;
    }
}
