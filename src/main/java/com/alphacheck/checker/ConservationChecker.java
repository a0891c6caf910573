package com.alphacheck.checker;

import com.alphacheck.domain.TradingTime;
import com.alphacheck.domain.enums.ConservationViolationType;
import com.alphacheck.domain.model.AlphaEvent;
import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.domain.model.TimeTicker;
import com.alphacheck.domain.model.ValidationDataset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies that volume is conserved through both pipeline phases.
 *
 * <p>Phase 1 (PM to Merged) and phase 2 (Merged to Split) are compared per (time, ticker)
 * over the union of keys on both sides; a key missing on one side counts as 0. At
 * PREV_CLOSE a PM without a closing row contributes 0 by rule, which the union already
 * expresses; the diagnostic names the contributing and defaulted PMs.
 *
 * <p>Split keys without any merged input are reported as orphans rather than as an
 * ordinary mismatch. Groups split across an unexpected number of traders are warnings:
 * they alone downgrade the result to WARN, never to FAIL.
 */
public class ConservationChecker implements Checker {

    private static final Logger log = LoggerFactory.getLogger(ConservationChecker.class);

    private final CheckerSettings settings;

    public ConservationChecker(CheckerSettings settings) {
        this.settings = settings;
    }

    @Override
    public String getName() {
        return "Merge Engine Conservation";
    }

    @Override
    public CheckResult check(ValidationDataset dataset) {
        List<ConservationViolation> failures = new ArrayList<>();
        failures.addAll(checkPmToMerged(dataset.getPmSignals(), dataset.getMergedSignals()));
        failures.addAll(checkMergedToSplit(dataset.getMergedSignals(), dataset.getSplitSignals()));
        List<ConservationViolation> warnings = checkAllocationCardinality(dataset.getSplitSignals());

        String validated = String.format(
                "Validated %d group merges and %d trader allocations",
                dataset.getMergedSignals().size(),
                dataset.getSplitSignals().size());

        if (failures.isEmpty() && warnings.isEmpty()) {
            return CheckResult.pass(getName(), "All merge engine volumes are conserved. " + validated);
        }

        List<String> details = new ArrayList<>();
        details.add(validated);
        failures.forEach(v -> details.add(v.describe()));
        warnings.forEach(v -> details.add(v.describe()));

        if (failures.isEmpty()) {
            log.warn("Conservation holds with {} allocation warnings", warnings.size());
            return CheckResult.warn(
                    getName(),
                    "Merge engine validation passed with " + DetailLines.plural(warnings.size(), "warning"),
                    details);
        }
        log.warn("Conservation broken: {} violations, {} warnings", failures.size(), warnings.size());
        return CheckResult.fail(
                getName(),
                String.format(
                        "Found %s and %s",
                        DetailLines.plural(failures.size(), "merge engine violation"),
                        DetailLines.plural(warnings.size(), "warning")),
                details);
    }

    // ---- phase 1 ----

    List<ConservationViolation> checkPmToMerged(List<AlphaEvent> pm, List<AlphaEvent> merged) {
        SortedMap<TimeTicker, Double> pmSums = VolumeSums.byTimeAndTicker(pm);
        SortedMap<TimeTicker, Double> mergedSums = VolumeSums.byTimeAndTicker(merged);
        Set<String> allPms = pm.stream().map(AlphaEvent::getParticipantId).collect(Collectors.toCollection(TreeSet::new));

        Set<TimeTicker> keys = new TreeSet<>(pmSums.keySet());
        keys.addAll(mergedSums.keySet());

        List<ConservationViolation> violations = new ArrayList<>();
        for (TimeTicker key : keys) {
            double pmTotal = pmSums.getOrDefault(key, 0.0);
            double mergedTotal = mergedSums.getOrDefault(key, 0.0);
            if (!VolumeSums.differs(pmTotal, mergedTotal, settings.getTolerance())) {
                continue;
            }
            violations.add(ConservationViolation.builder()
                    .type(ConservationViolationType.PM_TO_MERGED)
                    .time(key.time())
                    .ticker(key.ticker())
                    .upstreamTotal(pmTotal)
                    .downstreamTotal(mergedTotal)
                    .note(TradingTime.isPrevClose(key.time()) ? closingBreakdown(pm, key, allPms) : null)
                    .build());
        }
        return violations;
    }

    private String closingBreakdown(List<AlphaEvent> pm, TimeTicker key, Set<String> allPms) {
        SortedMap<String, Double> contributions = new TreeMap<>();
        for (AlphaEvent event : pm) {
            if (event.timeTicker().equals(key)) {
                contributions.merge(event.getParticipantId(), event.getTargetVolume(), Double::sum);
            }
        }
        Set<String> defaulted = new TreeSet<>(allPms);
        defaulted.removeAll(contributions.keySet());

        String from = contributions.isEmpty()
                ? "none"
                : contributions.entrySet().stream()
                        .map(e -> e.getKey() + ": " + DetailLines.volume(e.getValue()))
                        .collect(Collectors.joining(", "));
        String missing = defaulted.isEmpty() ? "none" : String.join(", ", defaulted);
        return "from: " + from + "; missing PMs default to 0: " + missing;
    }

    // ---- phase 2 ----

    List<ConservationViolation> checkMergedToSplit(List<AlphaEvent> merged, List<AlphaEvent> split) {
        SortedMap<TimeTicker, Double> mergedSums = VolumeSums.byTimeAndTicker(merged);
        SortedMap<TimeTicker, Double> splitSums = VolumeSums.byTimeAndTicker(split);

        List<ConservationViolation> violations = new ArrayList<>();
        for (Map.Entry<TimeTicker, Double> entry : mergedSums.entrySet()) {
            double splitTotal = splitSums.getOrDefault(entry.getKey(), 0.0);
            if (VolumeSums.differs(entry.getValue(), splitTotal, settings.getTolerance())) {
                violations.add(ConservationViolation.builder()
                        .type(ConservationViolationType.MERGED_TO_SPLIT)
                        .time(entry.getKey().time())
                        .ticker(entry.getKey().ticker())
                        .upstreamTotal(entry.getValue())
                        .downstreamTotal(splitTotal)
                        .build());
            }
        }
        for (Map.Entry<TimeTicker, Double> entry : splitSums.entrySet()) {
            if (!mergedSums.containsKey(entry.getKey())) {
                violations.add(ConservationViolation.builder()
                        .type(ConservationViolationType.ORPHANED_SPLIT)
                        .time(entry.getKey().time())
                        .ticker(entry.getKey().ticker())
                        .upstreamTotal(0)
                        .downstreamTotal(entry.getValue())
                        .build());
            }
        }
        return violations;
    }

    // ---- allocation rule ----

    List<ConservationViolation> checkAllocationCardinality(List<AlphaEvent> split) {
        Integer expected = settings.getTradersPerGroup();
        if (expected == null) {
            return List.of();
        }
        SortedMap<TimeTicker, Set<String>> traders = new TreeMap<>();
        for (AlphaEvent event : split) {
            traders.computeIfAbsent(event.timeTicker(), k -> new TreeSet<>()).add(event.getParticipantId());
        }
        List<ConservationViolation> warnings = new ArrayList<>();
        traders.forEach((key, ids) -> {
            if (ids.size() != expected) {
                warnings.add(ConservationViolation.builder()
                        .type(ConservationViolationType.ALLOCATION_CARDINALITY)
                        .time(key.time())
                        .ticker(key.ticker())
                        .upstreamTotal(expected)
                        .downstreamTotal(ids.size())
                        .build());
            }
        });
        return warnings;
    }
}
