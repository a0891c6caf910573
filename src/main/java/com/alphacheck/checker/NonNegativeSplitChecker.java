package com.alphacheck.checker;

import com.alphacheck.domain.model.AlphaEvent;
import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.domain.model.ValidationDataset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/** Split targets are long-only: every trader target volume must be non-negative. */
public class NonNegativeSplitChecker implements Checker {

    private final CheckerSettings settings;

    public NonNegativeSplitChecker(CheckerSettings settings) {
        this.settings = settings;
    }

    @Override
    public String getName() {
        return "Non-Negative Split Alpha";
    }

    @Override
    public CheckResult check(ValidationDataset dataset) {
        List<AlphaEvent> split = dataset.getSplitSignals();

        // Full scan so the reported count is exact.
        SortedMap<Long, List<AlphaEvent>> negativesByTime = new TreeMap<>();
        int negativeCount = 0;
        for (AlphaEvent event : split) {
            if (event.getTargetVolume() < 0) {
                negativesByTime.computeIfAbsent(event.getTime(), t -> new ArrayList<>()).add(event);
                negativeCount++;
            }
        }

        if (negativeCount == 0) {
            long timeCount = split.stream().map(AlphaEvent::getTime).distinct().count();
            return CheckResult.pass(
                    getName(),
                    String.format(
                            "All %d split alpha volumes are non-negative across %d time events",
                            split.size(), timeCount));
        }

        List<String> details = new ArrayList<>();
        DetailLines.appendGrouped(
                details,
                negativesByTime,
                time -> {
                    List<AlphaEvent> rows = negativesByTime.get(time);
                    double min = rows.stream().min(Comparator.comparingDouble(AlphaEvent::getTargetVolume))
                            .map(AlphaEvent::getTargetVolume)
                            .orElse(0.0);
                    return String.format(
                            "time=%s: %s (min=%s)",
                            DetailLines.time(time),
                            DetailLines.plural(rows.size(), "negative volume"),
                            DetailLines.volume(min));
                },
                e -> String.format(
                        "alphaid=%s, ticker=%s, volume=%s",
                        e.getParticipantId(), e.getTicker(), DetailLines.volume(e.getTargetVolume())),
                settings.getMaxDetailRows());

        return CheckResult.fail(
                getName(),
                String.format(
                        "Found %d negative split volumes across %d time events",
                        negativeCount, negativesByTime.size()),
                details);
    }
}
