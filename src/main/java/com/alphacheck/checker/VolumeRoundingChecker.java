package com.alphacheck.checker;

import com.alphacheck.domain.model.AlphaEvent;
import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.domain.model.PositionEvent;
import com.alphacheck.domain.model.ValidationDataset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Trade volumes implied by split targets must be whole lots.
 *
 * <p>Each split target is joined to the snapshot with the same (time, trader, ticker);
 * a missing snapshot means position 0. Duplicate rows on either side are summed per key. The remainder is taken modulo the lot size with a
 * floored (always non-negative) result, and compared against the tolerance on both sides
 * so that 99.9999999 counts as a whole lot.
 */
public class VolumeRoundingChecker implements Checker {

    private final CheckerSettings settings;

    public VolumeRoundingChecker(CheckerSettings settings) {
        this.settings = settings;
    }

    @Override
    public String getName() {
        return "Volume Rounding (" + settings.getLotSize() + " shares)";
    }

    @Override
    public CheckResult check(ValidationDataset dataset) {
        Map<String, Double> positions = new HashMap<>();
        for (PositionEvent position : dataset.getPositions()) {
            positions.merge(joinKey(position.getTime(), position.getParticipantId(), position.getTicker()),
                    position.getCurrentPosition(), Double::sum);
        }

        // duplicate target rows for one trader form a single target
        Map<String, AlphaEvent> targets = new LinkedHashMap<>();
        for (AlphaEvent split : dataset.getSplitSignals()) {
            targets.merge(joinKey(split.getTime(), split.getParticipantId(), split.getTicker()), split,
                    VolumeRoundingChecker::combine);
        }

        SortedMap<Long, List<UnroundedTrade>> unroundedByTime = new TreeMap<>();
        int unroundedCount = 0;
        for (Map.Entry<String, AlphaEvent> entry : targets.entrySet()) {
            AlphaEvent split = entry.getValue();
            double position = positions.getOrDefault(entry.getKey(), 0.0);
            double tradeVolume = split.getTargetVolume() - position;
            double remainder = floorRemainder(tradeVolume);
            if (Math.min(remainder, settings.getLotSize() - remainder) > settings.getTolerance()) {
                unroundedByTime
                        .computeIfAbsent(split.getTime(), t -> new ArrayList<>())
                        .add(new UnroundedTrade(split, position, tradeVolume, remainder));
                unroundedCount++;
            }
        }

        long timeCount = dataset.getSplitSignals().stream().map(AlphaEvent::getTime).distinct().count();
        if (unroundedCount == 0) {
            return CheckResult.pass(
                    getName(),
                    String.format(
                            "All %d trade volumes are properly rounded to %d shares across %d time events",
                            targets.size(), settings.getLotSize(), timeCount));
        }

        List<String> details = new ArrayList<>();
        DetailLines.appendGrouped(
                details,
                unroundedByTime,
                time -> String.format(
                        "time=%s: %s",
                        DetailLines.time(time),
                        DetailLines.plural(unroundedByTime.get(time).size(), "unrounded volume")),
                UnroundedTrade::describe,
                settings.getMaxDetailRows());

        return CheckResult.fail(
                getName(),
                String.format(
                        "Found %d trade volumes not rounded to %d shares across %d time events",
                        unroundedCount, settings.getLotSize(), unroundedByTime.size()),
                details);
    }

    double floorRemainder(double tradeVolume) {
        int lot = settings.getLotSize();
        return tradeVolume - lot * Math.floor(tradeVolume / lot);
    }

    private static AlphaEvent combine(AlphaEvent first, AlphaEvent second) {
        return AlphaEvent.builder()
                .phase(first.getPhase())
                .participantId(first.getParticipantId())
                .time(first.getTime())
                .ticker(first.getTicker())
                .targetVolume(first.getTargetVolume() + second.getTargetVolume())
                .build();
    }

    private static String joinKey(long time, String participantId, String ticker) {
        return time + "|" + participantId + "|" + ticker;
    }

    private record UnroundedTrade(AlphaEvent split, double position, double tradeVolume, double remainder) {

        String describe() {
            return String.format(
                    "sid=%s, ticker=%s: target=%s, pos=%s, volume=%s (remainder=%s)",
                    split.getParticipantId(),
                    split.getTicker(),
                    DetailLines.volume(split.getTargetVolume()),
                    DetailLines.volume(position),
                    DetailLines.volume(tradeVolume),
                    DetailLines.volume(remainder));
        }
    }
}
