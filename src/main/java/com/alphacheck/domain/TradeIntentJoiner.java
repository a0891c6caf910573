package com.alphacheck.domain;

import com.alphacheck.domain.model.AlphaEvent;
import com.alphacheck.domain.model.ParticipantTicker;
import com.alphacheck.domain.model.PositionEvent;
import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.domain.vo.TradeIntent;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pairs each split target with the position snapshots of its own bucket and the next one.
 *
 * <p>The "next" bucket is global rather than per participant. Two bucket sets are in use:
 * <ul>
 *   <li>{@link #joinOnSnapshotTimes}: ascending intraday snapshot times (direction checker)</li>
 *   <li>{@link #joinOnTargetTimes}: ascending intraday split-target times (fill rate), so a
 *       target is measured over its whole interval up to the next target</li>
 * </ul>
 * A step is produced only when the target at t, the position at t and the position at t+1
 * all exist (inner join). Duplicate rows for one (time, participant, ticker) are summed.
 */
public final class TradeIntentJoiner {

    private TradeIntentJoiner() {}

    public static List<TradeIntent> joinOnSnapshotTimes(ValidationDataset dataset) {
        return join(dataset, dataset.intradayPositionTimes());
    }

    public static List<TradeIntent> joinOnTargetTimes(ValidationDataset dataset) {
        return join(dataset, dataset.intradayTargetTimes());
    }

    private static List<TradeIntent> join(ValidationDataset dataset, List<Long> times) {
        if (times.size() < 2) {
            return List.of();
        }

        Map<Long, Map<ParticipantTicker, Double>> positionsByTime = new HashMap<>();
        for (PositionEvent position : dataset.getPositions()) {
            positionsByTime
                    .computeIfAbsent(position.getTime(), t -> new HashMap<>())
                    .merge(position.participantTicker(), position.getCurrentPosition(), Double::sum);
        }

        Map<Long, Map<ParticipantTicker, Double>> targetsByTime = new HashMap<>();
        for (AlphaEvent split : dataset.getSplitSignals()) {
            if (TradingTime.isIntraday(split.getTime())) {
                targetsByTime
                        .computeIfAbsent(split.getTime(), t -> new TreeMap<>())
                        .merge(split.participantTicker(), split.getTargetVolume(), Double::sum);
            }
        }

        List<TradeIntent> intents = new ArrayList<>();
        for (int i = 0; i < times.size() - 1; i++) {
            long from = times.get(i);
            long to = times.get(i + 1);
            Map<ParticipantTicker, Double> targets = targetsByTime.getOrDefault(from, Map.of());
            Map<ParticipantTicker, Double> current = positionsByTime.getOrDefault(from, Map.of());
            Map<ParticipantTicker, Double> next = positionsByTime.getOrDefault(to, Map.of());

            for (Map.Entry<ParticipantTicker, Double> target : targets.entrySet()) {
                Double currentPosition = current.get(target.getKey());
                Double nextPosition = next.get(target.getKey());
                if (currentPosition == null || nextPosition == null) {
                    continue;
                }
                intents.add(TradeIntent.builder()
                        .participantId(target.getKey().participantId())
                        .ticker(target.getKey().ticker())
                        .timeFrom(from)
                        .timeTo(to)
                        .targetVolume(target.getValue())
                        .currentPosition(currentPosition)
                        .nextPosition(nextPosition)
                        .build());
            }
        }
        return intents;
    }
}
