package com.alphacheck.domain.model;

import java.util.Comparator;

/** Grouping key for per-participant state (one trader or group in one ticker). */
public record ParticipantTicker(String participantId, String ticker) implements Comparable<ParticipantTicker> {

    private static final Comparator<ParticipantTicker> ORDER =
            Comparator.comparing(ParticipantTicker::participantId).thenComparing(ParticipantTicker::ticker);

    @Override
    public int compareTo(ParticipantTicker other) {
        return ORDER.compare(this, other);
    }
}
