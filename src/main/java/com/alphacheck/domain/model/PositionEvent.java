package com.alphacheck.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Real-time position snapshot of one trader in one ticker at one time bucket.
 *
 * <p>{@code availableSellableVolume} is the upstream T+1-aware sellable quantity. It is
 * null when the upstream feed did not populate it; the T+1 checker then falls back to
 * its own settled/unsettled ledger (when virtual positions are supplied).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionEvent {

    private String participantId;
    private long time;
    private String ticker;

    /** Net position: long minus short. */
    private double currentPosition;

    private double longPosition;
    private double shortPosition;

    /** Null = not provided by upstream. */
    private Double availableSellableVolume;

    public TimeTicker timeTicker() {
        return new TimeTicker(time, ticker);
    }

    public ParticipantTicker participantTicker() {
        return new ParticipantTicker(participantId, ticker);
    }
}
