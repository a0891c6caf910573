package com.alphacheck.domain.vo;

import lombok.Builder;
import lombok.Value;

/**
 * One participant/ticker step between two consecutive snapshot buckets: the split target
 * issued at {@code timeFrom}, the position held at {@code timeFrom} and the position
 * observed at the arrival bucket {@code timeTo}.
 */
@Value
@Builder
public class TradeIntent {

    String participantId;
    String ticker;
    long timeFrom;
    long timeTo;
    double targetVolume;
    double currentPosition;
    double nextPosition;

    /** Target minus position at the issuing bucket. Positive = buy. */
    public double getIntendedTrade() {
        return targetVolume - currentPosition;
    }

    /** Position change actually realized by the arrival bucket. */
    public double getActualTrade() {
        return nextPosition - currentPosition;
    }
}
