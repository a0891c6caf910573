package com.alphacheck.domain.model;

import com.alphacheck.domain.enums.Phase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A target position emitted at one pipeline stage.
 *
 * <p>The same shape is used for PM signals, merged group targets and per-trader split
 * targets; {@link #phase} tells them apart. {@code targetVolume} is the absolute target
 * position (not a delta), in shares.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlphaEvent {

    private Phase phase;

    /** PM id, merge group id or trader id depending on the phase. */
    private String participantId;

    /** HHMMSSmmm bucket, or TradingTime.PREV_CLOSE. */
    private long time;

    private String ticker;
    private double targetVolume;

    public TimeTicker timeTicker() {
        return new TimeTicker(time, ticker);
    }

    public ParticipantTicker participantTicker() {
        return new ParticipantTicker(participantId, ticker);
    }
}
