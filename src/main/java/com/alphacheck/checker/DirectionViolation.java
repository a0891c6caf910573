package com.alphacheck.checker;

import com.alphacheck.domain.enums.DirectionViolationType;
import com.alphacheck.domain.vo.TradeIntent;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class DirectionViolation {

    private final DirectionViolationType type;
    private final TradeIntent trade;

    public String describe() {
        String side = type == DirectionViolationType.BUY_DECREASED ? "buy" : "sell";
        String moved = type == DirectionViolationType.BUY_DECREASED ? "decreased" : "increased";
        return String.format(
                "%s/%s: %s -> %s (intended %s %s, but position %s)",
                trade.getParticipantId(),
                trade.getTicker(),
                DetailLines.volume(trade.getCurrentPosition()),
                DetailLines.volume(trade.getNextPosition()),
                side,
                DetailLines.volume(trade.getIntendedTrade()),
                moved);
    }
}
