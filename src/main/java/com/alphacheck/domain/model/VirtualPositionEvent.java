package com.alphacheck.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the optional PM virtual-position table. The PREV_CLOSE rows seed the
 * settled quantity of the T+1 ledger.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VirtualPositionEvent {

    private String participantId;
    private long time;
    private String ticker;
    private double virtualPosition;
}
