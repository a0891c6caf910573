package com.alphacheck.domain.enums;

/** Position moved against the direction implied by the target. */
public enum DirectionViolationType {

    /** Buy intent (target above position) but the next snapshot shows a lower position. */
    BUY_DECREASED,

    /** Sell intent (target below position) but the next snapshot shows a higher position. */
    SELL_INCREASED
}
