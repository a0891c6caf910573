package com.alphacheck.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Market snapshot for a ticker. Carried for reporting only; no checker reads it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketEvent {

    private long time;
    private String ticker;
    private BigDecimal lastPrice;
    private BigDecimal prevClosePrice;
}
