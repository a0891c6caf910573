package com.alphacheck.settlement;

import com.alphacheck.domain.model.ValidationDataset;

/**
 * One way of deciding how much inventory is sellable under T+1 at each bucket.
 *
 * <p>The two implementations are alternatives selected by which upstream data is present,
 * never combined in one run.
 */
public interface SettlementStrategy {

    String getName();

    /** True when the dataset carries the data this strategy reads. */
    boolean supports(ValidationDataset dataset);

    SettlementOutcome evaluate(ValidationDataset dataset, double tolerance);
}
