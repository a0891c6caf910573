package com.alphacheck.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Row, time-bucket and ticker counts per loaded table. Absent tables report zeros. */
@Getter
@Builder
public class DatasetSummary {

    private final List<TableSummary> tables;
    private final boolean mergeStagePresent;
    private final boolean marketDataPresent;
    private final boolean virtualPositionsPresent;

    public TableSummary table(String name) {
        return tables.stream()
                .filter(t -> t.name().equals(name))
                .findFirst()
                .orElse(new TableSummary(name, 0, 0, 0));
    }

    public record TableSummary(String name, int rows, int timeBuckets, int tickers) {}
}
