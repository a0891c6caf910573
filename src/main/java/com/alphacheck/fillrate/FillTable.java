package com.alphacheck.fillrate;

import java.util.List;
import java.util.function.Predicate;

/**
 * The per-trade fill table computed once per dataset. Views are filters over it, so every
 * view pairs buckets the same way.
 */
public class FillTable {

    private final List<FillRecord> records;

    public FillTable(List<FillRecord> records) {
        this.records = List.copyOf(records);
    }

    public List<FillRecord> all() {
        return records;
    }

    public List<FillRecord> arrivingAt(long time) {
        return filter(r -> r.getTimeTo() == time);
    }

    public List<FillRecord> forTicker(String ticker) {
        return filter(r -> r.getTicker().equals(ticker));
    }

    public List<FillRecord> forBucket(long time, String ticker) {
        return filter(r -> r.getTimeTo() == time && r.getTicker().equals(ticker));
    }

    public int size() {
        return records.size();
    }

    private List<FillRecord> filter(Predicate<FillRecord> predicate) {
        return records.stream().filter(predicate).toList();
    }
}
