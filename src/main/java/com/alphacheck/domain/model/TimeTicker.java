package com.alphacheck.domain.model;

import java.util.Comparator;

/** Grouping key for per-bucket, per-ticker sums. Sorted by time, then ticker. */
public record TimeTicker(long time, String ticker) implements Comparable<TimeTicker> {

    private static final Comparator<TimeTicker> ORDER =
            Comparator.comparingLong(TimeTicker::time).thenComparing(TimeTicker::ticker);

    @Override
    public int compareTo(TimeTicker other) {
        return ORDER.compare(this, other);
    }
}
