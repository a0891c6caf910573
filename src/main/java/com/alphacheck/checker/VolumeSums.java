package com.alphacheck.checker;

import com.alphacheck.domain.model.AlphaEvent;
import com.alphacheck.domain.model.TimeTicker;
import java.util.Collection;
import java.util.SortedMap;
import java.util.TreeMap;

final class VolumeSums {

    private VolumeSums() {}

    static SortedMap<TimeTicker, Double> byTimeAndTicker(Collection<AlphaEvent> events) {
        SortedMap<TimeTicker, Double> sums = new TreeMap<>();
        for (AlphaEvent event : events) {
            sums.merge(event.timeTicker(), event.getTargetVolume(), Double::sum);
        }
        return sums;
    }

    static SortedMap<Long, Double> byTime(Collection<AlphaEvent> events) {
        SortedMap<Long, Double> sums = new TreeMap<>();
        for (AlphaEvent event : events) {
            sums.merge(event.getTime(), event.getTargetVolume(), Double::sum);
        }
        return sums;
    }

    static boolean differs(double left, double right, double tolerance) {
        return Math.abs(left - right) > tolerance;
    }
}
