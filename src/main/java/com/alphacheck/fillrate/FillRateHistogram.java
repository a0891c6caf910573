package com.alphacheck.fillrate;

import java.util.List;
import lombok.Value;

/**
 * Equal-width histogram over the observed range. When every value is identical the range
 * is widened to value +/- 0.5 so that the bins stay non-degenerate.
 */
@Value
public class FillRateHistogram {

    public static final int DEFAULT_BINS = 20;

    double lowerBound;
    double upperBound;
    int[] counts;

    public static FillRateHistogram of(List<Double> values, int bins) {
        if (values.isEmpty()) {
            return new FillRateHistogram(0, 0, new int[bins]);
        }
        double min = values.stream().mapToDouble(Double::doubleValue).min().orElse(0);
        double max = values.stream().mapToDouble(Double::doubleValue).max().orElse(0);
        if (min == max) {
            min -= 0.5;
            max += 0.5;
        }
        double width = (max - min) / bins;
        int[] counts = new int[bins];
        for (double value : values) {
            int bin = (int) ((value - min) / width);
            // the top edge belongs to the last bin
            counts[Math.min(bin, bins - 1)]++;
        }
        return new FillRateHistogram(min, max, counts);
    }

    public int getTotal() {
        int total = 0;
        for (int count : counts) {
            total += count;
        }
        return total;
    }
}
