package com.alphacheck.fillrate;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Descriptive statistics over analyzable fill rates. {@code std} is the sample standard
 * deviation and is 0 for fewer than two values.
 */
@Value
@Builder
public class FillStatistics {

    int count;
    double mean;
    double std;
    double min;
    double max;

    public static FillStatistics of(List<Double> values) {
        if (values.isEmpty()) {
            return FillStatistics.builder()
                    .count(0)
                    .mean(Double.NaN)
                    .std(0)
                    .min(Double.NaN)
                    .max(Double.NaN)
                    .build();
        }
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
        double std = 0;
        if (values.size() > 1) {
            double squares = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum();
            std = Math.sqrt(squares / (values.size() - 1));
        }
        return FillStatistics.builder()
                .count(values.size())
                .mean(mean)
                .std(std)
                .min(values.stream().mapToDouble(Double::doubleValue).min().orElse(Double.NaN))
                .max(values.stream().mapToDouble(Double::doubleValue).max().orElse(Double.NaN))
                .build();
    }
}
