package com.alphacheck.checker;

import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.domain.model.ValidationDataset;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Coarse per-bucket reconciliation: total merged volume equals total split volume for
 * every time bucket, across all tickers.
 */
public class AlphaSumConsistencyChecker implements Checker {

    private final CheckerSettings settings;

    public AlphaSumConsistencyChecker(CheckerSettings settings) {
        this.settings = settings;
    }

    @Override
    public String getName() {
        return "Alpha Sum Consistency";
    }

    @Override
    public CheckResult check(ValidationDataset dataset) {
        SortedMap<Long, Double> mergedSums = VolumeSums.byTime(dataset.getMergedSignals());
        SortedMap<Long, Double> splitSums = VolumeSums.byTime(dataset.getSplitSignals());

        SortedSet<Long> times = new TreeSet<>(mergedSums.keySet());
        times.addAll(splitSums.keySet());

        List<String> mismatches = new ArrayList<>();
        for (Long time : times) {
            double mergedSum = mergedSums.getOrDefault(time, 0.0);
            double splitSum = splitSums.getOrDefault(time, 0.0);
            if (VolumeSums.differs(mergedSum, splitSum, settings.getTolerance())) {
                mismatches.add(String.format(
                        "time=%s: merged_sum=%s, split_sum=%s",
                        DetailLines.time(time), DetailLines.volume(mergedSum), DetailLines.volume(splitSum)));
            }
        }

        if (mismatches.isEmpty()) {
            return CheckResult.pass(
                    getName(), "All " + DetailLines.plural(times.size(), "time event") + " have consistent alpha sums");
        }
        return CheckResult.fail(
                getName(),
                "Found " + DetailLines.plural(mismatches.size(), "time event") + " with sum mismatches",
                mismatches);
    }
}
