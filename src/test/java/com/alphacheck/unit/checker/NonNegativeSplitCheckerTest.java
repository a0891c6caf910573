package com.alphacheck.unit.checker;

import static com.alphacheck.fixtures.DatasetBuilder.T1;
import static com.alphacheck.fixtures.DatasetBuilder.T2;
import static com.alphacheck.fixtures.DatasetBuilder.dataset;
import static org.assertj.core.api.Assertions.assertThat;

import com.alphacheck.checker.CheckerSettings;
import com.alphacheck.checker.NonNegativeSplitChecker;
import com.alphacheck.domain.enums.CheckStatus;
import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.fixtures.DatasetBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NonNegativeSplitCheckerTest {

    private final NonNegativeSplitChecker checker = new NonNegativeSplitChecker(CheckerSettings.defaults());

    @Test
    @DisplayName("Zero and positive split volumes pass")
    void passesForNonNegativeVolumes() {
        CheckResult result = checker.check(dataset()
                .split("S1", T1, "AAA", 0)
                .split("S2", T1, "AAA", 100)
                .split("S1", T2, "AAA", 100)
                .build());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.PASS);
        assertThat(result.getMessage()).isEqualTo("All 3 split alpha volumes are non-negative across 2 time events");
    }

    @Test
    @DisplayName("Counts are exact even when the detail listing is truncated")
    void countsEveryViolation() {
        DatasetBuilder builder = dataset();
        for (int i = 0; i < 7; i++) {
            builder.split("S" + i, T1, "AAA", -100 - i);
        }
        builder.split("S1", T2, "BBB", -1);

        CheckResult result = checker.check(builder.build());

        assertThat(result.getStatus()).isEqualTo(CheckStatus.FAIL);
        assertThat(result.getMessage()).isEqualTo("Found 8 negative split volumes across 2 time events");
        assertThat(result.getDetails())
                .contains("  time=93000000 (9:30): 7 negative volumes (min=-106)")
                .contains("    ... and 2 more")
                .contains("  time=93100000 (9:31): 1 negative volume (min=-1)");
    }
}
