package com.alphacheck.unit.reporting;

import static com.alphacheck.fixtures.DatasetBuilder.dataset;
import static org.assertj.core.api.Assertions.assertThat;

import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.reporting.ValidationReportRenderer;
import com.alphacheck.service.ValidationReport;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ValidationReportRendererTest {

    private final ValidationReportRenderer renderer = new ValidationReportRenderer();

    private static ValidationReport report(CheckResult... results) {
        return ValidationReport.of(List.of(results), dataset().build().summarize(), LocalDateTime.now(), 5);
    }

    @Test
    @DisplayName("Header counts each status and detail lines are indented")
    void rendersHeaderAndDetails() {
        List<String> lines = renderer.render(report(
                CheckResult.pass("A", "all good"),
                CheckResult.fail("B", "Found 1 problem", List.of("line one", "", "line two"))));

        assertThat(lines).startsWith("=".repeat(60), "ALPHA VALIDATION RESULTS", "=".repeat(60));
        assertThat(lines).contains("Total Checks: 2", "Passed: 1", "Failed: 1", "Warnings: 0", "Errors: 0");
        assertThat(lines).containsSubsequence("[FAIL] B", "    Found 1 problem", "    Details:", "      line one",
                "      line two");
        assertThat(lines).doesNotContain("      ");
        assertThat(lines.get(lines.size() - 1)).isEqualTo("ANALYSIS FAILED - 1 critical issues (1 of 2 checkers passed)");
    }

    @Test
    @DisplayName("Warnings alone produce the warning verdict")
    void warningVerdict() {
        List<String> lines = renderer.render(report(CheckResult.warn("A", "hmm", List.of("x"))));

        assertThat(lines.get(lines.size() - 1))
                .isEqualTo("ANALYSIS COMPLETED WITH WARNINGS - 1 warnings (0 of 1 checkers passed)");
    }

    @Test
    @DisplayName("Clean run ends with the pass verdict")
    void passVerdict() {
        String text = renderer.renderText(report(CheckResult.pass("A", "ok")));

        assertThat(text).endsWith("ALL CHECKS PASSED (1 of 1 checkers passed)");
        assertThat(text).doesNotContain("Details:");
    }
}
