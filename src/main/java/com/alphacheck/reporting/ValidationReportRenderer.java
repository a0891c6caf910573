package com.alphacheck.reporting;

import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.domain.model.DatasetSummary;
import com.alphacheck.fillrate.AnalysisResult;
import com.alphacheck.service.ValidationReport;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Plain-text rendering of reports for logs and the startup run. No ANSI colors.
 */
@Component
public class ValidationReportRenderer {

    static final String RULE = "=".repeat(60);

    public List<String> render(ValidationReport report) {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("ALPHA VALIDATION RESULTS");
        lines.add(RULE);
        lines.add("Total Checks: " + report.getTotal());
        lines.add("Passed: " + report.getPassed());
        lines.add("Failed: " + report.getFailed());
        lines.add("Warnings: " + report.getWarned());
        lines.add("Errors: " + report.getErrored());
        lines.add("");

        for (CheckResult result : report.getResults()) {
            lines.add("[" + result.getStatus() + "] " + result.getCheckerName());
            lines.add("    " + result.getMessage());
            if (result.hasDetails()) {
                lines.add("    Details:");
                result.getDetails().stream()
                        .filter(line -> !line.isBlank())
                        .forEach(line -> lines.add("      " + line));
            }
            lines.add("");
        }

        lines.add(verdict(report));
        return lines;
    }

    public String renderText(ValidationReport report) {
        return String.join(System.lineSeparator(), render(report));
    }

    public List<String> renderSummary(DatasetSummary summary) {
        List<String> lines = new ArrayList<>();
        lines.add("Data summary:");
        for (DatasetSummary.TableSummary table : summary.getTables()) {
            lines.add(String.format(
                    "  %-17s %6d records, %4d time buckets, %4d tickers",
                    table.name(), table.rows(), table.timeBuckets(), table.tickers()));
        }
        return lines;
    }

    public List<String> renderAnalysis(AnalysisResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("[" + result.getView() + "] " + result.getAnalyzerName());
        lines.add("    " + result.getSummary());
        result.getDetails().forEach(line -> lines.add("      " + line));
        return lines;
    }

    private static String verdict(ValidationReport report) {
        int critical = report.getFailed() + report.getErrored();
        if (critical > 0) {
            return "ANALYSIS FAILED - " + critical + " critical issues (" + report.getSummaryLine() + ")";
        }
        if (report.getWarned() > 0) {
            return "ANALYSIS COMPLETED WITH WARNINGS - " + report.getWarned() + " warnings ("
                    + report.getSummaryLine() + ")";
        }
        return "ALL CHECKS PASSED (" + report.getSummaryLine() + ")";
    }
}
