package com.alphacheck.service;

import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.fillrate.AnalysisResult;
import com.alphacheck.fillrate.FillRateAnalyzer;
import com.alphacheck.fillrate.FillRateQuery;
import com.alphacheck.reporting.ValidationReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Optional one-shot validation once the application is ready.
 *
 * <p>Enabled by {@code alphacheck.run-on-startup=true} together with
 * {@code alphacheck.data-dir}. Logs the data summary, the rendered report and the
 * fill-rate overview. A failure here is logged and leaves the REST API usable.
 */
@Component
public class ValidationStartupRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationStartupRunner.class);

    private final boolean runOnStartup;
    private final String dataDir;
    private final DatasetResolver datasetResolver;
    private final ValidationService validationService;
    private final FillRateAnalyzer fillRateAnalyzer;
    private final ValidationReportRenderer renderer;

    public ValidationStartupRunner(
            @Value("${alphacheck.run-on-startup:false}") boolean runOnStartup,
            @Value("${alphacheck.data-dir:}") String dataDir,
            DatasetResolver datasetResolver,
            ValidationService validationService,
            FillRateAnalyzer fillRateAnalyzer,
            ValidationReportRenderer renderer) {
        this.runOnStartup = runOnStartup;
        this.dataDir = dataDir;
        this.datasetResolver = datasetResolver;
        this.validationService = validationService;
        this.fillRateAnalyzer = fillRateAnalyzer;
        this.renderer = renderer;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!runOnStartup) {
            return;
        }
        if (dataDir == null || dataDir.isBlank()) {
            log.warn("alphacheck.run-on-startup is set but alphacheck.data-dir is empty, skipping startup run");
            return;
        }
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("Startup validation run failed: {}", e.getMessage(), e);
        }
    }

    void runOnce() {
        ValidationDataset dataset = datasetResolver.load(dataDir);
        renderer.renderSummary(dataset.summarize()).forEach(log::info);

        ValidationReport report = validationService.run(dataset);
        renderer.render(report).forEach(log::info);

        AnalysisResult overview = fillRateAnalyzer.analyze(dataset, FillRateQuery.overview());
        renderer.renderAnalysis(overview).forEach(log::info);
    }
}
