package com.alphacheck.api.controller;

import com.alphacheck.fillrate.AnalysisResult;
import com.alphacheck.fillrate.FillRateAnalyzer;
import com.alphacheck.fillrate.FillRateQuery;
import com.alphacheck.service.DatasetResolver;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the four fill-rate views. Times are arrival buckets in HHMMSSmmm form.
 */
@RestController
@RequestMapping("/api/fill-rate")
public class FillRateController {

    private final DatasetResolver datasetResolver;
    private final FillRateAnalyzer fillRateAnalyzer;

    public FillRateController(DatasetResolver datasetResolver, FillRateAnalyzer fillRateAnalyzer) {
        this.datasetResolver = datasetResolver;
        this.fillRateAnalyzer = fillRateAnalyzer;
    }

    @GetMapping("/overview")
    public AnalysisResult getOverview(@RequestParam(required = false) String dataDir) {
        return analyze(dataDir, FillRateQuery.overview());
    }

    @GetMapping("/time/{time}")
    public AnalysisResult getByTime(@PathVariable long time, @RequestParam(required = false) String dataDir) {
        return analyze(dataDir, FillRateQuery.byTime(time));
    }

    @GetMapping("/ticker/{ticker}")
    public AnalysisResult getByTicker(@PathVariable String ticker, @RequestParam(required = false) String dataDir) {
        return analyze(dataDir, FillRateQuery.byTicker(ticker));
    }

    @GetMapping("/deep")
    public AnalysisResult getDeep(
            @RequestParam long time, @RequestParam String ticker, @RequestParam(required = false) String dataDir) {
        return analyze(dataDir, FillRateQuery.deep(time, ticker));
    }

    private AnalysisResult analyze(String dataDir, FillRateQuery query) {
        return fillRateAnalyzer.analyze(datasetResolver.load(dataDir), query);
    }
}
