package com.alphacheck.api.controller;

import com.alphacheck.domain.model.DatasetSummary;
import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.service.DatasetResolver;
import com.alphacheck.service.ValidationReport;
import com.alphacheck.service.ValidationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for validation runs.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/validation/run} -- load a data directory and run every checker</li>
 *   <li>{@code GET /api/validation/summary} -- table counts of a data directory</li>
 * </ul>
 * {@code dataDir} is optional and falls back to {@code alphacheck.data-dir}.
 */
@RestController
@RequestMapping("/api/validation")
public class ValidationController {

    private final DatasetResolver datasetResolver;
    private final ValidationService validationService;

    public ValidationController(DatasetResolver datasetResolver, ValidationService validationService) {
        this.datasetResolver = datasetResolver;
        this.validationService = validationService;
    }

    @PostMapping("/run")
    public ValidationReport run(@RequestParam(required = false) String dataDir) {
        ValidationDataset dataset = datasetResolver.load(dataDir);
        return validationService.run(dataset);
    }

    @GetMapping("/summary")
    public DatasetSummary getSummary(@RequestParam(required = false) String dataDir) {
        return datasetResolver.load(dataDir).summarize();
    }
}
