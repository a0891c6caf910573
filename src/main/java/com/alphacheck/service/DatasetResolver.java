package com.alphacheck.service;

import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.exception.BusinessException;
import com.alphacheck.loader.CsvDatasetLoader;
import java.nio.file.Path;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Resolves the data directory for a request (explicit value first, then
 * {@code alphacheck.data-dir}) and loads it.
 */
@Service
public class DatasetResolver {

    private final CsvDatasetLoader csvDatasetLoader;
    private final String defaultDataDir;

    public DatasetResolver(
            CsvDatasetLoader csvDatasetLoader, @Value("${alphacheck.data-dir:}") String defaultDataDir) {
        this.csvDatasetLoader = csvDatasetLoader;
        this.defaultDataDir = defaultDataDir;
    }

    public Path resolveDirectory(String requested) {
        if (requested != null && !requested.isBlank()) {
            return Path.of(requested.trim());
        }
        if (defaultDataDir != null && !defaultDataDir.isBlank()) {
            return Path.of(defaultDataDir.trim());
        }
        throw new BusinessException("No data directory given and alphacheck.data-dir is not configured");
    }

    public ValidationDataset load(String requested) {
        return csvDatasetLoader.load(resolveDirectory(requested));
    }
}
