package com.alphacheck.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alphacheck.exception.BusinessException;
import com.alphacheck.loader.CsvDatasetLoader;
import com.alphacheck.service.DatasetResolver;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DatasetResolverTest {

    private final CsvDatasetLoader loader = new CsvDatasetLoader();

    @Test
    @DisplayName("Explicit directory wins over the configured default")
    void explicitDirectoryFirst() {
        DatasetResolver resolver = new DatasetResolver(loader, "/configured");

        assertThat(resolver.resolveDirectory(" /requested ")).isEqualTo(Path.of("/requested"));
        assertThat(resolver.resolveDirectory(null)).isEqualTo(Path.of("/configured"));
        assertThat(resolver.resolveDirectory("")).isEqualTo(Path.of("/configured"));
    }

    @Test
    @DisplayName("No directory anywhere is a bad request")
    void noDirectoryConfigured() {
        DatasetResolver resolver = new DatasetResolver(loader, "");

        assertThatThrownBy(() -> resolver.resolveDirectory(null))
                .isInstanceOf(BusinessException.class)
                .hasMessage("No data directory given and alphacheck.data-dir is not configured");
    }
}
