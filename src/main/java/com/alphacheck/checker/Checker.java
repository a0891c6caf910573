package com.alphacheck.checker;

import com.alphacheck.domain.model.CheckResult;
import com.alphacheck.domain.model.ValidationDataset;

/**
 * A single independent validation rule over one dataset.
 *
 * <p>Implementations are stateless between runs and must not mutate the dataset; the
 * orchestrator may call several checkers concurrently on the same instance of it.
 * Business-rule breaches are reported through the returned result, never thrown.
 */
public interface Checker {

    String getName();

    CheckResult check(ValidationDataset dataset);
}
