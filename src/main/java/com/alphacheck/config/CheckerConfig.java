package com.alphacheck.config;

import com.alphacheck.checker.AlphaSumConsistencyChecker;
import com.alphacheck.checker.CheckerRegistry;
import com.alphacheck.checker.CheckerSettings;
import com.alphacheck.checker.ConservationChecker;
import com.alphacheck.checker.DirectionConsistencyChecker;
import com.alphacheck.checker.NonNegativeSplitChecker;
import com.alphacheck.checker.VolumeRoundingChecker;
import com.alphacheck.domain.enums.SettlementStrategyType;
import com.alphacheck.settlement.SettlementChecker;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link CheckerSettings} bean from application.properties and assembles the
 * checker registry.
 *
 * <p>The registry is composed here, in report order. Adding a checker means adding it to
 * this list; nothing is discovered from the classpath.
 *
 * <p>Properties prefix: {@code alphacheck.checks.*}, {@code alphacheck.settlement.*}
 */
@Configuration
public class CheckerConfig {

    @Bean
    public CheckerSettings checkerSettings(
            @Value("${alphacheck.checks.tolerance:1e-6}") double tolerance,
            @Value("${alphacheck.checks.lot-size:100}") int lotSize,
            @Value("${alphacheck.checks.traders-per-group:2}") Integer tradersPerGroup,
            @Value("${alphacheck.checks.max-detail-rows:5}") int maxDetailRows,
            @Value("${alphacheck.settlement.strategy:AUTO}") SettlementStrategyType settlementStrategy) {
        return CheckerSettings.builder()
                .tolerance(tolerance)
                .lotSize(lotSize)
                .tradersPerGroup(tradersPerGroup)
                .maxDetailRows(maxDetailRows)
                .settlementStrategy(settlementStrategy)
                .build();
    }

    @Bean
    public CheckerRegistry checkerRegistry(CheckerSettings settings) {
        return new CheckerRegistry(List.of(
                new ConservationChecker(settings),
                new AlphaSumConsistencyChecker(settings),
                new NonNegativeSplitChecker(settings),
                new VolumeRoundingChecker(settings),
                new DirectionConsistencyChecker(settings),
                new SettlementChecker(settings)));
    }
}
