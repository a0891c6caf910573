package com.alphacheck.checker;

import com.alphacheck.domain.enums.SettlementStrategyType;
import lombok.Builder;
import lombok.Getter;

/**
 * Tunables shared by all checkers. Built from {@code alphacheck.checks.*} and
 * {@code alphacheck.settlement.*}.
 *
 * <p>A null {@code tradersPerGroup} disables the allocation-cardinality rule.
 */
@Getter
@Builder
public class CheckerSettings {

    @Builder.Default
    private final double tolerance = 1e-6;

    @Builder.Default
    private final int lotSize = 100;

    @Builder.Default
    private final Integer tradersPerGroup = 2;

    @Builder.Default
    private final int maxDetailRows = 5;

    @Builder.Default
    private final SettlementStrategyType settlementStrategy = SettlementStrategyType.AUTO;

    public static CheckerSettings defaults() {
        return CheckerSettings.builder().build();
    }
}
