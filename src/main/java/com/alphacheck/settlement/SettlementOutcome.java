package com.alphacheck.settlement;

import java.util.List;
import lombok.Getter;

@Getter
public class SettlementOutcome {

    private final List<SettlementViolation> violations;
    private final int targetsChecked;

    public SettlementOutcome(List<SettlementViolation> violations, int targetsChecked) {
        this.violations = List.copyOf(violations);
        this.targetsChecked = targetsChecked;
    }

    public double getTotalExcess() {
        return violations.stream().mapToDouble(SettlementViolation::getExcess).sum();
    }
}
