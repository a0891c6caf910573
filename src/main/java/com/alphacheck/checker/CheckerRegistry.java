package com.alphacheck.checker;

import java.util.List;

/**
 * Ordered, explicitly composed list of checkers. Report order follows registration order.
 */
public class CheckerRegistry {

    private final List<Checker> checkers;

    public CheckerRegistry(List<Checker> checkers) {
        this.checkers = List.copyOf(checkers);
    }

    public List<Checker> getCheckers() {
        return checkers;
    }
}
