package org.ogear.solver.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Raised when a search expands more states than its {@link SearchBudget} allows.
 */
@Getter
@Accessors(fluent = true)
public final class SearchBudgetExceededException extends GearSolverException {
    private final int expandedStates;
    private final int maxExpandedStates;

    SearchBudgetExceededException(int expandedStates, int maxExpandedStates) {
        super(
                REASON_SEARCH_BUDGET_EXCEEDED,
                "expanded-state budget exceeded: " + expandedStates + " > " + maxExpandedStates
        );
        this.expandedStates = expandedStates;
        this.maxExpandedStates = maxExpandedStates;
    }
}
