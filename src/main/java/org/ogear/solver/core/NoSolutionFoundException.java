package org.ogear.solver.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.ogear.solver.model.GearState;

/**
 * Raised when the whole reachable state space was explored without meeting the target.
 * This is a valid negative answer, not a malfunction.
 */
@Getter
@Accessors(fluent = true)
public final class NoSolutionFoundException extends GearSolverException {
    private final GearState origin;
    private final GearState target;
    private final int exploredStates;

    public NoSolutionFoundException(GearState origin, GearState target, int exploredStates) {
        super(
                REASON_NO_SOLUTION,
                "no solution found from " + origin + " to " + target
                        + " after exploring " + exploredStates + " states, check the provided initial and target positions"
        );
        this.origin = origin;
        this.target = target;
        this.exploredStates = exploredStates;
    }
}
