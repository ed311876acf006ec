package org.ogear.solver.model;

import java.util.Objects;

/**
 * Caller-facing step of a solution: where the gear ends up and whether it only rotated.
 */
public record Move(Position destination, boolean rotation) {

    public Move {
        Objects.requireNonNull(destination, "destination");
    }

    /**
     * Projects a transition onto the move a person performs on the puzzle.
     */
    public static Move of(Transition transition) {
        return new Move(transition.target(), transition.isRotation());
    }
}
