package org.ogear.solver.model;

import java.util.Objects;

/**
 * Cube side the gear sits on together with the axis it follows.
 *
 * <p>Any side/axis pair can be represented; whether the pair is a legal gear
 * position is decided by the {@code TransitionTable} lookup.</p>
 */
public record Position(int side, Axis axis) {

    public Position {
        Objects.requireNonNull(axis, "axis");
    }

    /**
     * Shorthand factory used by table literals.
     */
    public static Position of(int side, Axis axis) {
        return new Position(side, axis);
    }

    @Override
    public String toString() {
        return "(" + side + ", " + axis + ")";
    }
}
