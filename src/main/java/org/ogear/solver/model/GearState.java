package org.ogear.solver.model;

import java.util.Objects;

/**
 * Immutable configuration of the gear: where it sits, which tooth is engaged
 * inside the cube and which way it faces.
 *
 * <p>Tooth indices are kept modulo {@link #TOOTH_COUNT}; polarity is +1 when the
 * marked face of the gear points toward the positive direction of its axis and
 * -1 otherwise.</p>
 */
public record GearState(Position position, int tooth, int polarity) {
    public static final int TOOTH_COUNT = 5;

    public GearState {
        Objects.requireNonNull(position, "position");
        if (polarity != 1 && polarity != -1) {
            throw new IllegalArgumentException("polarity must be +1 or -1, got " + polarity);
        }
        tooth = Math.floorMod(tooth, TOOTH_COUNT);
    }

    /**
     * Convenience factory from individual fields.
     */
    public static GearState of(int side, Axis axis, int tooth, int polarity) {
        return new GearState(Position.of(side, axis), tooth, polarity);
    }

    /**
     * Derives the state reached by applying a transition from this state.
     *
     * <p>The tooth delta is oriented by the current polarity before it is applied,
     * since the direction a tooth advances depends on which way the gear faces.</p>
     *
     * @param transition move starting at this state's position.
     * @return next state.
     * @throws IllegalArgumentException when the transition starts elsewhere.
     */
    public GearState apply(Transition transition) {
        Objects.requireNonNull(transition, "transition");
        if (!transition.source().equals(position)) {
            throw new IllegalArgumentException(
                    "transition " + transition + " does not start at " + position
            );
        }
        return new GearState(
                transition.target(),
                tooth + transition.toothDelta() * polarity,
                polarity * transition.polarityMult()
        );
    }

    @Override
    public String toString() {
        return "GearState{side=" + position.side()
                + ", axis=" + position.axis()
                + ", tooth=" + tooth
                + ", polarity=" + (polarity > 0 ? "+1" : "-1")
                + '}';
    }
}
